package com.coshare.application.service;

import com.coshare.application.ports.StoreTransaction;
import com.coshare.domain.account.Management;
import com.coshare.domain.account.SharedAccount;
import com.coshare.domain.failure.FailureKind;
import com.coshare.domain.failure.SharedAccountException;
import com.coshare.domain.identity.IdentityId;

final class Lookups {

    private Lookups() {}

    static Management requireManagement(StoreTransaction tx, IdentityId target) {
        return tx.find(target, Management.class)
                .orElseThrow(() -> SharedAccountException.of(FailureKind.NOT_FOUND,
                        "No shared account management at " + target));
    }

    static SharedAccount requireSharedAccount(StoreTransaction tx, IdentityId target) {
        return tx.find(target, SharedAccount.class)
                .orElseThrow(() -> SharedAccountException.of(FailureKind.NOT_FOUND,
                        "No shared account at " + target));
    }
}
