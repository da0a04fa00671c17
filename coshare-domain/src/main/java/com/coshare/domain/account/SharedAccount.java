package com.coshare.domain.account;

import com.coshare.domain.identity.IdentityRecord;

import java.util.Objects;

/**
 * Marks an identity as a shared account and holds its authority source. Immutable once created.
 */
public record SharedAccount(AuthoritySource authoritySource) implements IdentityRecord {
    public SharedAccount {
        Objects.requireNonNull(authoritySource, "authoritySource");
    }
}
