package com.coshare.application.service;

import com.coshare.application.ports.IdentityStore;
import com.coshare.domain.account.Capability;
import com.coshare.domain.account.Management;
import com.coshare.domain.account.SharedAccount;
import com.coshare.domain.identity.IdentityId;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only views over committed state. None of these emit audit events.
 */
public final class SharedAccountQueries {

    private final IdentityStore store;

    public SharedAccountQueries(IdentityStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    /** @throws com.coshare.domain.failure.SharedAccountException {@code NOT_FOUND} */
    public IdentityId admin(IdentityId target) {
        Objects.requireNonNull(target, "target");
        return store.inTransaction(tx -> Lookups.requireManagement(tx, target).admin());
    }

    /** Allow-list in insertion order. */
    public List<IdentityId> unclaimed(IdentityId target) {
        Objects.requireNonNull(target, "target");
        return store.inTransaction(tx -> Lookups.requireManagement(tx, target).unclaimed());
    }

    public boolean isListed(IdentityId target, IdentityId principal) {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(principal, "principal");
        return store.inTransaction(tx -> tx.find(target, Management.class)
                .map(m -> m.isListed(principal))
                .orElse(false));
    }

    /** Target of the capability {@code principal} currently holds, if any. */
    public Optional<IdentityId> heldCapability(IdentityId principal) {
        Objects.requireNonNull(principal, "principal");
        return store.inTransaction(tx -> tx.find(principal, Capability.class).map(Capability::target));
    }

    public boolean isSharedAccount(IdentityId id) {
        Objects.requireNonNull(id, "id");
        return store.inTransaction(tx -> tx.contains(id, SharedAccount.class));
    }
}
