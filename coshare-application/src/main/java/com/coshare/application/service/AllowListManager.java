package com.coshare.application.service;

import com.coshare.application.ports.IdentityStore;
import com.coshare.application.ports.StoreTransaction;
import com.coshare.domain.account.Management;
import com.coshare.domain.failure.FailureKind;
import com.coshare.domain.failure.SharedAccountException;
import com.coshare.domain.identity.IdentityId;
import com.coshare.domain.registry.AuditEventKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Administrator-gated edits of a shared account's allow-list.
 *
 * Guard order for both operations: registry, Management present, caller is admin,
 * then membership.
 */
public final class AllowListManager {

    private static final Logger log = LoggerFactory.getLogger(AllowListManager.class);

    private final IdentityStore store;
    private final RegistryService registry;

    public AllowListManager(IdentityStore store, RegistryService registry) {
        this.store = Objects.requireNonNull(store, "store");
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * Appends {@code claimer} to the end of the allow-list. An administrator may list itself.
     *
     * @throws SharedAccountException {@code NOT_FOUND}, {@code NOT_ADMIN}, {@code ALREADY_LISTED}
     */
    public void addClaimer(IdentityId admin, IdentityId target, IdentityId claimer) {
        Objects.requireNonNull(admin, "admin");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(claimer, "claimer");

        try {
            store.inTransaction(tx -> {
                Management m = requireAdministered(tx, admin, target);
                if (m.isListed(claimer)) {
                    throw SharedAccountException.of(FailureKind.ALREADY_LISTED,
                            claimer + " is already listed for " + target);
                }
                tx.update(target, m.withClaimer(claimer));
                registry.record(tx, AuditEventKind.ALLOW_ADD, admin, claimer, target);
                tx.afterCommit(() -> log.info("[ALLOWLIST] added target={} claimer={}", target, claimer));
                return null;
            });
        } catch (SharedAccountException e) {
            log.debug("[ALLOWLIST] rejected add admin={} target={} claimer={} kind={}", admin, target, claimer, e.kind());
            throw e;
        }
    }

    /**
     * Removes {@code claimer}, preserving the order of the remaining entries.
     *
     * @throws SharedAccountException {@code NOT_FOUND}, {@code NOT_ADMIN}, {@code NOT_LISTED}
     */
    public void removeClaimer(IdentityId admin, IdentityId target, IdentityId claimer) {
        Objects.requireNonNull(admin, "admin");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(claimer, "claimer");

        try {
            store.inTransaction(tx -> {
                Management m = requireAdministered(tx, admin, target);
                if (!m.isListed(claimer)) {
                    throw SharedAccountException.of(FailureKind.NOT_LISTED,
                            claimer + " is not listed for " + target);
                }
                tx.update(target, m.withoutClaimer(claimer));
                registry.record(tx, AuditEventKind.ALLOW_REMOVE, admin, claimer, target);
                tx.afterCommit(() -> log.info("[ALLOWLIST] removed target={} claimer={}", target, claimer));
                return null;
            });
        } catch (SharedAccountException e) {
            log.debug("[ALLOWLIST] rejected remove admin={} target={} claimer={} kind={}", admin, target, claimer, e.kind());
            throw e;
        }
    }

    private Management requireAdministered(StoreTransaction tx, IdentityId admin, IdentityId target) {
        registry.requireRegistry(tx);
        Management m = Lookups.requireManagement(tx, target);
        if (!m.isAdmin(admin)) {
            throw SharedAccountException.of(FailureKind.NOT_ADMIN, admin + " does not administer " + target);
        }
        return m;
    }
}
