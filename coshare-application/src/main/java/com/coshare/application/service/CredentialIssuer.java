package com.coshare.application.service;

import com.coshare.application.ports.IdentityStore;
import com.coshare.domain.account.Capability;
import com.coshare.domain.account.Management;
import com.coshare.domain.failure.FailureKind;
import com.coshare.domain.failure.SharedAccountException;
import com.coshare.domain.identity.IdentityId;
import com.coshare.domain.registry.AuditEventKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Turns allow-list membership into a {@link Capability} deposited at the claimer.
 *
 * A principal holds at most one live capability across all shared accounts: while one
 * is outstanding, every further claim fails, whichever account it targets.
 */
public final class CredentialIssuer {

    private static final Logger log = LoggerFactory.getLogger(CredentialIssuer.class);

    private final IdentityStore store;
    private final RegistryService registry;

    public CredentialIssuer(IdentityStore store, RegistryService registry) {
        this.store = Objects.requireNonNull(store, "store");
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * @throws SharedAccountException {@code NOT_FOUND}, {@code NOT_LISTED}, {@code ALREADY_HOLDING_CAPABILITY}
     */
    public void claimCapability(IdentityId claimer, IdentityId target) {
        Objects.requireNonNull(claimer, "claimer");
        Objects.requireNonNull(target, "target");

        try {
            store.inTransaction(tx -> {
                registry.requireRegistry(tx);
                Management m = Lookups.requireManagement(tx, target);
                if (!m.isListed(claimer)) {
                    throw SharedAccountException.of(FailureKind.NOT_LISTED,
                            claimer + " is not listed for " + target);
                }
                if (tx.contains(claimer, Capability.class)) {
                    throw SharedAccountException.of(FailureKind.ALREADY_HOLDING_CAPABILITY,
                            claimer + " already holds a capability");
                }

                tx.update(target, m.withoutClaimer(claimer));
                tx.create(claimer, Capability.forTarget(target));
                registry.record(tx, AuditEventKind.CLAIM, claimer, claimer, target);
                tx.afterCommit(() -> log.info("[CAPABILITY] claimed claimer={} target={}", claimer, target));
                return null;
            });
        } catch (SharedAccountException e) {
            log.debug("[CAPABILITY] rejected claim claimer={} target={} kind={}", claimer, target, e.kind());
            throw e;
        }
    }
}
