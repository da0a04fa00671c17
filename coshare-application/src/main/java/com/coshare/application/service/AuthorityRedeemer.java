package com.coshare.application.service;

import com.coshare.application.ports.IdentityStore;
import com.coshare.domain.account.Capability;
import com.coshare.domain.account.DelegatedAuthority;
import com.coshare.domain.account.SharedAccount;
import com.coshare.domain.failure.FailureKind;
import com.coshare.domain.failure.SharedAccountException;
import com.coshare.domain.identity.IdentityId;
import com.coshare.domain.registry.AuditEventKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Function;

/**
 * Consumes a {@link Capability} and yields one-time authority over its shared account.
 *
 * The authority is only live inside the unit of work that redeemed it. Work that needs
 * to act as the shared account passes it to {@link #acquireAuthority(IdentityId, IdentityId, Function)};
 * if that work throws, the redemption is rolled back and the capability stays redeemable.
 */
public final class AuthorityRedeemer {

    private static final Logger log = LoggerFactory.getLogger(AuthorityRedeemer.class);

    private final IdentityStore store;
    private final RegistryService registry;

    public AuthorityRedeemer(IdentityStore store, RegistryService registry) {
        this.store = Objects.requireNonNull(store, "store");
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * Redeems and returns the proof. The returned proof has already expired; it only
     * tells the caller which identity it was issued for.
     *
     * @throws SharedAccountException {@code NO_CAPABILITY}, {@code WRONG_TARGET}, {@code NOT_FOUND}
     */
    public DelegatedAuthority acquireAuthority(IdentityId acquirer, IdentityId target) {
        return acquireAuthority(acquirer, target, Function.identity());
    }

    /**
     * Redeems and runs {@code work} with the live proof inside the same unit of work.
     *
     * @throws SharedAccountException {@code NO_CAPABILITY}, {@code WRONG_TARGET}, {@code NOT_FOUND}
     */
    public <T> T acquireAuthority(IdentityId acquirer, IdentityId target, Function<DelegatedAuthority, T> work) {
        Objects.requireNonNull(acquirer, "acquirer");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(work, "work");

        T result;
        try {
            result = store.inTransaction(tx -> {
                registry.requireRegistry(tx);
                Capability held = tx.find(acquirer, Capability.class)
                        .orElseThrow(() -> SharedAccountException.of(FailureKind.NO_CAPABILITY,
                                acquirer + " holds no capability"));
                if (!held.authorizes(target)) {
                    throw SharedAccountException.of(FailureKind.WRONG_TARGET,
                            "Capability of " + acquirer + " is for " + held.target() + ", not " + target);
                }
                SharedAccount account = Lookups.requireSharedAccount(tx, target);

                tx.remove(acquirer, Capability.class);
                DelegatedAuthority authority = account.authoritySource().delegate(tx.authorityScope());
                registry.record(tx, AuditEventKind.REDEEM, acquirer, acquirer, target);
                tx.afterCommit(() -> log.info("[AUTHORITY] redeemed acquirer={} target={}", acquirer, target));
                return work.apply(authority);
            });
        } catch (SharedAccountException e) {
            log.debug("[AUTHORITY] rejected acquire acquirer={} target={} kind={}", acquirer, target, e.kind());
            throw e;
        }

        return result;
    }
}
