package com.coshare.application.service;

import com.coshare.application.ports.AddressDeriver;
import com.coshare.application.ports.IdentityStore;
import com.coshare.domain.account.AuthoritySource;
import com.coshare.domain.account.Management;
import com.coshare.domain.account.SharedAccount;
import com.coshare.domain.failure.FailureKind;
import com.coshare.domain.failure.SharedAccountException;
import com.coshare.domain.identity.IdentityId;
import com.coshare.domain.registry.AuditEventKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Creates shared accounts at {@code derive(creator, seed)} with the creator as administrator.
 */
public final class SharedAccountFactory {

    private static final Logger log = LoggerFactory.getLogger(SharedAccountFactory.class);

    private final IdentityStore store;
    private final AddressDeriver deriver;
    private final RegistryService registry;

    public SharedAccountFactory(IdentityStore store, AddressDeriver deriver, RegistryService registry) {
        this.store = Objects.requireNonNull(store, "store");
        this.deriver = Objects.requireNonNull(deriver, "deriver");
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * @return identity of the new shared account
     * @throws SharedAccountException {@code NOT_INITIALIZED}, {@code ALREADY_EXISTS}
     */
    public IdentityId createSharedAccount(IdentityId creator, byte[] seed) {
        Objects.requireNonNull(creator, "creator");
        Objects.requireNonNull(seed, "seed");
        IdentityId target = deriver.derive(creator, seed.clone());

        try {
            store.inTransaction(tx -> {
                registry.requireRegistry(tx);
                if (tx.exists(target)) {
                    throw SharedAccountException.of(FailureKind.ALREADY_EXISTS, "Identity already exists: " + target);
                }

                AuthoritySource source = tx.createIdentity(target);
                tx.create(target, new SharedAccount(source));
                tx.create(target, Management.administeredBy(creator));
                registry.record(tx, AuditEventKind.CREATION, creator, null, target);
                tx.afterCommit(() -> log.info("[ACCOUNT] created target={} admin={}", target, creator));
                return target;
            });
        } catch (SharedAccountException e) {
            log.debug("[ACCOUNT] rejected create creator={} target={} kind={}", creator, target, e.kind());
            throw e;
        }

        return target;
    }
}
