package com.coshare.application.service;

import com.coshare.application.ports.AddressDeriver;
import com.coshare.application.ports.IdentityStore;
import com.coshare.application.ports.StoreTransaction;
import com.coshare.domain.account.AuthoritySource;
import com.coshare.domain.failure.FailureKind;
import com.coshare.domain.failure.SharedAccountException;
import com.coshare.domain.identity.IdentityId;
import com.coshare.domain.registry.AuditCounters;
import com.coshare.domain.registry.AuditEvent;
import com.coshare.domain.registry.AuditEventKind;
import com.coshare.domain.registry.Registry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Objects;

/**
 * One-time module bootstrap and the audit bookkeeping every other operation goes through.
 *
 * The registry lives at {@code derive(publisher, "coshare::registry")}. Every protocol
 * operation requires it and fails with {@link FailureKind#NOT_INITIALIZED} before it exists.
 */
public final class RegistryService {

    private static final Logger log = LoggerFactory.getLogger(RegistryService.class);

    static final byte[] REGISTRY_SEED = "coshare::registry".getBytes(StandardCharsets.UTF_8);

    private final IdentityStore store;
    private final IdentityId publisher;
    private final IdentityId registryId;
    private final Clock clock;

    public RegistryService(IdentityStore store, AddressDeriver deriver, IdentityId publisher, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.registryId = Objects.requireNonNull(deriver, "deriver").derive(publisher, REGISTRY_SEED.clone());
    }

    /**
     * Creates the module identity and its registry with all counters at zero.
     *
     * @throws IllegalArgumentException if {@code installer} is not the module publisher
     * @throws SharedAccountException   {@code ALREADY_INITIALIZED}
     */
    public IdentityId initialize(IdentityId installer) {
        Objects.requireNonNull(installer, "installer");
        if (!installer.equals(publisher)) {
            throw new IllegalArgumentException("Installer " + installer + " is not the module publisher");
        }

        try {
            store.inTransaction(tx -> {
                if (tx.exists(registryId)) {
                    throw SharedAccountException.of(FailureKind.ALREADY_INITIALIZED,
                            "Registry already initialized at " + registryId);
                }
                AuthoritySource source = tx.createIdentity(registryId);
                tx.create(registryId, Registry.install(registryId, source));
                tx.afterCommit(() -> log.info("[REGISTRY] initialized registry={} installer={}", registryId, installer));
                return registryId;
            });
        } catch (SharedAccountException e) {
            log.debug("[REGISTRY] rejected initialize installer={} kind={}", installer, e.kind());
            throw e;
        }

        return registryId;
    }

    public IdentityId registryId() {
        return registryId;
    }

    public IdentityId publisher() {
        return publisher;
    }

    public boolean isInitialized() {
        return store.inTransaction(tx -> tx.contains(registryId, Registry.class));
    }

    /**
     * @throws SharedAccountException {@code NOT_INITIALIZED}
     */
    public AuditCounters counters() {
        return store.inTransaction(tx -> requireRegistry(tx).counters());
    }

    Registry requireRegistry(StoreTransaction tx) {
        return tx.find(registryId, Registry.class)
                .orElseThrow(() -> SharedAccountException.of(FailureKind.NOT_INITIALIZED,
                        "Registry not initialized at " + registryId));
    }

    /**
     * Bumps the counter of {@code kind} and stages the matching audit event in the same unit of work.
     */
    void record(StoreTransaction tx, AuditEventKind kind, IdentityId actor, IdentityId subject, IdentityId target) {
        Registry next = requireRegistry(tx).withRecorded(kind);
        tx.update(registryId, next);
        tx.emit(new AuditEvent(next.count(kind), kind, actor, subject, target, clock.instant()));
    }
}
