package com.coshare.application.ports.impl;

import com.coshare.application.ports.AuditSink;
import com.coshare.application.ports.IdentityStore;
import com.coshare.application.ports.StoreTransaction;
import com.coshare.domain.account.AuthorityIssuer;
import com.coshare.domain.account.AuthorityScope;
import com.coshare.domain.account.AuthoritySource;
import com.coshare.domain.identity.IdentityId;
import com.coshare.domain.identity.IdentityRecord;
import com.coshare.domain.registry.AuditEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-local identity store. Replace with a durable implementation in infrastructure.
 *
 * One fair lock serializes units of work. Writes are staged in a transaction-local overlay
 * and applied only when the work returns normally; audit events are published after the
 * apply, still under the lock, so sinks see them in commit order.
 */
public final class InMemoryIdentityStore implements IdentityStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryIdentityStore.class);

    public static final Duration DEFAULT_LOCK_TIMEOUT = Duration.ofSeconds(5);

    private final AuthorityIssuer issuer = new AuthorityIssuer();
    private final ReentrantLock lock = new ReentrantLock(true);
    private final Map<IdentityId, Map<Class<? extends IdentityRecord>, IdentityRecord>> records = new HashMap<>();
    private final Set<IdentityId> identities = new HashSet<>();
    private final ThreadLocal<Transaction> current = new ThreadLocal<>();

    private final AuditSink auditSink;
    private final Duration lockTimeout;

    public InMemoryIdentityStore(AuditSink auditSink) {
        this(auditSink, DEFAULT_LOCK_TIMEOUT);
    }

    public InMemoryIdentityStore(AuditSink auditSink, Duration lockTimeout) {
        this.auditSink = Objects.requireNonNull(auditSink, "auditSink");
        this.lockTimeout = Objects.requireNonNull(lockTimeout, "lockTimeout");
        if (lockTimeout.isNegative() || lockTimeout.isZero()) {
            throw new IllegalArgumentException("lockTimeout must be positive: " + lockTimeout);
        }
    }

    @Override
    public <T> T inTransaction(UnitOfWork<T> work) {
        Objects.requireNonNull(work, "work");

        Transaction joined = current.get();
        if (joined != null) {
            return work.run(joined);
        }

        acquire();
        Transaction tx = new Transaction();
        current.set(tx);
        try {
            T result = work.run(tx);
            publish(tx.commit());
            runCallbacks(tx.callbacks);
            return result;
        } finally {
            tx.close();
            current.remove();
            lock.unlock();
        }
    }

    private void acquire() {
        try {
            if (!lock.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new IllegalStateException("Identity store busy: no lock within " + lockTimeout.toMillis() + "ms");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for identity store", e);
        }
    }

    private void publish(List<AuditEvent> events) {
        for (AuditEvent e : events) {
            try {
                auditSink.publish(e);
            } catch (RuntimeException ex) {
                // state is already committed; a sink outage must not undo it
                log.warn("[STORE] audit sink rejected kind={} seq={} target={}", e.kind(), e.sequence(), e.target(), ex);
            }
        }
    }

    private void runCallbacks(List<Runnable> callbacks) {
        for (Runnable r : callbacks) {
            try {
                r.run();
            } catch (RuntimeException ex) {
                log.warn("[STORE] after-commit callback failed", ex);
            }
        }
    }

    private final class Transaction implements StoreTransaction {

        private final Map<IdentityId, Map<Class<? extends IdentityRecord>, Optional<IdentityRecord>>> staged = new HashMap<>();
        private final Set<IdentityId> createdIdentities = new HashSet<>();
        private final List<AuditEvent> events = new ArrayList<>();
        private final List<Runnable> callbacks = new ArrayList<>();
        private final AuthorityScope scope = issuer.openScope();

        @Override
        public boolean isOpen() {
            return scope.isOpen();
        }

        @Override
        public AuthorityScope authorityScope() {
            ensureOpen();
            return scope;
        }

        @Override
        public boolean exists(IdentityId id) {
            ensureOpen();
            if (identities.contains(id) || createdIdentities.contains(id)) return true;

            Map<Class<? extends IdentityRecord>, Optional<IdentityRecord>> overlay = staged.getOrDefault(id, Map.of());
            for (Optional<IdentityRecord> slot : overlay.values()) {
                if (slot.isPresent()) return true;
            }
            for (Class<? extends IdentityRecord> type : records.getOrDefault(id, Map.of()).keySet()) {
                if (!overlay.containsKey(type)) return true;
            }
            return false;
        }

        @Override
        public AuthoritySource createIdentity(IdentityId id) {
            Objects.requireNonNull(id, "id");
            if (exists(id)) {
                throw new IllegalStateException("Identity already exists: " + id);
            }
            createdIdentities.add(id);
            return issuer.issue(id);
        }

        @Override
        public <R extends IdentityRecord> Optional<R> find(IdentityId id, Class<R> type) {
            ensureOpen();
            return lookup(id, type).map(type::cast);
        }

        @Override
        public void create(IdentityId id, IdentityRecord record) {
            Objects.requireNonNull(record, "record");
            Class<? extends IdentityRecord> type = record.getClass();
            ensureOpen();
            if (lookup(id, type).isPresent()) {
                throw new IllegalStateException(type.getSimpleName() + " already present at " + id);
            }
            stage(id, type, Optional.of(record));
        }

        @Override
        public void update(IdentityId id, IdentityRecord record) {
            Objects.requireNonNull(record, "record");
            Class<? extends IdentityRecord> type = record.getClass();
            ensureOpen();
            if (lookup(id, type).isEmpty()) {
                throw new IllegalStateException(type.getSimpleName() + " missing at " + id);
            }
            stage(id, type, Optional.of(record));
        }

        @Override
        public <R extends IdentityRecord> Optional<R> remove(IdentityId id, Class<R> type) {
            ensureOpen();
            Optional<IdentityRecord> existing = lookup(id, type);
            existing.ifPresent(r -> stage(id, type, Optional.empty()));
            return existing.map(type::cast);
        }

        @Override
        public void emit(AuditEvent event) {
            ensureOpen();
            events.add(Objects.requireNonNull(event, "event"));
        }

        @Override
        public void afterCommit(Runnable action) {
            ensureOpen();
            callbacks.add(Objects.requireNonNull(action, "action"));
        }

        private Optional<IdentityRecord> lookup(IdentityId id, Class<? extends IdentityRecord> type) {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(type, "type");
            Map<Class<? extends IdentityRecord>, Optional<IdentityRecord>> overlay = staged.get(id);
            if (overlay != null && overlay.containsKey(type)) {
                return overlay.get(type);
            }
            return Optional.ofNullable(records.getOrDefault(id, Map.of()).get(type));
        }

        private void stage(IdentityId id, Class<? extends IdentityRecord> type, Optional<IdentityRecord> slot) {
            staged.computeIfAbsent(id, k -> new HashMap<>()).put(type, slot);
        }

        private List<AuditEvent> commit() {
            identities.addAll(createdIdentities);
            for (Map.Entry<IdentityId, Map<Class<? extends IdentityRecord>, Optional<IdentityRecord>>> e : staged.entrySet()) {
                Map<Class<? extends IdentityRecord>, IdentityRecord> slots =
                        records.computeIfAbsent(e.getKey(), k -> new HashMap<>());
                for (Map.Entry<Class<? extends IdentityRecord>, Optional<IdentityRecord>> s : e.getValue().entrySet()) {
                    if (s.getValue().isPresent()) {
                        slots.put(s.getKey(), s.getValue().get());
                    } else {
                        slots.remove(s.getKey());
                    }
                }
                if (slots.isEmpty()) records.remove(e.getKey());
            }
            return List.copyOf(events);
        }

        private void close() {
            scope.close();
        }

        private void ensureOpen() {
            if (!scope.isOpen()) throw new IllegalStateException("Unit of work already finished");
        }
    }
}
