package com.coshare.application.ports;

import com.coshare.domain.account.AuthorityScope;
import com.coshare.domain.account.AuthoritySource;
import com.coshare.domain.identity.IdentityId;
import com.coshare.domain.identity.IdentityRecord;
import com.coshare.domain.registry.AuditEvent;

import java.util.Optional;

/**
 * View of the identity store inside one unit of work.
 *
 * Structural misuse (creating over an existing record, updating a missing one) is a
 * programming error and raises {@link IllegalStateException}; callers check their own
 * guards first.
 */
public interface StoreTransaction {

    /** False once the unit of work has committed or rolled back. */
    boolean isOpen();

    /**
     * Scope of this unit of work, opened by the same issuer as every authority source this
     * store hands out. Delegated authority minted in it expires when the unit ends.
     */
    AuthorityScope authorityScope();

    /** True if the identity was created or holds any record. */
    boolean exists(IdentityId id);

    /**
     * Registers a new identity and returns its authority source, bound to this store.
     *
     * @throws IllegalStateException if the identity already exists
     */
    AuthoritySource createIdentity(IdentityId id);

    <R extends IdentityRecord> Optional<R> find(IdentityId id, Class<R> type);

    default boolean contains(IdentityId id, Class<? extends IdentityRecord> type) {
        return find(id, type).isPresent();
    }

    /** @throws IllegalStateException if a record of the same type is already there */
    void create(IdentityId id, IdentityRecord record);

    /** @throws IllegalStateException if no record of the same type is there */
    void update(IdentityId id, IdentityRecord record);

    /** Moves the record out of its slot. */
    <R extends IdentityRecord> Optional<R> remove(IdentityId id, Class<R> type);

    /** Stages an audit event; it reaches the sink only if the unit of work commits. */
    void emit(AuditEvent event);

    /**
     * Runs {@code action} once the outermost unit of work has committed and its audit events
     * are published. Dropped on rollback.
     */
    void afterCommit(Runnable action);
}
