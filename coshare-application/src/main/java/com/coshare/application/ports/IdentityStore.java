package com.coshare.application.ports;

/**
 * Keyed store mapping identities to typed records (at most one record per type per identity).
 *
 * All reads and writes happen inside a unit of work. A unit of work either commits every
 * staged write and audit event, or, when {@code work} throws, leaves no trace at all.
 * Units of work are serialized; a unit of work started while another is running on the
 * same thread joins it.
 */
public interface IdentityStore {

    <T> T inTransaction(UnitOfWork<T> work);

    @FunctionalInterface
    interface UnitOfWork<T> {
        T run(StoreTransaction tx);
    }
}
