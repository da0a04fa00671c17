package com.coshare.domain.identity;

/**
 * Marker for record types the identity store can hold.
 * The store keeps at most one record of each concrete type per identity.
 */
public interface IdentityRecord {
}
