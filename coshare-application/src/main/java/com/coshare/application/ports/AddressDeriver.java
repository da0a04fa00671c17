package com.coshare.application.ports;

import com.coshare.domain.identity.IdentityId;

/**
 * Deterministic, collision-resistant derivation of child identities.
 *
 * Distinct {@code (parent, seed)} pairs must never yield the same identity.
 * Implementations live in infrastructure.
 */
@FunctionalInterface
public interface AddressDeriver {

    IdentityId derive(IdentityId parent, byte[] seed);
}
