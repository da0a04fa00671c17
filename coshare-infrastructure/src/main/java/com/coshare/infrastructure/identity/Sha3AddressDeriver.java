package com.coshare.infrastructure.identity;

import com.coshare.application.ports.AddressDeriver;
import com.coshare.domain.identity.IdentityId;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Objects;

/**
 * Derived-account addresses: {@code SHA3-256(parent || seed || 0xFF)}.
 *
 * The trailing scheme byte keeps derived addresses out of the space of any other
 * address scheme that hashes the same prefix.
 */
public final class Sha3AddressDeriver implements AddressDeriver {

    public static final byte DERIVED_SCHEME = (byte) 0xFF;

    private static final String ALGORITHM = "SHA3-256";

    public Sha3AddressDeriver() {
        // fail at wiring time, not on first derivation
        newDigest();
    }

    @Override
    public IdentityId derive(IdentityId parent, byte[] seed) {
        Objects.requireNonNull(parent, "parent");
        Objects.requireNonNull(seed, "seed");

        MessageDigest md = newDigest();
        md.update(parent.bytes());
        md.update(seed);
        md.update(DERIVED_SCHEME);
        return IdentityId.of(md.digest());
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " not available in this JVM", e);
        }
    }
}
