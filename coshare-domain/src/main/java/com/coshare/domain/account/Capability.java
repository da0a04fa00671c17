package com.coshare.domain.account;

import com.coshare.domain.identity.IdentityId;
import com.coshare.domain.identity.IdentityRecord;

import java.util.Objects;

/**
 * Single-use, non-transferable entitlement to one redemption of authority over {@link #target()}.
 *
 * Lives at the claiming principal's identity until it is moved out and consumed.
 * Instances have identity semantics: there is no copy, equality or clone.
 */
public final class Capability implements IdentityRecord {

    private final IdentityId target;

    private Capability(IdentityId target) {
        this.target = target;
    }

    public static Capability forTarget(IdentityId target) {
        return new Capability(Objects.requireNonNull(target, "target"));
    }

    public IdentityId target() {
        return target;
    }

    public boolean authorizes(IdentityId requested) {
        return target.equals(requested);
    }

    @Override
    public String toString() {
        return "Capability[target=" + target.shortForm() + "]";
    }
}
