package com.coshare.domain.account;

import com.coshare.domain.identity.IdentityId;

/**
 * Ephemeral proof of the right to act as {@link #identity()}.
 *
 * Obtained only by redeeming a {@link Capability}. It is never persisted and expires
 * together with the unit of work that redeemed it.
 */
public final class DelegatedAuthority {

    private final IdentityId identity;
    private final AuthorityScope scope;

    DelegatedAuthority(IdentityId identity, AuthorityScope scope) {
        this.identity = identity;
        this.scope = scope;
    }

    /** Identity this proof was issued for. Readable after expiry. */
    public IdentityId identity() {
        return identity;
    }

    public boolean isActive() {
        return scope.isOpen();
    }

    /**
     * @throws IllegalStateException if the unit of work that redeemed this proof has ended
     */
    public void checkActive() {
        if (!scope.isOpen()) {
            throw new IllegalStateException("Delegated authority for " + identity + " has expired");
        }
    }

    /**
     * Asserts the proof is live and speaks for {@code expected}.
     */
    public void checkActingAs(IdentityId expected) {
        checkActive();
        if (!identity.equals(expected)) {
            throw new IllegalStateException("Authority is for " + identity + ", not " + expected);
        }
    }

    @Override
    public String toString() {
        return "DelegatedAuthority[" + identity.shortForm() + (isActive() ? ", active" : ", expired") + "]";
    }
}
