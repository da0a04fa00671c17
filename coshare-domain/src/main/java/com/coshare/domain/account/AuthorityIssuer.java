package com.coshare.domain.account;

import com.coshare.domain.identity.IdentityId;

import java.util.Objects;

/**
 * Key that binds authority sources to the identity store that created them.
 *
 * Each store adapter holds its own issuer privately. A source only delegates inside a scope
 * opened by the same issuer, so a proof can only be minted within one of that store's units of work.
 */
public final class AuthorityIssuer {

    /** Called once per identity created by the owning store. */
    public AuthoritySource issue(IdentityId identity) {
        return new AuthoritySource(Objects.requireNonNull(identity, "identity"), this);
    }

    /** Called once per unit of work; the store closes the scope when the unit ends. */
    public AuthorityScope openScope() {
        return new AuthorityScope(this);
    }
}
