package com.coshare.domain.account;

import com.coshare.domain.identity.IdentityId;

import java.util.Objects;

/**
 * Opaque source of delegated authority for one identity.
 *
 * Issued through the identity store's {@link AuthorityIssuer} when the identity is created
 * and kept inside that identity's own records (the registry or a shared account).
 */
public final class AuthoritySource {

    private final IdentityId identity;
    private final AuthorityIssuer issuer;

    AuthoritySource(IdentityId identity, AuthorityIssuer issuer) {
        this.identity = identity;
        this.issuer = issuer;
    }

    public IdentityId identity() {
        return identity;
    }

    /**
     * Mints a one-time proof of authority that is usable only while {@code scope} stays open.
     *
     * @throws IllegalArgumentException if {@code scope} was not opened by the issuer of this source
     * @throws IllegalStateException    if {@code scope} is already closed
     */
    public DelegatedAuthority delegate(AuthorityScope scope) {
        Objects.requireNonNull(scope, "scope");
        if (!scope.openedBy(issuer)) {
            throw new IllegalArgumentException("Scope was not opened by the store that issued " + identity);
        }
        if (!scope.isOpen()) {
            throw new IllegalStateException("Cannot delegate authority outside an open unit of work");
        }
        return new DelegatedAuthority(identity, scope);
    }

    @Override
    public String toString() {
        return "AuthoritySource[" + identity.shortForm() + "]";
    }
}
