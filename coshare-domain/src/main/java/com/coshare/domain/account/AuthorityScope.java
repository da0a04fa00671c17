package com.coshare.domain.account;

/**
 * Lifetime of a unit of work. Delegated authority minted inside a scope is only usable while it is open.
 *
 * Scopes are opened by an {@link AuthorityIssuer} and closed exactly once.
 */
public final class AuthorityScope {

    private final AuthorityIssuer issuer;
    private volatile boolean open = true;

    AuthorityScope(AuthorityIssuer issuer) {
        this.issuer = issuer;
    }

    public boolean isOpen() {
        return open;
    }

    public void close() {
        open = false;
    }

    boolean openedBy(AuthorityIssuer candidate) {
        return issuer == candidate;
    }
}
