package com.coshare.application.service;

import com.coshare.application.ports.AddressDeriver;
import com.coshare.application.ports.IdentityStore;
import com.coshare.domain.identity.IdentityId;

import java.time.Clock;
import java.util.Objects;

/**
 * Wires the protocol services over one store, one deriver and one publisher.
 * Used by the API wiring and by tests; callers never see half-wired services.
 */
public final class SharedAccountModule {

    private final RegistryService registry;
    private final SharedAccountFactory factory;
    private final AllowListManager allowList;
    private final CredentialIssuer issuer;
    private final AuthorityRedeemer redeemer;
    private final SharedAccountQueries queries;

    private SharedAccountModule(IdentityStore store, AddressDeriver deriver, IdentityId publisher, Clock clock) {
        this.registry = new RegistryService(store, deriver, publisher, clock);
        this.factory = new SharedAccountFactory(store, deriver, registry);
        this.allowList = new AllowListManager(store, registry);
        this.issuer = new CredentialIssuer(store, registry);
        this.redeemer = new AuthorityRedeemer(store, registry);
        this.queries = new SharedAccountQueries(store);
    }

    public static SharedAccountModule create(IdentityStore store, AddressDeriver deriver, IdentityId publisher) {
        return create(store, deriver, publisher, Clock.systemUTC());
    }

    public static SharedAccountModule create(IdentityStore store,
                                             AddressDeriver deriver,
                                             IdentityId publisher,
                                             Clock clock) {
        Objects.requireNonNull(store, "store");
        Objects.requireNonNull(deriver, "deriver");
        Objects.requireNonNull(publisher, "publisher");
        Objects.requireNonNull(clock, "clock");
        return new SharedAccountModule(store, deriver, publisher, clock);
    }

    public RegistryService registry() { return registry; }
    public SharedAccountFactory factory() { return factory; }
    public AllowListManager allowList() { return allowList; }
    public CredentialIssuer issuer() { return issuer; }
    public AuthorityRedeemer redeemer() { return redeemer; }
    public SharedAccountQueries queries() { return queries; }
}
