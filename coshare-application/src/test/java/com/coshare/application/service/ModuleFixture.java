package com.coshare.application.service;

import com.coshare.application.ports.impl.InMemoryAuditSink;
import com.coshare.application.ports.impl.InMemoryIdentityStore;
import com.coshare.domain.identity.IdentityId;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * Fresh in-memory module with an initialized registry.
 */
final class ModuleFixture {

    static final IdentityId PUBLISHER = IdentityId.parse("0xc0ffee");
    static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    final InMemoryAuditSink audit = new InMemoryAuditSink();
    final InMemoryIdentityStore store = new InMemoryIdentityStore(audit);
    final SequentialAddressDeriver deriver = new SequentialAddressDeriver();
    final SharedAccountModule module =
            SharedAccountModule.create(store, deriver, PUBLISHER, Clock.fixed(NOW, ZoneOffset.UTC));

    static ModuleFixture initialized() {
        ModuleFixture f = new ModuleFixture();
        f.module.registry().initialize(PUBLISHER);
        return f;
    }

    static ModuleFixture uninitialized() {
        return new ModuleFixture();
    }

    static IdentityId id(String hex) {
        return IdentityId.parse(hex);
    }

    static byte[] seed(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    IdentityId createAccount(IdentityId admin, String seed) {
        return module.factory().createSharedAccount(admin, seed(seed));
    }
}
