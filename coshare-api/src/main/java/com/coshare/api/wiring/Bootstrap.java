package com.coshare.api.wiring;

import com.coshare.application.config.ConfigKey;
import com.coshare.application.config.ConfigValidator;
import com.coshare.application.ports.AuditSink;
import com.coshare.application.ports.ConfigPort;
import com.coshare.application.ports.impl.InMemoryIdentityStore;
import com.coshare.application.service.SharedAccountModule;
import com.coshare.domain.identity.IdentityId;
import com.coshare.infrastructure.identity.Sha3AddressDeriver;

import java.time.Duration;

public final class Bootstrap {

  private Bootstrap() {
  }

  /**
   * Validates {@code config} and wires the protocol services over an in-memory store.
   *
   * @throws IllegalStateException if the configuration is invalid
   */
  public static SharedAccountModule createModule(ConfigPort config, AuditSink auditSink) {
    new ConfigValidator().validate(config).throwIfInvalid();

    IdentityId publisher = IdentityId.parse(config.get(ConfigKey.MODULE_PUBLISHER.key()));
    int lockTimeoutMs = config.getInt(
        ConfigKey.STORE_LOCK_TIMEOUT_MS.key(),
        Integer.parseInt(ConfigKey.STORE_LOCK_TIMEOUT_MS.defaultValue()));

    InMemoryIdentityStore store = new InMemoryIdentityStore(auditSink, Duration.ofMillis(lockTimeoutMs));
    return SharedAccountModule.create(store, new Sha3AddressDeriver(), publisher);
  }
}
