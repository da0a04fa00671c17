package com.coshare.api.wiring;

import com.coshare.application.service.RegistryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Installs the module registry for the configured publisher on startup.
 * An existing registry (durable store, restart) is left as it is.
 */
@Component
public class RegistryStartup implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(RegistryStartup.class);

  private final RegistryService registry;

  public RegistryStartup(RegistryService registry) {
    this.registry = registry;
  }

  @Override
  public void run(ApplicationArguments args) {
    if (registry.isInitialized()) {
      log.info("[REGISTRY] already present registry={} publisher={}", registry.registryId(), registry.publisher());
      return;
    }
    registry.initialize(registry.publisher());
  }
}
