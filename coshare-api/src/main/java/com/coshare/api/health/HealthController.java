package com.coshare.api.health;

import com.coshare.application.service.RegistryService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

@RestController
public class HealthController {

  private final RegistryService registry;

  public HealthController(RegistryService registry) {
    this.registry = registry;
  }

  @GetMapping("/api/v1/health")
  public Map<String, Object> health() {
    return Map.of(
        "status", "ok",
        "service", "coshare-api",
        "registryInitialized", registry.isInitialized(),
        "ts", Instant.now().toString()
    );
  }
}
