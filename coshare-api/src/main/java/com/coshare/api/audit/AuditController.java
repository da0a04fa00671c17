package com.coshare.api.audit;

import com.coshare.application.ports.impl.InMemoryAuditSink;
import com.coshare.application.service.RegistryService;
import com.coshare.domain.registry.AuditCounters;
import com.coshare.domain.registry.AuditEventKind;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/audit")
public class AuditController {

  private final RegistryService registry;
  private final InMemoryAuditSink history;

  public AuditController(RegistryService registry, InMemoryAuditSink history) {
    this.registry = registry;
    this.history = history;
  }

  @GetMapping("/counters")
  public ResponseEntity<Map<String, Object>> counters() {
    AuditCounters c = registry.counters();
    return ResponseEntity.ok(Map.of(
        "creations", c.creations(),
        "adds", c.adds(),
        "removes", c.removes(),
        "claims", c.claims(),
        "redemptions", c.redemptions(),
        "ts", Instant.now().toString()
    ));
  }

  @GetMapping("/{kind}")
  public ResponseEntity<List<AuditEventView>> events(@PathVariable("kind") String kind) {
    AuditEventKind k = parseKind(kind);
    return ResponseEntity.ok(history.events(k).stream().map(AuditEventView::of).toList());
  }

  private static AuditEventKind parseKind(String v) {
    try {
      return AuditEventKind.valueOf(v.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown audit kind: " + v, e);
    }
  }
}
