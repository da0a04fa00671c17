package com.coshare.infrastructure.audit;

import com.coshare.application.ports.AuditSink;
import com.coshare.domain.registry.AuditEvent;
import com.coshare.domain.registry.AuditEventKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Exposes audit activity as metrics.
 *
 * Exposes:
 * - coshare.audit.events{kind=creation|allow_add|allow_remove|claim|redeem} (counter)
 */
public final class MicrometerAuditSink implements AuditSink {

    public static final String METRIC = "coshare.audit.events";

    private final Map<AuditEventKind, Counter> counters = new EnumMap<>(AuditEventKind.class);

    public MicrometerAuditSink(MeterRegistry registry) {
        for (AuditEventKind kind : AuditEventKind.values()) {
            counters.put(kind, Counter.builder(METRIC)
                    .description("Committed shared-account protocol operations")
                    .tag("kind", kind.name().toLowerCase(Locale.ROOT))
                    .register(registry));
        }
    }

    @Override
    public void publish(AuditEvent event) {
        counters.get(event.kind()).increment();
    }
}
