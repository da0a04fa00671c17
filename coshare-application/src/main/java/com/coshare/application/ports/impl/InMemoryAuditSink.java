package com.coshare.application.ports.impl;

import com.coshare.application.ports.AuditSink;
import com.coshare.domain.registry.AuditEvent;
import com.coshare.domain.registry.AuditEventKind;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Append-only in-process audit log, one stream per event kind.
 * Backs the audit query endpoint; a durable sink would replace it in production.
 */
public final class InMemoryAuditSink implements AuditSink {

    private final Map<AuditEventKind, List<AuditEvent>> byKind = new EnumMap<>(AuditEventKind.class);

    public InMemoryAuditSink() {
        for (AuditEventKind kind : AuditEventKind.values()) {
            byKind.put(kind, new ArrayList<>());
        }
    }

    @Override
    public synchronized void publish(AuditEvent event) {
        Objects.requireNonNull(event, "event");
        byKind.get(event.kind()).add(event);
    }

    public synchronized List<AuditEvent> events(AuditEventKind kind) {
        return List.copyOf(byKind.get(Objects.requireNonNull(kind, "kind")));
    }

    public synchronized int size() {
        int n = 0;
        for (List<AuditEvent> l : byKind.values()) n += l.size();
        return n;
    }
}
