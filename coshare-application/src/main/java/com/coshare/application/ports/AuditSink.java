package com.coshare.application.ports;

import com.coshare.domain.registry.AuditEvent;

/**
 * Receives audit events after the unit of work that produced them has committed.
 * Implementations live in infrastructure (log, metrics) or {@code ports.impl} (in-memory).
 */
@FunctionalInterface
public interface AuditSink {

    void publish(AuditEvent event);
}
