package com.coshare.infrastructure.audit;

import com.coshare.application.ports.AuditSink;
import com.coshare.domain.registry.AuditEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes one structured line per audit event to the {@code coshare.audit} logger.
 */
public final class LoggingAuditSink implements AuditSink {

    private static final Logger log = LoggerFactory.getLogger("coshare.audit");

    @Override
    public void publish(AuditEvent event) {
        log.info("[AUDIT] kind={} seq={} actor={} subject={} target={} at={}",
                event.kind(),
                event.sequence(),
                event.actor(),
                event.subject() == null ? "-" : event.subject(),
                event.target(),
                event.at());
    }
}
