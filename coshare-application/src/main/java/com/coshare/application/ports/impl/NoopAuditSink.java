package com.coshare.application.ports.impl;

import com.coshare.application.ports.AuditSink;
import com.coshare.domain.registry.AuditEvent;

/** Safe default when no audit sink is wired. */
public final class NoopAuditSink implements AuditSink {
    @Override
    public void publish(AuditEvent event) {
        // no-op
    }
}
