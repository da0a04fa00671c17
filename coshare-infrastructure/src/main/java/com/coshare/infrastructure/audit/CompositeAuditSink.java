package com.coshare.infrastructure.audit;

import com.coshare.application.ports.AuditSink;
import com.coshare.application.ports.impl.NoopAuditSink;
import com.coshare.domain.registry.AuditEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Fans an event out to every delegate. One failing delegate does not starve the others.
 */
public final class CompositeAuditSink implements AuditSink {

    private static final Logger log = LoggerFactory.getLogger(CompositeAuditSink.class);

    private final List<AuditSink> delegates;

    private CompositeAuditSink(List<AuditSink> delegates) {
        this.delegates = delegates;
    }

    /** Collapses to a single delegate, or a no-op sink when there is none. */
    public static AuditSink of(List<? extends AuditSink> delegates) {
        List<AuditSink> copy = List.copyOf(delegates);
        if (copy.isEmpty()) return new NoopAuditSink();
        if (copy.size() == 1) return copy.get(0);
        return new CompositeAuditSink(copy);
    }

    @Override
    public void publish(AuditEvent event) {
        for (AuditSink sink : delegates) {
            try {
                sink.publish(event);
            } catch (RuntimeException e) {
                log.warn("[AUDIT] sink {} failed kind={} seq={}",
                        sink.getClass().getSimpleName(), event.kind(), event.sequence(), e);
            }
        }
    }

    int size() {
        return delegates.size();
    }
}
