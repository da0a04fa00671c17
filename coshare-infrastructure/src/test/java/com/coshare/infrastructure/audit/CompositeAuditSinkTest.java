package com.coshare.infrastructure.audit;

import com.coshare.application.ports.AuditSink;
import com.coshare.application.ports.impl.InMemoryAuditSink;
import com.coshare.application.ports.impl.NoopAuditSink;
import com.coshare.domain.identity.IdentityId;
import com.coshare.domain.registry.AuditEvent;
import com.coshare.domain.registry.AuditEventKind;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CompositeAuditSinkTest {

    private static final IdentityId T = IdentityId.parse("0x7a");

    @Test
    void collapsesTrivialLists() {
        InMemoryAuditSink only = new InMemoryAuditSink();

        assertThat(CompositeAuditSink.of(List.of())).isInstanceOf(NoopAuditSink.class);
        assertThat(CompositeAuditSink.of(List.of(only))).isSameAs(only);
    }

    @Test
    void failingDelegateDoesNotStarveOthers() {
        AuditSink failing = e -> {
            throw new IllegalStateException("down");
        };
        InMemoryAuditSink after = new InMemoryAuditSink();
        AuditSink composite = CompositeAuditSink.of(List.of(failing, after));

        composite.publish(new AuditEvent(1, AuditEventKind.CREATION, T, null, T, Instant.EPOCH));

        assertThat(((CompositeAuditSink) composite).size()).isEqualTo(2);
        assertThat(after.events(AuditEventKind.CREATION)).hasSize(1);
    }
}
