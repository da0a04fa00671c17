package com.coshare.domain.registry;

import com.coshare.domain.identity.IdentityId;

import java.time.Instant;
import java.util.Objects;

/**
 * Append-only record of one successful protocol operation.
 *
 * @param sequence per-kind counter value after this event (1-based)
 * @param actor    principal that called the operation
 * @param subject  claimer the operation was about; null for account creation
 * @param target   shared account the operation touched
 */
public record AuditEvent(
        long sequence,
        AuditEventKind kind,
        IdentityId actor,
        IdentityId subject,
        IdentityId target,
        Instant at
) {
    public AuditEvent {
        if (sequence < 1) throw new IllegalArgumentException("sequence must be >= 1: " + sequence);
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(actor, "actor");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(at, "at");
    }
}
