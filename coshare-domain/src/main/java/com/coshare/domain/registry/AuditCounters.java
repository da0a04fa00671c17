package com.coshare.domain.registry;

/**
 * Snapshot of the five audit counters.
 */
public record AuditCounters(
        long creations,
        long adds,
        long removes,
        long claims,
        long redemptions
) {
    public static AuditCounters zero() {
        return new AuditCounters(0, 0, 0, 0, 0);
    }

    public long get(AuditEventKind kind) {
        return switch (kind) {
            case CREATION -> creations;
            case ALLOW_ADD -> adds;
            case ALLOW_REMOVE -> removes;
            case CLAIM -> claims;
            case REDEEM -> redemptions;
        };
    }

    public AuditCounters increment(AuditEventKind kind) {
        return switch (kind) {
            case CREATION -> new AuditCounters(creations + 1, adds, removes, claims, redemptions);
            case ALLOW_ADD -> new AuditCounters(creations, adds + 1, removes, claims, redemptions);
            case ALLOW_REMOVE -> new AuditCounters(creations, adds, removes + 1, claims, redemptions);
            case CLAIM -> new AuditCounters(creations, adds, removes, claims + 1, redemptions);
            case REDEEM -> new AuditCounters(creations, adds, removes, claims, redemptions + 1);
        };
    }
}
