package com.coshare.domain.registry;

/**
 * One audit stream (and counter) per successful protocol operation.
 */
public enum AuditEventKind {
    CREATION,
    ALLOW_ADD,
    ALLOW_REMOVE,
    CLAIM,
    REDEEM
}
