package com.coshare.domain.failure;

import java.util.Locale;

/**
 * Reasons a protocol operation is rejected. Every rejection aborts the whole unit of work.
 */
public enum FailureKind {
    NOT_INITIALIZED,
    ALREADY_INITIALIZED,
    ALREADY_EXISTS,
    NOT_FOUND,
    NOT_ADMIN,
    ALREADY_LISTED,
    NOT_LISTED,
    ALREADY_HOLDING_CAPABILITY,
    NO_CAPABILITY,
    WRONG_TARGET;

    /** Stable snake_case reason used in API responses, e.g. {@code already_listed}. */
    public String reason() {
        return name().toLowerCase(Locale.ROOT);
    }
}
