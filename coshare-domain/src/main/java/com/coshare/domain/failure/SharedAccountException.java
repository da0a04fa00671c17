package com.coshare.domain.failure;

import com.coshare.domain.DomainException;

import java.util.Objects;

public final class SharedAccountException extends DomainException {

    private final FailureKind kind;

    public SharedAccountException(FailureKind kind, String message) {
        super(message == null || message.isBlank() ? kind.name() : message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public static SharedAccountException of(FailureKind kind, String message) {
        return new SharedAccountException(kind, message);
    }

    public FailureKind kind() {
        return kind;
    }

    /**
     * Used by API layer to render stable error reason.
     */
    public String reason() {
        return kind.reason();
    }
}
