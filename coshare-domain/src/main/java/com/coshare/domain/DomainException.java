package com.coshare.domain;

/**
 * Base type for rule violations raised by the domain and the services built on it.
 */
public class DomainException extends RuntimeException {

    public DomainException(String message) {
        super(message);
    }

    public DomainException(String message, Throwable cause) {
        super(message, cause);
    }
}
