package com.keystone.security;

/**
 * Thrown when the access decision pipeline denies a request.
 */
public class AccessDeniedException extends RuntimeException {

    private final DenialReason reason;

    public AccessDeniedException(DenialReason reason, String message) {
        super(message);
        if (reason == null) {
            throw new IllegalArgumentException("reason must not be null");
        }
        this.reason = reason;
    }

    public DenialReason reason() {
        return reason;
    }
}
