package com.keystone.audit;

import java.util.List;

/** Thrown by an {@link AuditSink} that could not store an entry. */
public class AuditWriteException extends RuntimeException {

    private final List<AuditSink> failedSinks;

    public AuditWriteException(String message) {
        super(message);
        this.failedSinks = List.of();
    }

    public AuditWriteException(String message, Throwable cause) {
        super(message, cause);
        this.failedSinks = List.of();
    }

    /**
     * @param failedSinks the sinks that did not store the entry, when the others did
     */
    public AuditWriteException(String message, Throwable cause, List<AuditSink> failedSinks) {
        super(message, cause);
        this.failedSinks = List.copyOf(failedSinks);
    }

    /** Sinks that did not store the entry; empty when the thrower did not say. */
    public List<AuditSink> failedSinks() {
        return failedSinks;
    }
}
