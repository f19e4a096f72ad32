package com.keystone.audit;

/**
 * Receives entries that an {@link AuditSink} failed to store. Called instead of propagating the
 * failure into the business operation.
 */
@FunctionalInterface
public interface AuditFailureHandler {

    void onWriteFailure(AuditEntry entry, RuntimeException cause);
}
