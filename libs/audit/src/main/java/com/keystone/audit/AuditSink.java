package com.keystone.audit;

/**
 * Destination of audit entries. Implementations write an entry in a single call and signal any
 * failure by throwing; they never drop an entry silently.
 */
public interface AuditSink {

    /**
     * Writes one entry.
     *
     * @throws AuditWriteException (or any runtime exception) if the entry was not stored
     */
    void write(AuditEntry entry);
}
