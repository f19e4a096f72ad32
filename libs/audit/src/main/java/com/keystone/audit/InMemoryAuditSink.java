package com.keystone.audit;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/** Keeps entries in memory. Backs the audit query endpoint and tests. */
public class InMemoryAuditSink implements AuditSink {

    private final List<AuditEntry> entries = new CopyOnWriteArrayList<>();

    @Override
    public void write(AuditEntry entry) {
        entries.add(Objects.requireNonNull(entry, "entry"));
    }

    /** All entries, oldest first. */
    public List<AuditEntry> entries() {
        return List.copyOf(entries);
    }

    /** Entries recorded against {@code tenantId}, oldest first. */
    public List<AuditEntry> entriesForTenant(String tenantId) {
        return entries.stream().filter(e -> Objects.equals(tenantId, e.tenantId())).toList();
    }

    /** Entries flagged as security events. */
    public List<AuditEntry> securityEvents() {
        return entries.stream().filter(AuditEntry::securityEvent).toList();
    }

    public void clear() {
        entries.clear();
    }
}
