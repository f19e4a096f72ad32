package com.keystone.audit;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One immutable entry of the audit trail.
 *
 * <p>Entries are complete when constructed; sinks write them in a single call, so an entry is
 * either recorded whole or not at all.
 *
 * @param entryId        unique id of this entry (UUID)
 * @param occurredAt     when the audited outcome was observed
 * @param requestId      id of the request that produced the entry, null for background work
 * @param actorId        authenticated caller, null for anonymous or system callers
 * @param tenantId       tenant the operation ran against, null when none was resolved
 * @param action         what was attempted
 * @param resource       kind of resource acted upon (e.g. "User")
 * @param outcome        success, failure or denial
 * @param reason         failure or denial reason, null on success
 * @param securityEvent  whether the entry records a security-relevant event
 * @param details        additional redacted key/value data
 */
public record AuditEntry(
        String entryId,
        Instant occurredAt,
        String requestId,
        String actorId,
        String tenantId,
        AuditAction action,
        String resource,
        AuditOutcome outcome,
        String reason,
        boolean securityEvent,
        Map<String, Object> details) {

    public AuditEntry {
        if (entryId == null || entryId.isBlank()) {
            throw new IllegalArgumentException("entryId must not be null or blank");
        }
        if (occurredAt == null) {
            throw new IllegalArgumentException("occurredAt must not be null");
        }
        if (action == null) {
            throw new IllegalArgumentException("action must not be null");
        }
        if (resource == null || resource.isBlank()) {
            throw new IllegalArgumentException("resource must not be null or blank");
        }
        if (outcome == null) {
            throw new IllegalArgumentException("outcome must not be null");
        }
        details = details == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    /** Returns a copy of this entry with the given details. */
    public AuditEntry withDetails(Map<String, Object> newDetails) {
        return new AuditEntry(entryId, occurredAt, requestId, actorId, tenantId, action, resource,
                outcome, reason, securityEvent, newDetails);
    }
}
