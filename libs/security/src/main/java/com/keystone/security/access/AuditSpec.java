package com.keystone.security.access;

import com.keystone.audit.AuditAction;

/**
 * What to record in the audit trail when an audited operation completes.
 *
 * @param action   the audited action
 * @param resource the resource kind, e.g. "User"
 */
public record AuditSpec(AuditAction action, String resource) {

    public AuditSpec {
        if (action == null) {
            throw new IllegalArgumentException("action must not be null");
        }
        if (resource == null || resource.isBlank()) {
            throw new IllegalArgumentException("resource must not be null or blank");
        }
    }
}
