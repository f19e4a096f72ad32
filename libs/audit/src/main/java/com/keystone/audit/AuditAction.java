package com.keystone.audit;

import java.util.Optional;

/**
 * Actions recorded in the audit trail.
 *
 * <p>The first group is declared by audited operations; the second group is emitted by the
 * access-control core itself and is always flagged as a security event.
 */
public enum AuditAction {

    CREATE("CREATE"),
    UPDATE("UPDATE"),
    DELETE("DELETE"),
    LOGIN("LOGIN"),
    LOGOUT("LOGOUT"),
    ACCESS("ACCESS"),
    EXPORT("EXPORT"),

    TENANT_MISMATCH("TENANT_MISMATCH"),
    TENANT_SCOPE_VIOLATION("TENANT_SCOPE_VIOLATION"),
    TENANT_SCOPE_BYPASS("TENANT_SCOPE_BYPASS");

    private final String value;

    AuditAction(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /** Whether this action is only ever emitted as a security event. */
    public boolean isSecurityAction() {
        return this == TENANT_MISMATCH || this == TENANT_SCOPE_VIOLATION || this == TENANT_SCOPE_BYPASS;
    }

    public static Optional<AuditAction> fromString(String value) {
        for (AuditAction action : values()) {
            if (action.value.equalsIgnoreCase(value)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }
}
