package com.keystone.security;

import java.util.Locale;

/** Why the access decision pipeline denied a request. */
public enum DenialReason {

    UNAUTHENTICATED,
    TENANT_REQUIRED,
    TENANT_INACTIVE,
    TENANT_MISMATCH,
    INSUFFICIENT_ROLE,
    INSUFFICIENT_PERMISSION;

    /** Whether denials for this reason are recorded as security events. */
    public boolean isSecurityEvent() {
        return this == TENANT_MISMATCH;
    }

    /** Lower-case form used in metric tags and error bodies. */
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
