package com.keystone.security.access;

/** One stage of the access decision pipeline. */
public interface AccessGuard {

    /** Short name used in logs and metrics. */
    String name();

    /**
     * @throws com.keystone.security.tenant.TenantLookupException if a lookup the verdict depends on
     *     could not complete; this is never reported as a denial
     */
    GuardVerdict evaluate(AccessRequest request);
}
