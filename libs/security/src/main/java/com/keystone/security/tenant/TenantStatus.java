package com.keystone.security.tenant;

/** Lifecycle status of a tenant as seen by the access-control core. */
public enum TenantStatus {
    ACTIVE,
    INACTIVE,
    UNKNOWN
}
