package com.keystone.security.tenant;

/** Where the tenant of a request came from, in priority order. */
public enum TenantSource {
    TOKEN_CLAIM,
    HEADER,
    PUBLIC_SLUG,
    NONE
}
