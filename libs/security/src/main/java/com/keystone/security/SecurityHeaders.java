package com.keystone.security;

/** Header names of the access-control contract. */
public final class SecurityHeaders {

    public static final String AUTHORIZATION = "Authorization";
    public static final String DEFAULT_TENANT_HEADER = "X-Tenant-ID";
    public static final String REQUEST_ID = "X-Request-ID";
    public static final String API_KEY = "X-API-Key";

    private SecurityHeaders() {
        // utility class
    }
}
