package com.keystone.security.tenant;

/** Thrown when a tenant lookup fails or does not complete in time. */
public class TenantLookupException extends RuntimeException {

    public TenantLookupException(String message) {
        super(message);
    }

    public TenantLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
