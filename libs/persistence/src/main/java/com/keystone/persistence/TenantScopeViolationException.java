package com.keystone.persistence;

/**
 * Thrown when a tenant-scoped operation runs without a resolved tenant outside
 * {@link TenantScopedGateway#withoutTenantScope}, or tries to write a record of another tenant.
 * Always a programming error.
 */
public class TenantScopeViolationException extends RuntimeException {

    private final String recordType;

    public TenantScopeViolationException(String recordType, String message) {
        super(message);
        this.recordType = recordType;
    }

    public String recordType() {
        return recordType;
    }
}
