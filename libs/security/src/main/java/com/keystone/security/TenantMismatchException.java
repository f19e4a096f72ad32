package com.keystone.security;

/**
 * Thrown when a caller authenticated for one tenant acts against a request resolved to another.
 */
public class TenantMismatchException extends AccessDeniedException {

    private final String principalTenantId;
    private final String requestedTenantId;

    public TenantMismatchException(String principalTenantId, String requestedTenantId) {
        super(DenialReason.TENANT_MISMATCH,
                "Tenant mismatch: principal of tenant '%s' cannot act on tenant '%s'"
                        .formatted(principalTenantId, requestedTenantId));
        this.principalTenantId = principalTenantId;
        this.requestedTenantId = requestedTenantId;
    }

    public String principalTenantId() {
        return principalTenantId;
    }

    public String requestedTenantId() {
        return requestedTenantId;
    }
}
