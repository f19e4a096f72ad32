package com.keystone.security.access;

import com.keystone.context.ContextKey;
import com.keystone.context.RequestContext;
import com.keystone.security.InboundRequest;
import com.keystone.security.Principal;
import com.keystone.security.SecurityContextKeys;
import com.keystone.security.tenant.TenantResolution;
import java.util.Optional;

/**
 * Everything the guards look at for one decision: the operation's policy, a snapshot of the
 * request context and the inbound request.
 */
public record AccessRequest(OperationPolicy policy, RequestContext context, InboundRequest request) {

    public AccessRequest {
        if (policy == null || context == null || request == null) {
            throw new IllegalArgumentException("policy, context and request must not be null");
        }
    }

    public Optional<Principal> principal() {
        return context.get(SecurityContextKeys.PRINCIPAL);
    }

    public Optional<String> tenantId() {
        return context.get(ContextKey.TENANT_ID);
    }

    public Optional<TenantResolution> tenantResolution() {
        return context.get(SecurityContextKeys.TENANT_RESOLUTION);
    }

    public Optional<RuntimeException> credentialFailure() {
        return context.get(SecurityContextKeys.CREDENTIAL_FAILURE);
    }

    /** Whether the operation demands an authenticated principal. */
    public boolean principalRequired() {
        return !policy.publicAccess();
    }
}
