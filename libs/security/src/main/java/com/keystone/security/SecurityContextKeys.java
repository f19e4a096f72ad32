package com.keystone.security;

import com.keystone.context.ContextKey;
import com.keystone.security.tenant.TenantResolution;

/** Request context keys written by the security layer. */
public final class SecurityContextKeys {

    /** The authenticated caller. Absent for anonymous requests. */
    public static final ContextKey<Principal> PRINCIPAL = ContextKey.of("principal", Principal.class);

    /** How the tenant of the request was resolved. */
    public static final ContextKey<TenantResolution> TENANT_RESOLUTION =
            ContextKey.of("tenantResolution", TenantResolution.class);

    /**
     * Why a presented credential was rejected. Kept so that public operations can still proceed
     * anonymously while protected ones report the original failure.
     */
    public static final ContextKey<RuntimeException> CREDENTIAL_FAILURE =
            ContextKey.of("credentialFailure", RuntimeException.class);

    private SecurityContextKeys() {
        // utility class
    }
}
