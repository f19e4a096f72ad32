package com.keystone.security.access;

import com.keystone.security.DenialReason;
import com.keystone.security.tenant.TenantLookupException;
import com.keystone.security.tenant.TenantResolution;
import java.util.Optional;

/**
 * Denies operations that need a tenant when none was resolved. When the tenant is missing
 * because its slug lookup failed, the lookup failure is thrown instead of a denial.
 */
public final class TenantPresenceGuard implements AccessGuard {

    private final boolean strictTenantMode;

    public TenantPresenceGuard(boolean strictTenantMode) {
        this.strictTenantMode = strictTenantMode;
    }

    @Override
    public String name() {
        return "tenant-presence";
    }

    @Override
    public GuardVerdict evaluate(AccessRequest request) {
        if (!request.policy().requiresTenant(strictTenantMode)) {
            return GuardVerdict.skip();
        }
        if (request.tenantId().isPresent()) {
            return GuardVerdict.allow();
        }
        Optional<TenantLookupException> failedLookup =
                request.tenantResolution().flatMap(TenantResolution::failedLookup);
        if (failedLookup.isPresent()) {
            throw failedLookup.get();
        }
        return GuardVerdict.deny(DenialReason.TENANT_REQUIRED, "Tenant is required");
    }
}
