package com.keystone.security.access;

import com.keystone.security.DenialReason;
import com.keystone.security.tenant.TenantDirectory;
import com.keystone.security.tenant.TenantLookupException;
import com.keystone.security.tenant.TenantStatus;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Denies requests resolved to a tenant that is unknown or deactivated. A lookup that fails or
 * times out is not a denial: its {@link TenantLookupException} propagates so the caller can
 * report the system as unavailable.
 */
public final class TenantStatusGuard implements AccessGuard {

    private static final Logger log = LoggerFactory.getLogger(TenantStatusGuard.class);

    private final TenantDirectory directory;

    /**
     * @param directory directory used for status lookups; should already be time-bounded
     */
    public TenantStatusGuard(TenantDirectory directory) {
        if (directory == null) {
            throw new IllegalArgumentException("directory must not be null");
        }
        this.directory = directory;
    }

    @Override
    public String name() {
        return "tenant-status";
    }

    /**
     * @throws TenantLookupException if the tenant's status could not be looked up
     */
    @Override
    public GuardVerdict evaluate(AccessRequest request) {
        Optional<String> tenantId = request.tenantId();
        if (tenantId.isEmpty()) {
            return GuardVerdict.skip();
        }
        TenantStatus status;
        try {
            status = directory.findStatus(tenantId.get());
        } catch (TenantLookupException e) {
            log.warn("Status lookup for tenant {} failed: {}", tenantId.get(), e.getMessage());
            throw e;
        }
        return switch (status) {
            case ACTIVE -> GuardVerdict.allow();
            case INACTIVE -> GuardVerdict.deny(DenialReason.TENANT_INACTIVE, "Tenant is not active");
            case UNKNOWN -> GuardVerdict.deny(DenialReason.TENANT_INACTIVE, "Tenant does not exist");
        };
    }
}
