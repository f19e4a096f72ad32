package com.keystone.persistence.directory;

import com.keystone.persistence.UnavailableException;
import com.keystone.persistence.model.Tenant;
import com.keystone.persistence.repository.TenantRepository;
import com.keystone.security.tenant.TenantDirectory;
import com.keystone.security.tenant.TenantLookupException;
import com.keystone.security.tenant.TenantStatus;
import java.util.Optional;

/** {@link TenantDirectory} backed by the tenant records of the data gateway. */
public class GatewayTenantDirectory implements TenantDirectory {

    private final TenantRepository tenants;

    public GatewayTenantDirectory(TenantRepository tenants) {
        this.tenants = tenants;
    }

    @Override
    public Optional<String> findTenantIdBySlug(String slug) {
        try {
            return tenants.findActiveBySlug(slug).map(Tenant::id);
        } catch (UnavailableException e) {
            throw new TenantLookupException("Tenant lookup by slug failed", e);
        }
    }

    @Override
    public TenantStatus findStatus(String tenantId) {
        try {
            return tenants.findById(tenantId)
                    .map(t -> t.active() ? TenantStatus.ACTIVE : TenantStatus.INACTIVE)
                    .orElse(TenantStatus.UNKNOWN);
        } catch (UnavailableException e) {
            throw new TenantLookupException("Tenant status lookup failed for " + tenantId, e);
        }
    }
}
