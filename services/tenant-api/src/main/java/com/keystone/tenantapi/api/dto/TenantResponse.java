package com.keystone.tenantapi.api.dto;

import com.keystone.persistence.model.Tenant;

/**
 * @param adminUserId id of the administrator seeded with the tenant, null outside provisioning
 */
public record TenantResponse(String id, String slug, String name, boolean active, String adminUserId) {

    public static TenantResponse from(Tenant tenant, String adminUserId) {
        return new TenantResponse(tenant.id(), tenant.slug(), tenant.name(), tenant.active(), adminUserId);
    }
}
