package com.keystone.tenantapi.api;

import com.keystone.context.ContextKey;
import com.keystone.context.RequestContextHolder;
import com.keystone.persistence.RecordNotFoundException;
import com.keystone.persistence.repository.TenantRepository;
import com.keystone.security.access.TenantRequirement;
import com.keystone.tenantapi.api.dto.PublicTenantProfile;
import com.keystone.tenantapi.security.PublicOperation;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

/**
 * Public booking page of a tenant, addressed by slug. The tenant is resolved from the path before
 * dispatch, so the handler reads it from the request context rather than the path variable.
 */
@RestController
public class PublicBookingController {

    private final TenantRepository tenants;

    public PublicBookingController(TenantRepository tenants) {
        this.tenants = tenants;
    }

    @PublicOperation(tenant = TenantRequirement.REQUIRED)
    @GetMapping("/public/book/{slug}")
    public PublicTenantProfile profile(@PathVariable String slug) {
        String tenantId = RequestContextHolder.get(ContextKey.TENANT_ID)
                .orElseThrow(() -> new IllegalStateException("tenant not resolved for public route"));
        return tenants.findById(tenantId)
                .map(tenant -> new PublicTenantProfile(tenant.slug(), tenant.name()))
                .orElseThrow(() -> new RecordNotFoundException("Tenant", slug));
    }
}
