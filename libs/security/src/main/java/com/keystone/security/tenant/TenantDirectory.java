package com.keystone.security.tenant;

import java.util.Optional;

/**
 * Tenant lookups the access-control core needs from the persistence layer.
 *
 * <p>Implementations may block; callers bound them with {@link TimeBoundedTenantDirectory}.
 */
public interface TenantDirectory {

    /**
     * Resolves a public slug to the id of an active tenant.
     *
     * @return the tenant id, or empty if no active tenant has that slug
     * @throws TenantLookupException if the lookup could not be completed
     */
    Optional<String> findTenantIdBySlug(String slug);

    /**
     * @throws TenantLookupException if the lookup could not be completed
     */
    TenantStatus findStatus(String tenantId);
}
