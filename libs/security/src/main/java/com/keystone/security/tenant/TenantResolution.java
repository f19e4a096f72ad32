package com.keystone.security.tenant;

import java.util.Optional;

/**
 * Outcome of tenant resolution for one request.
 *
 * @param tenantId        the resolved tenant, null when no source yielded one
 * @param source          the source that won
 * @param headerTenantId  the tenant header value as presented, recorded even when a higher
 *                        priority source won
 * @param lookupFailure   the failed slug lookup that left the request without a tenant, if any
 */
public record TenantResolution(String tenantId, TenantSource source, String headerTenantId,
                               TenantLookupException lookupFailure) {

    public TenantResolution {
        if (source == null) {
            throw new IllegalArgumentException("source must not be null");
        }
        if ((tenantId == null) != (source == TenantSource.NONE)) {
            throw new IllegalArgumentException("tenantId must be present exactly when source is not NONE");
        }
        if (lookupFailure != null && tenantId != null) {
            throw new IllegalArgumentException("a resolved tenant cannot carry a lookup failure");
        }
    }

    public TenantResolution(String tenantId, TenantSource source, String headerTenantId) {
        this(tenantId, source, headerTenantId, null);
    }

    public static TenantResolution none(String headerTenantId) {
        return new TenantResolution(null, TenantSource.NONE, headerTenantId, null);
    }

    /** No tenant because the slug lookup could not complete. */
    public static TenantResolution unavailable(TenantLookupException failure) {
        return new TenantResolution(null, TenantSource.NONE, null, failure);
    }

    public boolean isResolved() {
        return tenantId != null;
    }

    public Optional<String> resolvedTenantId() {
        return Optional.ofNullable(tenantId);
    }

    public Optional<String> presentedHeaderTenantId() {
        return Optional.ofNullable(headerTenantId);
    }

    public Optional<TenantLookupException> failedLookup() {
        return Optional.ofNullable(lookupFailure);
    }
}
