package com.keystone.security;

import java.time.Instant;
import java.util.Set;

/**
 * The authenticated caller of the current request.
 *
 * <p>Built only from a fully validated credential; immutable for the lifetime of the request.
 *
 * @param principalId the caller's id (token subject)
 * @param tenantId    the tenant the credential was issued for
 * @param roles       role names held by the caller
 * @param issuedAt    when the credential was issued, null if the credential did not say
 * @param expiresAt   when the credential expires
 */
public record Principal(
        String principalId,
        String tenantId,
        Set<String> roles,
        Instant issuedAt,
        Instant expiresAt) {

    public Principal {
        if (principalId == null || principalId.isBlank()) {
            throw new IllegalArgumentException("principalId must not be null or blank");
        }
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be null or blank");
        }
        roles = roles == null ? Set.of() : Set.copyOf(roles);
    }

    public boolean hasRole(String role) {
        return roles.contains(role);
    }

    /** Whether the caller holds {@link SystemRole#SUPER_ADMIN}. */
    public boolean isSuperAdmin() {
        return roles.contains(SystemRole.SUPER_ADMIN.value());
    }

    public boolean belongsTo(String otherTenantId) {
        return tenantId.equals(otherTenantId);
    }
}
