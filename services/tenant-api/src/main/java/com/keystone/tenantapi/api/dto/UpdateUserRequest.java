package com.keystone.tenantapi.api.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.Set;

/**
 * Changes to a user. Null fields are left unchanged.
 *
 * @param version the version the caller last read; a stale version is rejected with 409
 */
public record UpdateUserRequest(
        @NotNull @Min(1) Long version,
        @Size(max = 200) String displayName,
        Set<String> roles,
        Boolean active) {
}
