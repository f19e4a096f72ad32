package com.keystone.tenantapi.api.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * A new tenant together with its first administrator.
 */
public record CreateTenantRequest(
        @NotBlank @Pattern(regexp = "[a-z0-9-]+") String slug,
        @NotBlank String name,
        @NotBlank @Email String adminEmail,
        String adminName) {
}
