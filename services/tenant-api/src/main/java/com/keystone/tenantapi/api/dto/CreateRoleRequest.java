package com.keystone.tenantapi.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Pattern;
import java.util.Set;

/**
 * @param permissions granted permissions in {@code resource:action} form
 */
public record CreateRoleRequest(
        @NotBlank @Pattern(regexp = "[a-z][a-z0-9_]*") String name,
        String description,
        @NotEmpty Set<String> permissions) {
}
