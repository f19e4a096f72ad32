package com.keystone.tenantapi.api.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.Set;

public record CreateUserRequest(
        @NotBlank @Email String email,
        @Size(max = 200) String displayName,
        Set<String> roles) {
}
