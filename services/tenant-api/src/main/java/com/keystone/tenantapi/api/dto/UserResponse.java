package com.keystone.tenantapi.api.dto;

import com.keystone.persistence.model.User;
import java.time.Instant;
import java.util.Set;

public record UserResponse(
        String id,
        String tenantId,
        String email,
        String displayName,
        Set<String> roles,
        boolean active,
        long version,
        Instant createdAt,
        Instant updatedAt) {

    public static UserResponse from(User user) {
        return new UserResponse(user.id(), user.tenantId(), user.email(), user.displayName(),
                user.roleNames(), user.active(), user.version(),
                user.meta().createdAt(), user.meta().updatedAt());
    }
}
