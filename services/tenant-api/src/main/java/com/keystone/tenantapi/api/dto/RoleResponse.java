package com.keystone.tenantapi.api.dto;

import com.keystone.persistence.model.RoleDefinition;
import com.keystone.security.Permission;
import java.util.Set;
import java.util.TreeSet;

public record RoleResponse(String id, String name, String description, Set<String> permissions, long version) {

    public static RoleResponse from(RoleDefinition role) {
        Set<String> permissions = new TreeSet<>();
        for (Permission permission : role.permissions()) {
            permissions.add(permission.toString());
        }
        return new RoleResponse(role.id(), role.name(), role.description(), permissions, role.version());
    }
}
