package com.keystone.persistence.model;

import com.keystone.security.Permission;
import java.util.Set;

/**
 * A role defined by a tenant, with the permissions it grants. Names of system roles are reserved.
 */
public record RoleDefinition(
        RecordMeta meta,
        String tenantId,
        String name,
        String description,
        Set<Permission> permissions) implements TenantScoped<RoleDefinition> {

    public RoleDefinition {
        if (meta == null) {
            meta = RecordMeta.unsaved();
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        permissions = permissions == null ? Set.of() : Set.copyOf(permissions);
    }

    public static RoleDefinition create(String name, String description, Set<Permission> permissions) {
        return new RoleDefinition(RecordMeta.unsaved(), null, name, description, permissions);
    }

    @Override
    public RoleDefinition withMeta(RecordMeta meta) {
        return new RoleDefinition(meta, tenantId, name, description, permissions);
    }

    @Override
    public RoleDefinition withTenantId(String tenantId) {
        return new RoleDefinition(meta, tenantId, name, description, permissions);
    }

    public RoleDefinition withPermissions(Set<Permission> permissions) {
        return new RoleDefinition(meta, tenantId, name, description, permissions);
    }
}
