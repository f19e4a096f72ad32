package com.keystone.security.access;

import com.keystone.security.Permission;
import com.keystone.security.SystemRole;
import java.util.LinkedHashSet;
import java.util.Set;

/** Resolves permissions of {@link SystemRole}s only. */
public final class SystemRolePermissionResolver implements PermissionResolver {

    @Override
    public Set<Permission> permissionsFor(String tenantId, Set<String> roleNames) {
        Set<Permission> result = new LinkedHashSet<>();
        for (String roleName : roleNames) {
            SystemRole.fromString(roleName).ifPresent(role -> result.addAll(role.grants()));
        }
        return result;
    }
}
