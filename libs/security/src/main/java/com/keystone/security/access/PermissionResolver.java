package com.keystone.security.access;

import com.keystone.security.Permission;
import java.util.Set;

/** Computes the permissions granted by a set of roles within a tenant. */
@FunctionalInterface
public interface PermissionResolver {

    /**
     * @return the union of the permissions of every role in {@code roleNames}; unknown roles grant
     *     nothing
     */
    Set<Permission> permissionsFor(String tenantId, Set<String> roleNames);
}
