package com.keystone.persistence.directory;

import com.keystone.context.ContextKey;
import com.keystone.context.RequestContextHolder;
import com.keystone.persistence.model.RoleDefinition;
import com.keystone.persistence.repository.RoleDefinitionRepository;
import com.keystone.security.Permission;
import com.keystone.security.SystemRole;
import com.keystone.security.access.PermissionResolver;
import com.keystone.security.access.SystemRolePermissionResolver;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves system roles from {@link SystemRole} and every other role name from the
 * {@link RoleDefinition}s of the tenant.
 *
 * <p>Tenant roles are read through the gateway, so they are only resolved when {@code tenantId} is
 * the tenant of the current request. In any other case only system roles grant permissions.
 */
public class TenantRolePermissionResolver implements PermissionResolver {

    private static final Logger log = LoggerFactory.getLogger(TenantRolePermissionResolver.class);

    private final SystemRolePermissionResolver systemRoles = new SystemRolePermissionResolver();
    private final RoleDefinitionRepository roles;

    public TenantRolePermissionResolver(RoleDefinitionRepository roles) {
        this.roles = roles;
    }

    @Override
    public Set<Permission> permissionsFor(String tenantId, Set<String> roleNames) {
        Set<Permission> result = new LinkedHashSet<>(systemRoles.permissionsFor(tenantId, roleNames));

        Set<String> tenantRoleNames = new HashSet<>(roleNames);
        tenantRoleNames.removeIf(SystemRole::isSystemRole);
        if (tenantRoleNames.isEmpty()) {
            return result;
        }
        String ambientTenant = RequestContextHolder.get(ContextKey.TENANT_ID).orElse(null);
        if (tenantId == null || !tenantId.equals(ambientTenant)) {
            log.debug("Skipping tenant roles {} of tenant {} outside its request scope", tenantRoleNames, tenantId);
            return result;
        }
        for (RoleDefinition role : roles.findByNames(tenantRoleNames)) {
            result.addAll(role.permissions());
        }
        return result;
    }
}
