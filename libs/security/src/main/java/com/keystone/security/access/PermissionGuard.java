package com.keystone.security.access;

import com.keystone.security.DenialReason;
import com.keystone.security.Permission;
import com.keystone.security.Principal;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Requires every permission of the operation to be covered by the union of the permissions of the
 * principal's roles.
 */
public final class PermissionGuard implements AccessGuard {

    private final PermissionResolver resolver;

    public PermissionGuard(PermissionResolver resolver) {
        if (resolver == null) {
            throw new IllegalArgumentException("resolver must not be null");
        }
        this.resolver = resolver;
    }

    @Override
    public String name() {
        return "permission";
    }

    @Override
    public GuardVerdict evaluate(AccessRequest request) {
        Set<Permission> required = request.policy().requiredPermissions();
        if (required.isEmpty()) {
            return GuardVerdict.skip();
        }
        Optional<Principal> principal = request.principal();
        if (principal.isEmpty()) {
            return GuardVerdict.deny(DenialReason.UNAUTHENTICATED, "Authentication is required");
        }
        Set<Permission> granted = resolver.permissionsFor(principal.get().tenantId(), principal.get().roles());
        List<Permission> missing = required.stream()
                .filter(permission -> !Permission.anyCovers(granted, permission))
                .toList();
        if (!missing.isEmpty()) {
            return GuardVerdict.deny(DenialReason.INSUFFICIENT_PERMISSION, "Missing permissions " + missing);
        }
        return GuardVerdict.allow();
    }
}
