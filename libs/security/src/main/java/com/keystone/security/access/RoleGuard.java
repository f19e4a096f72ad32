package com.keystone.security.access;

import com.keystone.security.DenialReason;
import com.keystone.security.Principal;
import java.util.Optional;
import java.util.Set;

/**
 * Requires at least one of the operation's roles. {@code super_admin} passes every role check.
 */
public final class RoleGuard implements AccessGuard {

    @Override
    public String name() {
        return "role";
    }

    @Override
    public GuardVerdict evaluate(AccessRequest request) {
        Set<String> required = request.policy().requiredRoles();
        if (required.isEmpty()) {
            return GuardVerdict.skip();
        }
        Optional<Principal> principal = request.principal();
        if (principal.isEmpty()) {
            return GuardVerdict.deny(DenialReason.UNAUTHENTICATED, "Authentication is required");
        }
        if (principal.get().isSuperAdmin()) {
            return GuardVerdict.allow();
        }
        for (String role : required) {
            if (principal.get().hasRole(role)) {
                return GuardVerdict.allow();
            }
        }
        return GuardVerdict.deny(DenialReason.INSUFFICIENT_ROLE,
                "Requires one of the roles " + required);
    }
}
