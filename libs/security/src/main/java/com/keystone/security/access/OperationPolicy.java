package com.keystone.security.access;

import com.keystone.security.Permission;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Static access requirements of one operation, built once when the operation is registered.
 *
 * @param operationId          stable name of the operation, used in logs and metrics
 * @param publicAccess         whether the operation may be called without a principal
 * @param tenantRequirement    whether a resolved tenant is needed
 * @param requiredRoles        roles of which the caller needs at least one; empty for none
 * @param requiredPermissions  permissions the caller needs all of; empty for none
 * @param apiKeyRequired       whether the internal API key must be presented
 * @param audit                audit entry to record on completion, null if not audited
 */
public record OperationPolicy(
        String operationId,
        boolean publicAccess,
        TenantRequirement tenantRequirement,
        Set<String> requiredRoles,
        Set<Permission> requiredPermissions,
        boolean apiKeyRequired,
        AuditSpec audit) {

    public OperationPolicy {
        if (operationId == null || operationId.isBlank()) {
            throw new IllegalArgumentException("operationId must not be null or blank");
        }
        tenantRequirement = tenantRequirement == null ? TenantRequirement.DEFAULT : tenantRequirement;
        requiredRoles = requiredRoles == null ? Set.of() : Set.copyOf(requiredRoles);
        requiredPermissions = requiredPermissions == null ? Set.of() : Set.copyOf(requiredPermissions);
    }

    public static Builder builder(String operationId) {
        return new Builder(operationId);
    }

    /** A protected operation with no role or permission requirements. */
    public static OperationPolicy authenticated(String operationId) {
        return builder(operationId).build();
    }

    public Optional<AuditSpec> auditSpec() {
        return Optional.ofNullable(audit);
    }

    /**
     * Whether a resolved tenant is needed.
     *
     * @param strictTenantMode whether public operations also need a tenant by default
     */
    public boolean requiresTenant(boolean strictTenantMode) {
        return switch (tenantRequirement) {
            case REQUIRED -> true;
            case OPTIONAL -> false;
            case DEFAULT -> !publicAccess || strictTenantMode;
        };
    }

    public static final class Builder {
        private final String operationId;
        private boolean publicAccess;
        private TenantRequirement tenantRequirement = TenantRequirement.DEFAULT;
        private final Set<String> requiredRoles = new LinkedHashSet<>();
        private final Set<Permission> requiredPermissions = new LinkedHashSet<>();
        private boolean apiKeyRequired;
        private AuditSpec audit;

        private Builder(String operationId) {
            this.operationId = operationId;
        }

        public Builder publicAccess(boolean publicAccess) {
            this.publicAccess = publicAccess;
            return this;
        }

        public Builder tenant(TenantRequirement tenantRequirement) {
            this.tenantRequirement = tenantRequirement;
            return this;
        }

        public Builder roles(String... roles) {
            requiredRoles.addAll(Arrays.asList(roles));
            return this;
        }

        /** Adds permissions in {@code resource:action} form. */
        public Builder permissions(String... permissions) {
            for (String permission : permissions) {
                requiredPermissions.add(Permission.parse(permission));
            }
            return this;
        }

        public Builder apiKeyRequired(boolean apiKeyRequired) {
            this.apiKeyRequired = apiKeyRequired;
            return this;
        }

        public Builder audit(AuditSpec audit) {
            this.audit = audit;
            return this;
        }

        public OperationPolicy build() {
            return new OperationPolicy(operationId, publicAccess, tenantRequirement,
                    requiredRoles, requiredPermissions, apiKeyRequired, audit);
        }
    }
}
