package com.keystone.tenantapi.security;

import static org.assertj.core.api.Assertions.assertThat;

import com.keystone.audit.AuditAction;
import com.keystone.security.Permission;
import com.keystone.security.access.AuditSpec;
import com.keystone.security.access.OperationPolicy;
import com.keystone.security.access.TenantRequirement;
import java.lang.reflect.Method;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.method.HandlerMethod;

@DisplayName("OperationPolicyRegistry")
class OperationPolicyRegistryTest {

    @RequiresRoles("admin")
    static class SampleController {

        public void inherited() {
        }

        @RequiresRoles({"manager", "owner"})
        @RequiresPermissions({"users:read", "users:update"})
        @Audited(action = AuditAction.UPDATE, resource = "User")
        public void overridden() {
        }

        @PublicOperation(tenant = TenantRequirement.REQUIRED)
        @ApiKeyRequired
        public void webhook() {
        }
    }

    static class PlainController {

        public void unannotated() {
        }
    }

    private static OperationPolicy compile(Class<?> type, String method) throws NoSuchMethodException {
        return OperationPolicyRegistry.compile(type, type.getMethod(method));
    }

    @Test
    @DisplayName("an unannotated handler requires an authenticated caller and nothing else")
    void unannotatedIsAuthenticated() throws Exception {
        OperationPolicy policy = compile(PlainController.class, "unannotated");

        assertThat(policy.operationId()).isEqualTo("PlainController.unannotated");
        assertThat(policy.publicAccess()).isFalse();
        assertThat(policy.requiredRoles()).isEmpty();
        assertThat(policy.requiredPermissions()).isEmpty();
        assertThat(policy.auditSpec()).isEmpty();
    }

    @Test
    @DisplayName("class annotations apply to methods without their own")
    void classAnnotationsApply() throws Exception {
        OperationPolicy policy = compile(SampleController.class, "inherited");

        assertThat(policy.requiredRoles()).containsExactly("admin");
    }

    @Test
    @DisplayName("method annotations override class annotations")
    void methodAnnotationsOverride() throws Exception {
        OperationPolicy policy = compile(SampleController.class, "overridden");

        assertThat(policy.requiredRoles()).containsExactlyInAnyOrder("manager", "owner");
        assertThat(policy.requiredPermissions())
                .containsExactlyInAnyOrder(Permission.of("users", "read"), Permission.of("users", "update"));
        assertThat(policy.auditSpec()).contains(new AuditSpec(AuditAction.UPDATE, "User"));
    }

    @Test
    @DisplayName("public operations keep their tenant requirement and API key flag")
    void publicOperation() throws Exception {
        OperationPolicy policy = compile(SampleController.class, "webhook");

        assertThat(policy.publicAccess()).isTrue();
        assertThat(policy.tenantRequirement()).isEqualTo(TenantRequirement.REQUIRED);
        assertThat(policy.apiKeyRequired()).isTrue();
    }

    @Test
    @DisplayName("compiles each handler method once")
    void cachesPolicies() throws Exception {
        var registry = new OperationPolicyRegistry();
        var controller = new SampleController();
        Method method = SampleController.class.getMethod("overridden");

        OperationPolicy first = registry.policyFor(new HandlerMethod(controller, method));
        OperationPolicy second = registry.policyFor(new HandlerMethod(controller, method));

        assertThat(second).isSameAs(first);
        assertThat(registry.size()).isEqualTo(1);
    }
}
