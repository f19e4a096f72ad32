package com.keystone.tenantapi.security;

import com.keystone.security.access.AuditSpec;
import com.keystone.security.access.OperationPolicy;
import java.lang.annotation.Annotation;
import java.lang.reflect.Method;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;

/**
 * Compiles the access annotations of each handler method into an {@link OperationPolicy}, once.
 *
 * <p>Method annotations override class annotations of the same kind. A handler without
 * {@link PublicOperation} requires an authenticated caller.
 */
@Component
public class OperationPolicyRegistry {

    private static final Logger log = LoggerFactory.getLogger(OperationPolicyRegistry.class);

    private final Map<Method, OperationPolicy> policies = new ConcurrentHashMap<>();

    public OperationPolicy policyFor(HandlerMethod handler) {
        return policies.computeIfAbsent(handler.getMethod(), method -> compile(handler.getBeanType(), method));
    }

    int size() {
        return policies.size();
    }

    static OperationPolicy compile(Class<?> controller, Method method) {
        String operationId = controller.getSimpleName() + "." + method.getName();
        OperationPolicy.Builder builder = OperationPolicy.builder(operationId);

        PublicOperation publicOperation = find(controller, method, PublicOperation.class);
        if (publicOperation != null) {
            builder.publicAccess(true).tenant(publicOperation.tenant());
        }
        RequiresRoles roles = find(controller, method, RequiresRoles.class);
        if (roles != null) {
            builder.roles(roles.value());
        }
        RequiresPermissions permissions = find(controller, method, RequiresPermissions.class);
        if (permissions != null) {
            builder.permissions(permissions.value());
        }
        if (find(controller, method, ApiKeyRequired.class) != null) {
            builder.apiKeyRequired(true);
        }
        Audited audited = AnnotatedElementUtils.findMergedAnnotation(method, Audited.class);
        if (audited != null) {
            builder.audit(new AuditSpec(audited.action(), audited.resource()));
        }

        OperationPolicy policy = builder.build();
        log.debug("Compiled {}", policy);
        return policy;
    }

    private static <A extends Annotation> A find(Class<?> controller, Method method, Class<A> type) {
        A onMethod = AnnotatedElementUtils.findMergedAnnotation(method, type);
        return onMethod != null ? onMethod : AnnotatedElementUtils.findMergedAnnotation(controller, type);
    }
}
