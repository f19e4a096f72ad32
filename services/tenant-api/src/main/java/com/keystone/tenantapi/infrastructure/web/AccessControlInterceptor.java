package com.keystone.tenantapi.infrastructure.web;

import com.keystone.context.RequestContextHolder;
import com.keystone.security.InboundRequest;
import com.keystone.security.access.AccessDecisionPipeline;
import com.keystone.security.access.AccessRequest;
import com.keystone.security.access.OperationPolicy;
import com.keystone.tenantapi.security.OperationPolicyRegistry;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Runs the access decision pipeline for every controller method before it is invoked.
 *
 * <p>A denial is thrown and mapped to a problem response by {@link GlobalExceptionHandler}; the
 * controller never runs. Allowed requests carry their policy in request attribute
 * {@link #GRANTED_POLICY}.
 */
@Component
public class AccessControlInterceptor implements HandlerInterceptor {

    public static final String GRANTED_POLICY = AccessControlInterceptor.class.getName() + ".GRANTED_POLICY";

    private final OperationPolicyRegistry policies;
    private final AccessDecisionPipeline pipeline;

    public AccessControlInterceptor(OperationPolicyRegistry policies, AccessDecisionPipeline pipeline) {
        this.policies = policies;
        this.pipeline = pipeline;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!(handler instanceof HandlerMethod handlerMethod)) {
            return true;
        }
        OperationPolicy policy = policies.policyFor(handlerMethod);
        InboundRequest inbound = (InboundRequest) request.getAttribute(RequestContextFilter.INBOUND_REQUEST);
        if (inbound == null) {
            inbound = RequestContextFilter.toInboundRequest(request);
        }
        pipeline.enforce(new AccessRequest(policy, RequestContextHolder.snapshot(), inbound));
        request.setAttribute(GRANTED_POLICY, policy);
        return true;
    }
}
