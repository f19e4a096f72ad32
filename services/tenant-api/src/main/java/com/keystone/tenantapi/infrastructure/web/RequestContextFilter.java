package com.keystone.tenantapi.infrastructure.web;

import com.keystone.context.ContextHandle;
import com.keystone.context.RequestContextHolder;
import com.keystone.security.InboundRequest;
import com.keystone.security.SecurityContextInitializer;
import com.keystone.security.SecurityHeaders;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Pattern;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Opens the request context for every HTTP request and populates it before dispatch.
 *
 * <ol>
 *   <li>the request id is taken from {@code X-Request-ID} when it looks like an id, otherwise a
 *       fresh UUID, and is echoed on the response
 *   <li>the tenant is resolved and a presented bearer credential is authenticated
 *   <li>the context is ended in {@code finally}, so a pooled servlet thread never carries one
 *       request's tenant or principal into the next
 * </ol>
 *
 * <p>Runs at {@link Ordered#HIGHEST_PRECEDENCE} so every later filter and handler sees the context.
 * The {@link InboundRequest} it built is left in request attribute {@link #INBOUND_REQUEST} for
 * the access-control interceptor. A slug lookup that cannot complete leaves the request without a
 * tenant here; the access-control interceptor reports it when the handler needs one.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestContextFilter extends OncePerRequestFilter {

    public static final String INBOUND_REQUEST = RequestContextFilter.class.getName() + ".INBOUND_REQUEST";

    private static final Pattern REQUEST_ID = Pattern.compile("[A-Za-z0-9._-]{1,128}");

    private final SecurityContextInitializer initializer;

    public RequestContextFilter(SecurityContextInitializer initializer) {
        this.initializer = initializer;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String requestId = request.getHeader(SecurityHeaders.REQUEST_ID);
        if (requestId == null || !REQUEST_ID.matcher(requestId).matches()) {
            requestId = UUID.randomUUID().toString();
        }
        response.setHeader(SecurityHeaders.REQUEST_ID, requestId);

        try (ContextHandle ignored = RequestContextHolder.begin(requestId)) {
            InboundRequest inbound = toInboundRequest(request);
            request.setAttribute(INBOUND_REQUEST, inbound);
            initializer.initialize(inbound);
            filterChain.doFilter(request, response);
        }
    }

    static InboundRequest toInboundRequest(HttpServletRequest request) {
        Map<String, String> headers = new LinkedHashMap<>();
        for (String name : Collections.list(request.getHeaderNames())) {
            headers.put(name, request.getHeader(name));
        }
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return InboundRequest.of(path, headers);
    }
}
