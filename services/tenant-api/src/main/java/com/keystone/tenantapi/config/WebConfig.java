package com.keystone.tenantapi.config;

import com.keystone.security.SecurityHeaders;
import com.keystone.tenantapi.infrastructure.web.AccessControlInterceptor;
import com.keystone.tenantapi.infrastructure.web.AuditInterceptor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web MVC configuration: CORS and the access-control and audit interceptors.
 *
 * <p>The access-control interceptor is registered first, so an operation is only audited once it
 * has been allowed. The error path carries no operation policy and is excluded.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final AccessControlInterceptor accessControl;
    private final AuditInterceptor audit;

    public WebConfig(AccessControlInterceptor accessControl, AuditInterceptor audit) {
        this.accessControl = accessControl;
        this.audit = audit;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(accessControl).excludePathPatterns("/error");
        registry.addInterceptor(audit).excludePathPatterns("/error");
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        // Local development frontends; production origins come from the gateway in front.
        registry.addMapping("/api/**")
                .allowedOrigins("http://localhost:3000", "http://localhost:5173")
                .allowedMethods("GET", "POST", "PUT", "DELETE", "PATCH", "OPTIONS")
                .allowedHeaders(SecurityHeaders.AUTHORIZATION, SecurityHeaders.DEFAULT_TENANT_HEADER,
                        SecurityHeaders.REQUEST_ID, SecurityHeaders.API_KEY, "Content-Type")
                .exposedHeaders(SecurityHeaders.REQUEST_ID)
                .allowCredentials(true)
                .maxAge(3600);
    }
}
