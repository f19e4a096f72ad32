package com.keystone.tenantapi;

import com.keystone.tenantapi.config.KeystoneDataProperties;
import com.keystone.tenantapi.config.KeystoneSecurityProperties;
import com.keystone.tenantapi.config.KeystoneServiceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Keystone tenant API.
 *
 * <p>Every request passes through the same pipeline before it reaches a controller:
 *
 * <ol>
 *   <li>{@code RequestContextFilter} opens the request context, resolves the tenant and
 *       authenticates the bearer credential
 *   <li>{@code AccessControlInterceptor} runs the access decision pipeline against the handler's
 *       {@code OperationPolicy}
 *   <li>controllers reach data only through the tenant-scoping gateway
 *   <li>{@code AuditInterceptor} records audited operations on completion
 * </ol>
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties({
    KeystoneServiceProperties.class,
    KeystoneSecurityProperties.class,
    KeystoneDataProperties.class
})
public class TenantApiApplication {

    private static final Logger log = LoggerFactory.getLogger(TenantApiApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(TenantApiApplication.class, args);
        log.info("Keystone tenant API started");
    }
}
