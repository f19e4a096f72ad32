package com.keystone.tenantapi.config;

import com.keystone.security.AccessControlSettings;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Access-control settings, bound from {@code keystone.security.*} and validated at startup.
 *
 * <pre>
 * keystone:
 *   security:
 *     signing-secret: ${KEYSTONE_SIGNING_SECRET}
 *     issuer: keystone
 *     audience: keystone-api
 *     tenant-header: X-Tenant-ID
 *     strict-tenant-mode: false
 *     clock-skew: 30s
 *     lookup-timeout: 2s
 *     public-slug-route: /public/book/{slug}
 *     internal-api-key: ${KEYSTONE_INTERNAL_API_KEY:}
 * </pre>
 *
 * <p>Unset optional values fall back to the defaults of {@link AccessControlSettings}.
 */
@ConfigurationProperties(prefix = "keystone.security")
@Validated
public record KeystoneSecurityProperties(
        @NotBlank @Size(min = AccessControlSettings.MIN_SECRET_BYTES) String signingSecret,
        String issuer,
        String audience,
        String tenantHeader,
        boolean strictTenantMode,
        Duration clockSkew,
        Duration lookupTimeout,
        String publicSlugRoute,
        String internalApiKey) {

    public AccessControlSettings toSettings() {
        return AccessControlSettings.builder(signingSecret)
                .issuer(issuer)
                .audience(audience)
                .tenantHeader(tenantHeader)
                .strictTenantMode(strictTenantMode)
                .clockSkew(clockSkew)
                .lookupTimeout(lookupTimeout)
                .publicSlugRoute(publicSlugRoute)
                .internalApiKey(internalApiKey)
                .build();
    }

    @Override
    public String toString() {
        return toSettings().toString();
    }
}
