package com.keystone.security;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Settings of the access-control core.
 *
 * @param signingSecret     HS256 secret shared with the token issuer, at least 32 bytes
 * @param issuer            expected {@code iss} claim, null to accept any issuer
 * @param audience          expected {@code aud} entry, null to accept any audience
 * @param tenantHeader      header carrying a caller-supplied tenant id
 * @param strictTenantMode  whether public operations also require a resolved tenant
 * @param clockSkew         tolerance applied to {@code exp} and {@code nbf}
 * @param lookupTimeout     upper bound for credential verification and tenant lookups
 * @param publicSlugRoute   path template of public pages addressed by tenant slug; must contain
 *                          {@code {slug}}
 * @param internalApiKey    key expected in {@code X-API-Key} by server-to-server operations, null
 *                          to reject all of them
 */
public record AccessControlSettings(
        String signingSecret,
        String issuer,
        String audience,
        String tenantHeader,
        boolean strictTenantMode,
        Duration clockSkew,
        Duration lookupTimeout,
        String publicSlugRoute,
        String internalApiKey) {

    public static final int MIN_SECRET_BYTES = 32;
    public static final Duration DEFAULT_CLOCK_SKEW = Duration.ofSeconds(30);
    public static final Duration DEFAULT_LOOKUP_TIMEOUT = Duration.ofSeconds(2);
    public static final String DEFAULT_PUBLIC_SLUG_ROUTE = "/public/book/{slug}";

    public AccessControlSettings {
        if (signingSecret == null
                || signingSecret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new IllegalArgumentException(
                    "signingSecret must be at least %d bytes".formatted(MIN_SECRET_BYTES));
        }
        issuer = blankToNull(issuer);
        audience = blankToNull(audience);
        internalApiKey = blankToNull(internalApiKey);
        if (tenantHeader == null || tenantHeader.isBlank()) {
            tenantHeader = SecurityHeaders.DEFAULT_TENANT_HEADER;
        }
        if (clockSkew == null) {
            clockSkew = DEFAULT_CLOCK_SKEW;
        }
        if (clockSkew.isNegative()) {
            throw new IllegalArgumentException("clockSkew must not be negative");
        }
        if (lookupTimeout == null) {
            lookupTimeout = DEFAULT_LOOKUP_TIMEOUT;
        }
        if (lookupTimeout.isZero() || lookupTimeout.isNegative()) {
            throw new IllegalArgumentException("lookupTimeout must be positive");
        }
        if (publicSlugRoute == null || publicSlugRoute.isBlank()) {
            publicSlugRoute = DEFAULT_PUBLIC_SLUG_ROUTE;
        }
        if (!publicSlugRoute.contains("{slug}")) {
            throw new IllegalArgumentException("publicSlugRoute must contain {slug}");
        }
    }

    public static Builder builder(String signingSecret) {
        return new Builder(signingSecret);
    }

    public byte[] signingKey() {
        return signingSecret.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "AccessControlSettings[issuer=%s, audience=%s, tenantHeader=%s, strictTenantMode=%s, "
                .formatted(issuer, audience, tenantHeader, strictTenantMode)
                + "clockSkew=%s, lookupTimeout=%s, publicSlugRoute=%s, internalApiKey=%s]"
                .formatted(clockSkew, lookupTimeout, publicSlugRoute,
                        internalApiKey == null ? "unset" : "set");
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    /** Builder starting from the defaults. */
    public static final class Builder {
        private final String signingSecret;
        private String issuer;
        private String audience;
        private String tenantHeader = SecurityHeaders.DEFAULT_TENANT_HEADER;
        private boolean strictTenantMode;
        private Duration clockSkew = DEFAULT_CLOCK_SKEW;
        private Duration lookupTimeout = DEFAULT_LOOKUP_TIMEOUT;
        private String publicSlugRoute = DEFAULT_PUBLIC_SLUG_ROUTE;
        private String internalApiKey;

        private Builder(String signingSecret) {
            this.signingSecret = signingSecret;
        }

        public Builder issuer(String issuer) {
            this.issuer = issuer;
            return this;
        }

        public Builder audience(String audience) {
            this.audience = audience;
            return this;
        }

        public Builder tenantHeader(String tenantHeader) {
            this.tenantHeader = tenantHeader;
            return this;
        }

        public Builder strictTenantMode(boolean strictTenantMode) {
            this.strictTenantMode = strictTenantMode;
            return this;
        }

        public Builder clockSkew(Duration clockSkew) {
            this.clockSkew = clockSkew;
            return this;
        }

        public Builder lookupTimeout(Duration lookupTimeout) {
            this.lookupTimeout = lookupTimeout;
            return this;
        }

        public Builder publicSlugRoute(String publicSlugRoute) {
            this.publicSlugRoute = publicSlugRoute;
            return this;
        }

        public Builder internalApiKey(String internalApiKey) {
            this.internalApiKey = internalApiKey;
            return this;
        }

        public AccessControlSettings build() {
            return new AccessControlSettings(signingSecret, issuer, audience, tenantHeader,
                    strictTenantMode, clockSkew, lookupTimeout, publicSlugRoute, internalApiKey);
        }
    }
}
