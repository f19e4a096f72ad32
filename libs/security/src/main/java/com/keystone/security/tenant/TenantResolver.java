package com.keystone.security.tenant;

import com.keystone.context.ContextKey;
import com.keystone.context.RequestContextHolder;
import com.keystone.security.AccessControlSettings;
import com.keystone.security.InboundRequest;
import com.keystone.security.SecurityContextKeys;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.JWTParser;
import com.nimbusds.jwt.SignedJWT;
import java.text.ParseException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Determines the tenant of a request from, in strict priority order:
 *
 * <ol>
 *   <li>the {@value #TENANT_CLAIM} claim of the bearer token, decoded without verifying the
 *       signature (the authenticator verifies it separately);
 *   <li>the tenant header;
 *   <li>the slug of a public route, looked up in the {@link TenantDirectory}.
 * </ol>
 *
 * <p>The first source that yields a value wins and later sources are not consulted, so a public
 * slug can never override a token claim. A failed slug lookup yields no tenant rather than an
 * error, with the failure kept on the {@link TenantResolution}; whether a missing tenant is
 * acceptable is decided by the access decision pipeline. Only signed tokens are read for a claim;
 * an encrypted or otherwise undecodable token counts as carrying none.
 */
public final class TenantResolver {

    private static final Logger log = LoggerFactory.getLogger(TenantResolver.class);

    /** Claim carrying the tenant id in bearer tokens. */
    public static final String TENANT_CLAIM = "tenantId";

    private final String tenantHeader;
    private final PublicSlugRoute slugRoute;
    private final TenantDirectory directory;

    /**
     * @param directory directory used for slug lookups; should already be time-bounded
     */
    public TenantResolver(AccessControlSettings settings, TenantDirectory directory) {
        if (settings == null || directory == null) {
            throw new IllegalArgumentException("settings and directory must not be null");
        }
        this.tenantHeader = settings.tenantHeader();
        this.slugRoute = new PublicSlugRoute(settings.publicSlugRoute());
        this.directory = directory;
    }

    /** Resolves the tenant of {@code request} without touching the request context. */
    public TenantResolution resolve(InboundRequest request) {
        String headerTenant = request.header(tenantHeader).orElse(null);

        Optional<String> fromToken = request.bearerToken().flatMap(TenantResolver::tenantClaim);
        if (fromToken.isPresent()) {
            return new TenantResolution(fromToken.get(), TenantSource.TOKEN_CLAIM, headerTenant);
        }
        if (headerTenant != null) {
            return new TenantResolution(headerTenant, TenantSource.HEADER, headerTenant);
        }
        Optional<String> slug = slugRoute.extractSlug(request.path());
        if (slug.isPresent()) {
            return lookupSlug(slug.get());
        }
        return TenantResolution.none(null);
    }

    /**
     * Resolves the tenant of {@code request} and writes it into the active request context.
     *
     * @throws IllegalStateException if no request context is active
     */
    public TenantResolution resolveAndBind(InboundRequest request) {
        TenantResolution resolution = resolve(request);
        RequestContextHolder.set(SecurityContextKeys.TENANT_RESOLUTION, resolution);
        RequestContextHolder.set(ContextKey.TENANT_ID, resolution.tenantId());
        log.debug("Resolved tenant {} from {}", resolution.tenantId(), resolution.source());
        return resolution;
    }

    private TenantResolution lookupSlug(String slug) {
        try {
            return directory.findTenantIdBySlug(slug)
                    .map(id -> new TenantResolution(id, TenantSource.PUBLIC_SLUG, null))
                    .orElseGet(() -> TenantResolution.none(null));
        } catch (TenantLookupException e) {
            log.warn("Tenant lookup for slug '{}' failed, continuing without tenant: {}",
                    slug, e.getMessage());
            return TenantResolution.unavailable(e);
        }
    }

    private static Optional<String> tenantClaim(String token) {
        try {
            if (!(JWTParser.parse(token) instanceof SignedJWT jwt)) {
                return Optional.empty();
            }
            JWTClaimsSet claims = jwt.getJWTClaimsSet();
            if (claims == null) {
                return Optional.empty();
            }
            String tenantId = claims.getStringClaim(TENANT_CLAIM);
            return tenantId == null || tenantId.isBlank() ? Optional.empty() : Optional.of(tenantId);
        } catch (ParseException e) {
            log.debug("Bearer token carries no readable tenant claim: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
