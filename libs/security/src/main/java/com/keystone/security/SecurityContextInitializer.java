package com.keystone.security;

import com.keystone.context.ContextKey;
import com.keystone.context.RequestContextHolder;
import com.keystone.security.authn.TokenAuthenticator;
import com.keystone.security.tenant.TenantResolution;
import com.keystone.security.tenant.TenantResolver;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Populates the active request context before dispatch: resolves the tenant, then authenticates
 * the bearer credential if one is presented.
 *
 * <p>A rejected credential does not fail the request here. It is stored under
 * {@link SecurityContextKeys#CREDENTIAL_FAILURE} and the request continues anonymously; the
 * access decision pipeline reports it for operations that require a principal.
 */
public final class SecurityContextInitializer {

    private static final Logger log = LoggerFactory.getLogger(SecurityContextInitializer.class);

    private final TenantResolver tenantResolver;
    private final TokenAuthenticator authenticator;

    public SecurityContextInitializer(TenantResolver tenantResolver, TokenAuthenticator authenticator) {
        if (tenantResolver == null || authenticator == null) {
            throw new IllegalArgumentException("tenantResolver and authenticator must not be null");
        }
        this.tenantResolver = tenantResolver;
        this.authenticator = authenticator;
    }

    /**
     * @return the authenticated principal, if a valid credential was presented
     * @throws IllegalStateException if no request context is active
     */
    public Optional<Principal> initialize(InboundRequest request) {
        TenantResolution resolution = tenantResolver.resolveAndBind(request);
        Optional<String> token = request.bearerToken();
        if (token.isEmpty()) {
            return Optional.empty();
        }
        try {
            Principal principal = authenticator.authenticate(token.get());
            RequestContextHolder.set(SecurityContextKeys.PRINCIPAL, principal);
            RequestContextHolder.set(ContextKey.ACTOR_ID, principal.principalId());
            log.debug("Authenticated principal {} of tenant {} (request tenant {} via {})",
                    principal.principalId(), principal.tenantId(),
                    resolution.tenantId(), resolution.source());
            return Optional.of(principal);
        } catch (InvalidCredentialException | AccessDeniedException e) {
            log.info("Rejected bearer credential: {}", e.getMessage());
            RequestContextHolder.set(SecurityContextKeys.CREDENTIAL_FAILURE, e);
            return Optional.empty();
        }
    }
}
