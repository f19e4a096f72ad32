package com.keystone.security.authn;

import com.keystone.security.AccessControlSettings;
import com.keystone.security.tenant.TenantResolver;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.UUID;

/**
 * Issues HS256 tokens that {@link JwtTokenAuthenticator} accepts under the same settings.
 */
public final class JwtTokenIssuer {

    private final JWSSigner signer;
    private final String issuer;
    private final String audience;
    private final Clock clock;

    public JwtTokenIssuer(AccessControlSettings settings) {
        this(settings, Clock.systemUTC());
    }

    public JwtTokenIssuer(AccessControlSettings settings, Clock clock) {
        try {
            this.signer = new MACSigner(settings.signingKey());
        } catch (JOSEException e) {
            throw new IllegalArgumentException("Signing secret is not usable for HS256", e);
        }
        this.issuer = settings.issuer();
        this.audience = settings.audience();
        this.clock = clock;
    }

    /**
     * Issues a token for {@code subject} in {@code tenantId} with the given roles.
     *
     * @param ttl how long the token stays valid
     */
    public String issue(String subject, String tenantId, Collection<String> roles, Duration ttl) {
        Instant now = clock.instant();
        var claims = new JWTClaimsSet.Builder()
                .jwtID(UUID.randomUUID().toString())
                .subject(subject)
                .issuer(issuer)
                .claim(TenantResolver.TENANT_CLAIM, tenantId)
                .claim(JwtTokenAuthenticator.ROLES_CLAIM, List.copyOf(roles))
                .issueTime(Date.from(now))
                .expirationTime(Date.from(now.plus(ttl)));
        if (audience != null) {
            claims.audience(audience);
        }
        return sign(claims.build());
    }

    /** Signs arbitrary claims with the configured secret. */
    public String sign(JWTClaimsSet claims) {
        try {
            var jwt = new SignedJWT(new JWSHeader(JWSAlgorithm.HS256), claims);
            jwt.sign(signer);
            return jwt.serialize();
        } catch (JOSEException e) {
            throw new IllegalStateException("Failed to sign token", e);
        }
    }
}
