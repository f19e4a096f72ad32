package com.keystone.security.authn;

import com.keystone.security.AccessControlSettings;
import com.keystone.security.InvalidCredentialException;
import com.keystone.security.Principal;
import com.keystone.security.tenant.TenantResolver;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Set;

/**
 * Verifies HS256-signed JWTs and builds the {@link Principal} from their claims.
 *
 * <p>Checks, in order: structure, algorithm, signature, expiry and not-before (with clock skew),
 * issuer, audience, subject, tenant claim and role claim. Any failure raises
 * {@link InvalidCredentialException}.
 */
public final class JwtTokenAuthenticator implements TokenAuthenticator {

    /** Claim carrying the caller's role names. */
    public static final String ROLES_CLAIM = "roles";

    private final JWSVerifier verifier;
    private final String issuer;
    private final String audience;
    private final Duration clockSkew;
    private final Clock clock;

    public JwtTokenAuthenticator(AccessControlSettings settings) {
        this(settings, Clock.systemUTC());
    }

    public JwtTokenAuthenticator(AccessControlSettings settings, Clock clock) {
        try {
            this.verifier = new MACVerifier(settings.signingKey());
        } catch (JOSEException e) {
            throw new IllegalArgumentException("Signing secret is not usable for HS256", e);
        }
        this.issuer = settings.issuer();
        this.audience = settings.audience();
        this.clockSkew = settings.clockSkew();
        this.clock = clock;
    }

    @Override
    public Principal authenticate(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidCredentialException("Credential is empty");
        }
        SignedJWT jwt;
        try {
            jwt = SignedJWT.parse(token);
        } catch (ParseException e) {
            throw new InvalidCredentialException("Credential is not a well-formed signed JWT", e);
        }
        if (!JWSAlgorithm.HS256.equals(jwt.getHeader().getAlgorithm())) {
            throw new InvalidCredentialException(
                    "Unsupported signing algorithm " + jwt.getHeader().getAlgorithm());
        }
        try {
            if (!jwt.verify(verifier)) {
                throw new InvalidCredentialException("Credential signature is invalid");
            }
            return toPrincipal(jwt.getJWTClaimsSet());
        } catch (JOSEException e) {
            throw new InvalidCredentialException("Credential signature could not be verified", e);
        } catch (ParseException e) {
            throw new InvalidCredentialException("Credential claims are malformed", e);
        }
    }

    private Principal toPrincipal(JWTClaimsSet claims) throws ParseException {
        Instant now = clock.instant();
        Instant expiresAt = toInstant(claims.getExpirationTime());
        if (expiresAt == null) {
            throw new InvalidCredentialException("Credential has no expiry");
        }
        if (now.isAfter(expiresAt.plus(clockSkew))) {
            throw new InvalidCredentialException("Credential has expired");
        }
        Instant notBefore = toInstant(claims.getNotBeforeTime());
        if (notBefore != null && now.plus(clockSkew).isBefore(notBefore)) {
            throw new InvalidCredentialException("Credential is not valid yet");
        }
        if (issuer != null && !issuer.equals(claims.getIssuer())) {
            throw new InvalidCredentialException("Credential was issued by an unexpected issuer");
        }
        if (audience != null) {
            List<String> audiences = claims.getAudience();
            if (audiences == null || !audiences.contains(audience)) {
                throw new InvalidCredentialException("Credential is not intended for this audience");
            }
        }
        String subject = claims.getSubject();
        if (subject == null || subject.isBlank()) {
            throw new InvalidCredentialException("Credential has no subject");
        }
        String tenantId = claims.getStringClaim(TenantResolver.TENANT_CLAIM);
        if (tenantId == null || tenantId.isBlank()) {
            throw new InvalidCredentialException("Credential has no tenant claim");
        }
        List<String> roles = claims.getStringListClaim(ROLES_CLAIM);
        return new Principal(
                subject,
                tenantId,
                roles == null ? Set.of() : Set.copyOf(roles),
                toInstant(claims.getIssueTime()),
                expiresAt);
    }

    private static Instant toInstant(Date date) {
        return date == null ? null : date.toInstant();
    }
}
