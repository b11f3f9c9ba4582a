package org.openphc.insight.realtime.delivery;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.source.ImmutableJWKSet;
import com.nimbusds.jose.jwk.source.JWKSource;
import com.nimbusds.jose.jwk.source.JWKSourceBuilder;
import com.nimbusds.jose.proc.BadJOSEException;
import com.nimbusds.jose.proc.JWSVerificationKeySelector;
import com.nimbusds.jose.proc.SecurityContext;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.proc.ConfigurableJWTProcessor;
import com.nimbusds.jwt.proc.DefaultJWTClaimsVerifier;
import com.nimbusds.jwt.proc.DefaultJWTProcessor;
import lombok.extern.slf4j.Slf4j;
import org.openphc.insight.realtime.api.exception.ConnectionRejectedException;
import org.openphc.insight.realtime.config.RealtimeProperties;
import org.openphc.insight.realtime.domain.model.enums.DisconnectReason;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.net.MalformedURLException;
import java.net.URL;
import java.text.ParseException;
import java.util.HashSet;
import java.util.Set;

/**
 * Verifies client access tokens (signed JWTs) against the identity provider's keys.
 * The subject is the user id; the tenant comes from a configurable claim.
 */
@Component
@Slf4j
public class TokenVerifier {

    private static final Set<JWSAlgorithm> ALGORITHMS = Set.of(
            JWSAlgorithm.RS256, JWSAlgorithm.RS384, JWSAlgorithm.RS512,
            JWSAlgorithm.ES256, JWSAlgorithm.ES384);

    private final ConfigurableJWTProcessor<SecurityContext> processor;
    private final String tenantClaim;

    @Autowired
    public TokenVerifier(RealtimeProperties properties) {
        this(keySource(properties.getAuth()), properties.getAuth());
    }

    public TokenVerifier(JWKSource<SecurityContext> keySource, RealtimeProperties.Auth auth) {
        this.tenantClaim = auth.getTenantClaim();
        DefaultJWTProcessor<SecurityContext> jwtProcessor = new DefaultJWTProcessor<>();
        jwtProcessor.setJWSKeySelector(new JWSVerificationKeySelector<>(ALGORITHMS, keySource));
        JWTClaimsSet.Builder exact = new JWTClaimsSet.Builder();
        if (auth.getIssuer() != null && !auth.getIssuer().isBlank()) {
            exact.issuer(auth.getIssuer());
        }
        Set<String> required = new HashSet<>(Set.of("sub", "exp", tenantClaim));
        jwtProcessor.setJWTClaimsSetVerifier(new DefaultJWTClaimsVerifier<>(
                auth.getAudience() == null || auth.getAudience().isBlank() ? null : auth.getAudience(),
                exact.build(), required));
        this.processor = jwtProcessor;
    }

    public AuthenticatedPrincipal verify(String token) {
        if (token == null || token.isBlank()) {
            throw new ConnectionRejectedException("Missing access token", DisconnectReason.UNAUTHORIZED);
        }
        try {
            JWTClaimsSet claims = processor.process(token, null);
            String tenantId = claims.getStringClaim(tenantClaim);
            if (tenantId == null || tenantId.isBlank()) {
                throw new ConnectionRejectedException("Token has no tenant", DisconnectReason.UNAUTHORIZED);
            }
            return new AuthenticatedPrincipal(claims.getSubject(), tenantId);
        } catch (ParseException | BadJOSEException | JOSEException e) {
            throw new ConnectionRejectedException("Invalid access token: " + e.getMessage(),
                    DisconnectReason.UNAUTHORIZED, e);
        }
    }

    private static JWKSource<SecurityContext> keySource(RealtimeProperties.Auth auth) {
        try {
            if (auth.getJwkSet() != null && !auth.getJwkSet().isBlank()) {
                return new ImmutableJWKSet<>(JWKSet.parse(auth.getJwkSet()));
            }
            if (auth.getJwksUrl() == null || auth.getJwksUrl().isBlank()) {
                throw new IllegalStateException("Either insight.auth.jwk-set or insight.auth.jwks-url must be set");
            }
            log.info("Verifying access tokens against {}", auth.getJwksUrl());
            return JWKSourceBuilder.create(new URL(auth.getJwksUrl())).retrying(true).build();
        } catch (ParseException | MalformedURLException e) {
            throw new IllegalStateException("Invalid token verification key configuration", e);
        }
    }
}
