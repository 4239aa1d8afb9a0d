package com.linlay.chatrunner.security;

import com.linlay.chatrunner.config.AppAuthProperties;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.crypto.RSASSAVerifier;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.net.URI;
import java.security.KeyFactory;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.X509EncodedKeySpec;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;

/**
 * Verifies RS256 bearer tokens against a configured PEM key and an optional JWKS endpoint.
 * A token is accepted when it is signed by one of those keys, carries a subject, has not expired
 * and, if an issuer is configured, names that issuer.
 */
@Component
public class JwtVerifier {

    private static final Logger log = LoggerFactory.getLogger(JwtVerifier.class);

    private final AppAuthProperties authProperties;
    private final Clock clock;
    private final Object jwksLock = new Object();

    private volatile RSAKey localKey;
    private volatile CachedJwkSet cachedJwkSet;

    @Autowired
    public JwtVerifier(AppAuthProperties authProperties) {
        this(authProperties, Clock.systemUTC());
    }

    JwtVerifier(AppAuthProperties authProperties, Clock clock) {
        this.authProperties = authProperties;
        this.clock = clock;
    }

    @PostConstruct
    void initialize() {
        if (StringUtils.hasText(authProperties.getLocalPublicKey())) {
            localKey = parsePublicKey(authProperties.getLocalPublicKey());
        }
        if (authProperties.isEnabled() && localKey == null && !StringUtils.hasText(authProperties.getJwksUri())) {
            log.warn("chat.auth is enabled but neither local-public-key nor jwks-uri is set; every call will be rejected");
        }
    }

    public Optional<AuthenticatedUser> verify(String token) {
        if (!StringUtils.hasText(token)) {
            return Optional.empty();
        }
        SignedJWT jwt;
        JWTClaimsSet claims;
        try {
            jwt = SignedJWT.parse(token.trim());
            claims = jwt.getJWTClaimsSet();
        } catch (Exception ex) {
            log.debug("Rejected malformed bearer token: {}", ex.getMessage());
            return Optional.empty();
        }
        if (!JWSAlgorithm.RS256.equals(jwt.getHeader().getAlgorithm())) {
            return Optional.empty();
        }
        if (!claimsAcceptable(claims)) {
            return Optional.empty();
        }
        if (!signedByLocalKey(jwt) && !signedByJwksKey(jwt)) {
            log.debug("Rejected bearer token for subject {}: signature not verified", claims.getSubject());
            return Optional.empty();
        }
        return Optional.of(toUser(claims));
    }

    private boolean claimsAcceptable(JWTClaimsSet claims) {
        if (claims == null || !StringUtils.hasText(claims.getSubject())) {
            return false;
        }
        if (claims.getExpirationTime() == null) {
            return false;
        }
        Instant now = clock.instant();
        Instant expiresAt = claims.getExpirationTime().toInstant();
        if (expiresAt.plusSeconds(authProperties.getClockSkewSeconds()).isBefore(now)) {
            return false;
        }
        String expectedIssuer = authProperties.getIssuer();
        return !StringUtils.hasText(expectedIssuer) || expectedIssuer.equals(claims.getIssuer());
    }

    private boolean signedByLocalKey(SignedJWT jwt) {
        RSAKey key = localKey;
        return key != null && verifySignature(jwt, key);
    }

    private boolean signedByJwksKey(SignedJWT jwt) {
        for (RSAKey key : jwksCandidates(jwt.getHeader().getKeyID())) {
            if (verifySignature(jwt, key)) {
                return true;
            }
        }
        return false;
    }

    private List<RSAKey> jwksCandidates(String keyId) {
        JWKSet jwkSet = loadJwkSet();
        if (jwkSet == null) {
            return List.of();
        }
        List<RSAKey> matching = new ArrayList<>();
        List<RSAKey> all = new ArrayList<>();
        for (JWK jwk : jwkSet.getKeys()) {
            if (jwk instanceof RSAKey rsaKey) {
                all.add(rsaKey);
                if (keyId != null && keyId.equals(rsaKey.getKeyID())) {
                    matching.add(rsaKey);
                }
            }
        }
        return matching.isEmpty() ? all : matching;
    }

    private JWKSet loadJwkSet() {
        if (!StringUtils.hasText(authProperties.getJwksUri())) {
            return null;
        }
        Instant now = clock.instant();
        CachedJwkSet current = cachedJwkSet;
        if (current != null && now.isBefore(current.expiresAt())) {
            return current.jwkSet();
        }
        synchronized (jwksLock) {
            CachedJwkSet latest = cachedJwkSet;
            if (latest != null && now.isBefore(latest.expiresAt())) {
                return latest.jwkSet();
            }
            try {
                JWKSet loaded = JWKSet.load(URI.create(authProperties.getJwksUri().trim()).toURL());
                cachedJwkSet = new CachedJwkSet(loaded, now.plusSeconds(authProperties.getJwksCacheSeconds()));
                log.info("Loaded {} key(s) from {}", loaded.getKeys().size(), authProperties.getJwksUri());
                return loaded;
            } catch (Exception ex) {
                log.warn("Failed to load JWKS from {}: {}", authProperties.getJwksUri(), ex.getMessage());
                return latest == null ? null : latest.jwkSet();
            }
        }
    }

    private boolean verifySignature(SignedJWT jwt, RSAKey key) {
        try {
            return jwt.verify(new RSASSAVerifier(key.toRSAPublicKey()));
        } catch (JOSEException ex) {
            return false;
        }
    }

    private AuthenticatedUser toUser(JWTClaimsSet claims) {
        Object scope = claims.getClaim("scope");
        Instant issuedAt = claims.getIssueTime() == null ? null : claims.getIssueTime().toInstant();
        return new AuthenticatedUser(
                claims.getSubject(),
                scope == null ? null : String.valueOf(scope),
                issuedAt,
                claims.getExpirationTime().toInstant()
        );
    }

    static RSAKey parsePublicKey(String pem) {
        String base64 = pem
                .replace("-----BEGIN PUBLIC KEY-----", "")
                .replace("-----END PUBLIC KEY-----", "")
                .replaceAll("\\s+", "");
        if (base64.isEmpty()) {
            throw new IllegalStateException("chat.auth.local-public-key cannot be blank");
        }
        try {
            byte[] der = Base64.getDecoder().decode(base64);
            RSAPublicKey publicKey = (RSAPublicKey) KeyFactory.getInstance("RSA")
                    .generatePublic(new X509EncodedKeySpec(der));
            return new RSAKey.Builder(publicKey).build();
        } catch (Exception ex) {
            throw new IllegalStateException("chat.auth.local-public-key is not a valid PEM RSA public key", ex);
        }
    }

    private record CachedJwkSet(JWKSet jwkSet, Instant expiresAt) {
    }
}
