package com.linlay.chatrunner.security;

import com.linlay.chatrunner.config.AppAuthProperties;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.crypto.RSASSASigner;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jose.jwk.gen.RSAKeyGenerator;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.Date;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JwtVerifierTest {

    private static final String ISSUER = "https://auth.example.local";
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private static RSAKey rsaKey;
    private static RSAKey otherKey;
    private static Path jwksFile;

    @BeforeAll
    static void beforeAll() throws Exception {
        rsaKey = new RSAKeyGenerator(2048).keyID("test-kid").generate();
        otherKey = new RSAKeyGenerator(2048).keyID("other-kid").generate();
        jwksFile = Files.createTempFile("chat-runner-jwks-", ".json");
        Files.writeString(jwksFile, new JWKSet(rsaKey.toPublicJWK()).toJSONObject().toString(), StandardCharsets.UTF_8);
    }

    @AfterAll
    static void afterAll() throws Exception {
        if (jwksFile != null) {
            Files.deleteIfExists(jwksFile);
        }
    }

    @Test
    void shouldAcceptTokenSignedByLocalKey() throws Exception {
        JwtVerifier verifier = localKeyVerifier();

        Optional<AuthenticatedUser> user = verifier.verify(issueToken(rsaKey, ISSUER, "app-user", NOW.plusSeconds(300)));

        assertThat(user).isPresent();
        assertThat(user.get().subject()).isEqualTo("app-user");
        assertThat(user.get().scope()).isEqualTo("app");
    }

    @Test
    void shouldRejectExpiredToken() throws Exception {
        JwtVerifier verifier = localKeyVerifier();

        assertThat(verifier.verify(issueToken(rsaKey, ISSUER, "app-user", NOW.minusSeconds(120)))).isEmpty();
    }

    @Test
    void shouldToleratePastExpiryWithinClockSkew() throws Exception {
        JwtVerifier verifier = localKeyVerifier();

        assertThat(verifier.verify(issueToken(rsaKey, ISSUER, "app-user", NOW.minusSeconds(10)))).isPresent();
    }

    @Test
    void shouldRejectTokenFromOtherIssuer() throws Exception {
        JwtVerifier verifier = localKeyVerifier();

        assertThat(verifier.verify(issueToken(rsaKey, "https://evil.example", "app-user", NOW.plusSeconds(300))))
                .isEmpty();
    }

    @Test
    void shouldRejectTokenSignedByUnknownKey() throws Exception {
        JwtVerifier verifier = localKeyVerifier();

        assertThat(verifier.verify(issueToken(otherKey, ISSUER, "app-user", NOW.plusSeconds(300)))).isEmpty();
    }

    @Test
    void shouldRejectTokenWithoutSubject() throws Exception {
        JwtVerifier verifier = localKeyVerifier();

        assertThat(verifier.verify(issueToken(rsaKey, ISSUER, null, NOW.plusSeconds(300)))).isEmpty();
    }

    @Test
    void shouldRejectNonRs256Token() throws Exception {
        JwtVerifier verifier = localKeyVerifier();
        SignedJWT jwt = new SignedJWT(new JWSHeader(JWSAlgorithm.HS256), claims(ISSUER, "app-user", NOW.plusSeconds(300)));
        jwt.sign(new MACSigner("0123456789abcdef0123456789abcdef".getBytes(StandardCharsets.UTF_8)));

        assertThat(verifier.verify(jwt.serialize())).isEmpty();
    }

    @Test
    void shouldRejectBlankAndMalformedTokens() {
        JwtVerifier verifier = localKeyVerifier();

        assertThat(verifier.verify(null)).isEmpty();
        assertThat(verifier.verify("  ")).isEmpty();
        assertThat(verifier.verify("not-a-jwt")).isEmpty();
    }

    @Test
    void shouldAcceptTokenSignedByJwksKey() throws Exception {
        AppAuthProperties properties = baseProperties();
        properties.setJwksUri(jwksFile.toUri().toString());
        JwtVerifier verifier = new JwtVerifier(properties, Clock.fixed(NOW, ZoneOffset.UTC));
        verifier.initialize();

        assertThat(verifier.verify(issueToken(rsaKey, ISSUER, "jwks-user", NOW.plusSeconds(300))))
                .map(AuthenticatedUser::subject)
                .contains("jwks-user");
        assertThat(verifier.verify(issueToken(otherKey, ISSUER, "jwks-user", NOW.plusSeconds(300)))).isEmpty();
    }

    @Test
    void shouldRejectEverythingWhenNoKeyIsConfigured() throws Exception {
        JwtVerifier verifier = new JwtVerifier(baseProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
        verifier.initialize();

        assertThat(verifier.verify(issueToken(rsaKey, ISSUER, "app-user", NOW.plusSeconds(300)))).isEmpty();
    }

    @Test
    void shouldFailFastOnInvalidPublicKey() {
        assertThatThrownBy(() -> JwtVerifier.parsePublicKey("-----BEGIN PUBLIC KEY-----\nAAAA\n-----END PUBLIC KEY-----"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("local-public-key");
        assertThatThrownBy(() -> JwtVerifier.parsePublicKey("-----BEGIN PUBLIC KEY-----\n-----END PUBLIC KEY-----"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("blank");
    }

    private JwtVerifier localKeyVerifier() {
        AppAuthProperties properties = baseProperties();
        properties.setLocalPublicKey(toPem(rsaKey));
        JwtVerifier verifier = new JwtVerifier(properties, Clock.fixed(NOW, ZoneOffset.UTC));
        verifier.initialize();
        return verifier;
    }

    private AppAuthProperties baseProperties() {
        AppAuthProperties properties = new AppAuthProperties();
        properties.setEnabled(true);
        properties.setIssuer(ISSUER);
        return properties;
    }

    private static String toPem(RSAKey key) {
        try {
            String body = Base64.getMimeEncoder(64, "\n".getBytes(StandardCharsets.US_ASCII))
                    .encodeToString(key.toRSAPublicKey().getEncoded());
            return "-----BEGIN PUBLIC KEY-----\n" + body + "\n-----END PUBLIC KEY-----\n";
        } catch (JOSEException ex) {
            throw new IllegalStateException(ex);
        }
    }

    private String issueToken(RSAKey key, String issuer, String subject, Instant expiresAt) throws JOSEException {
        SignedJWT jwt = new SignedJWT(
                new JWSHeader.Builder(JWSAlgorithm.RS256).keyID(key.getKeyID()).build(),
                claims(issuer, subject, expiresAt)
        );
        JWSSigner signer = new RSASSASigner(key.toPrivateKey());
        jwt.sign(signer);
        return jwt.serialize();
    }

    private JWTClaimsSet claims(String issuer, String subject, Instant expiresAt) {
        return new JWTClaimsSet.Builder()
                .issuer(issuer)
                .subject(subject)
                .issueTime(Date.from(NOW.minusSeconds(60)))
                .expirationTime(Date.from(expiresAt))
                .claim("scope", "app")
                .build();
    }
}
