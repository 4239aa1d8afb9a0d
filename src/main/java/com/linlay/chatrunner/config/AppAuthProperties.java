package com.linlay.chatrunner.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Bearer token verification for the chat API.
 * <p>
 * Tokens are RS256 JWTs. They are checked against {@code local-public-key} (PEM) and, when
 * {@code jwks-uri} is set, against the keys published there. {@code issuer}, when set, must match.
 */
@ConfigurationProperties(prefix = "chat.auth")
public class AppAuthProperties {

    private boolean enabled = true;
    private String issuer;
    private String localPublicKey;
    private String jwksUri;
    private long jwksCacheSeconds = 300;
    private long clockSkewSeconds = 30;
    private List<String> protectedPaths = new ArrayList<>(List.of("/api/chat", "/api/performance"));

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getIssuer() {
        return issuer;
    }

    public void setIssuer(String issuer) {
        this.issuer = issuer;
    }

    public String getLocalPublicKey() {
        return localPublicKey;
    }

    public void setLocalPublicKey(String localPublicKey) {
        this.localPublicKey = localPublicKey;
    }

    public String getJwksUri() {
        return jwksUri;
    }

    public void setJwksUri(String jwksUri) {
        this.jwksUri = jwksUri;
    }

    public long getJwksCacheSeconds() {
        return jwksCacheSeconds;
    }

    public void setJwksCacheSeconds(long jwksCacheSeconds) {
        this.jwksCacheSeconds = Math.max(30L, jwksCacheSeconds);
    }

    public long getClockSkewSeconds() {
        return clockSkewSeconds;
    }

    public void setClockSkewSeconds(long clockSkewSeconds) {
        this.clockSkewSeconds = Math.max(0L, clockSkewSeconds);
    }

    public List<String> getProtectedPaths() {
        return protectedPaths;
    }

    public void setProtectedPaths(List<String> protectedPaths) {
        this.protectedPaths = protectedPaths == null ? new ArrayList<>() : new ArrayList<>(protectedPaths);
    }
}
