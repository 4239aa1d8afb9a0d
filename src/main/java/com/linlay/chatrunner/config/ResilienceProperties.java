package com.linlay.chatrunner.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "chat.resilience")
public record ResilienceProperties(
        Duration upstreamTimeout,
        Cache cache,
        Retry retry,
        CircuitBreaker circuitBreaker
) {

    public ResilienceProperties {
        if (upstreamTimeout == null || upstreamTimeout.isNegative() || upstreamTimeout.isZero()) {
            upstreamTimeout = Duration.ofSeconds(30);
        }
        if (cache == null) {
            cache = new Cache(null, null, null, null, null);
        }
        if (retry == null) {
            retry = new Retry(null, null, null);
        }
        if (circuitBreaker == null) {
            circuitBreaker = new CircuitBreaker(null, null);
        }
    }

    /**
     * @param skipToolRequests bypass the cache entirely for calls that advertise tools
     */
    public record Cache(
            Boolean enabled,
            Duration ttl,
            Long maximumSize,
            Duration sweepInterval,
            Boolean skipToolRequests
    ) {
        public Cache {
            if (enabled == null) {
                enabled = Boolean.TRUE;
            }
            if (ttl == null || ttl.isNegative() || ttl.isZero()) {
                ttl = Duration.ofMinutes(5);
            }
            if (maximumSize == null || maximumSize <= 0) {
                maximumSize = 1_000L;
            }
            if (sweepInterval == null || sweepInterval.isNegative() || sweepInterval.isZero()) {
                sweepInterval = Duration.ofMinutes(1);
            }
            if (skipToolRequests == null) {
                skipToolRequests = Boolean.FALSE;
            }
        }
    }

    public record Retry(
            Integer maxRetries,
            Duration baseDelay,
            Duration maxDelay
    ) {
        public Retry {
            if (maxRetries == null || maxRetries < 0) {
                maxRetries = 3;
            }
            if (baseDelay == null || baseDelay.isNegative() || baseDelay.isZero()) {
                baseDelay = Duration.ofSeconds(1);
            }
            if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
                maxDelay = baseDelay.compareTo(Duration.ofSeconds(10)) > 0 ? baseDelay : Duration.ofSeconds(10);
            }
        }
    }

    public record CircuitBreaker(
            Integer failureThreshold,
            Duration resetTimeout
    ) {
        public CircuitBreaker {
            if (failureThreshold == null || failureThreshold < 1) {
                failureThreshold = 5;
            }
            if (resetTimeout == null || resetTimeout.toMillis() < 1) {
                resetTimeout = Duration.ofSeconds(60);
            }
        }
    }
}
