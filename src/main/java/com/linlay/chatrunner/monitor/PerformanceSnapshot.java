package com.linlay.chatrunner.monitor;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;

public record PerformanceSnapshot(
        long requestCount,
        long totalLatencyMs,
        long errorCount,
        long tokensGenerated,
        long cacheHits,
        long cacheMisses,
        long circuitRejections,
        Instant lastReset,
        Instant capturedAt
) {

    @JsonProperty
    public double averageLatencyMs() {
        return requestCount > 0 ? (double) totalLatencyMs / requestCount : 0D;
    }

    @JsonProperty
    public double errorRate() {
        return requestCount > 0 ? (double) errorCount / requestCount : 0D;
    }

    @JsonProperty
    public double cacheHitRate() {
        long lookups = cacheHits + cacheMisses;
        return lookups > 0 ? (double) cacheHits / lookups : 0D;
    }

    @JsonProperty
    public double requestsPerMinute() {
        if (lastReset == null || capturedAt == null) {
            return 0D;
        }
        double minutes = Duration.between(lastReset, capturedAt).toMillis() / 60_000D;
        return minutes > 0 ? requestCount / minutes : 0D;
    }

    @JsonProperty
    public double tokensPerRequest() {
        return requestCount > 0 ? (double) tokensGenerated / requestCount : 0D;
    }
}
