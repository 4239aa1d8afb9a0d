package com.linlay.chatrunner.monitor;

import java.util.ArrayList;
import java.util.List;

/**
 * Operator-facing reading of a {@link PerformanceSnapshot}: health status, letter grade and hints.
 */
public record PerformanceReport(
        PerformanceSnapshot metrics,
        long cacheSize,
        String circuitState,
        String status,
        String grade,
        List<String> recommendations
) {

    public static PerformanceReport of(PerformanceSnapshot metrics, long cacheSize, String circuitState) {
        return new PerformanceReport(
                metrics,
                cacheSize,
                circuitState,
                status(metrics),
                grade(metrics),
                recommendations(metrics)
        );
    }

    static String status(PerformanceSnapshot metrics) {
        double errorRate = metrics.errorRate();
        if (errorRate < 0.05) {
            return "healthy";
        }
        return errorRate < 0.15 ? "warning" : "critical";
    }

    static String grade(PerformanceSnapshot metrics) {
        int score = 100;

        double latency = metrics.averageLatencyMs();
        if (latency > 5000) {
            score -= 30;
        } else if (latency > 3000) {
            score -= 20;
        } else if (latency > 2000) {
            score -= 10;
        }

        double errorRate = metrics.errorRate();
        if (errorRate > 0.1) {
            score -= 40;
        } else if (errorRate > 0.05) {
            score -= 20;
        } else if (errorRate > 0.01) {
            score -= 10;
        }

        double hitRate = metrics.cacheHitRate();
        if (hitRate < 0.1) {
            score -= 15;
        } else if (hitRate < 0.2) {
            score -= 10;
        } else if (hitRate > 0.5) {
            score += 5;
        }

        if (score >= 90) {
            return "A";
        }
        if (score >= 80) {
            return "B";
        }
        if (score >= 70) {
            return "C";
        }
        return score >= 60 ? "D" : "F";
    }

    static List<String> recommendations(PerformanceSnapshot metrics) {
        List<String> hints = new ArrayList<>();
        if (metrics.averageLatencyMs() > 3000) {
            hints.add("High latency detected. Consider a faster model or a longer cache TTL.");
        }
        if (metrics.errorRate() > 0.05) {
            hints.add("High error rate detected. Check upstream provider status and network connectivity.");
        }
        if (metrics.cacheHitRate() < 0.2 && metrics.requestCount() > 10) {
            hints.add("Low cache hit rate. Consider request deduplication or a longer cache TTL.");
        }
        if (metrics.requestsPerMinute() > 100) {
            hints.add("High request volume. Consider rate limiting.");
        }
        if (metrics.tokensPerRequest() > 2000) {
            hints.add("High average tokens per request. Consider tighter prompts or max_tokens limits.");
        }
        if (metrics.circuitRejections() > 0) {
            hints.add("Requests were rejected while the circuit breaker was open.");
        }
        if (hints.isEmpty()) {
            hints.add("Performance looks good. No immediate optimizations needed.");
        }
        return List.copyOf(hints);
    }
}
