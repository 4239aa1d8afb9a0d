package com.linlay.chatrunner.resilience;

import com.linlay.chatrunner.config.ResilienceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.function.BooleanSupplier;

/**
 * Exponential backoff for retryable upstream failures: the n-th retry (0-based) waits
 * {@code baseDelay * 2^n}, capped at {@code maxDelay}. A stream that already produced output is
 * never retried, since replaying it would duplicate frames.
 */
public class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final int maxRetries;
    private final Duration baseDelay;
    private final Duration maxDelay;

    public RetryPolicy(int maxRetries, Duration baseDelay, Duration maxDelay) {
        this.maxRetries = Math.max(0, maxRetries);
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
    }

    public static RetryPolicy from(ResilienceProperties.Retry properties) {
        return new RetryPolicy(properties.maxRetries(), properties.baseDelay(), properties.maxDelay());
    }

    public Retry spec(BooleanSupplier outputStarted, String stage) {
        return Retry.backoff(maxRetries, baseDelay)
                .maxBackoff(maxDelay)
                .jitter(0D)
                .filter(ex -> !outputStarted.getAsBoolean() && UpstreamErrors.classify(ex).retryable())
                .doBeforeRetry(signal -> log.info("[{}] Retrying upstream call attempt={} after {}: {}",
                        stage,
                        signal.totalRetries() + 1,
                        UpstreamErrors.classify(signal.failure()).kind().code(),
                        signal.failure().getMessage()))
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    public Duration delayForAttempt(int attempt) {
        Duration delay = baseDelay.multipliedBy(1L << Math.min(attempt, 30));
        return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
    }

    public int maxRetries() {
        return maxRetries;
    }
}
