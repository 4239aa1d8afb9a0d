package com.linlay.chatrunner.resilience;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Consecutive-failure circuit breaker for one upstream dependency.
 * <p>
 * A count-based window of {@code failureThreshold} calls with a 100% failure-rate threshold opens
 * the circuit exactly when the last {@code failureThreshold} calls all failed. After
 * {@code resetTimeout} the next permission request moves it to half-open, where a single trial call
 * is admitted. Only retryable failures (timeouts, 5xx, connection errors) count; any other
 * outcome means the dependency answered.
 */
public class UpstreamCircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(UpstreamCircuitBreaker.class);

    private final CircuitBreaker delegate;

    public UpstreamCircuitBreaker(String dependency, int failureThreshold, Duration resetTimeout) {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowType(SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(failureThreshold)
                .minimumNumberOfCalls(failureThreshold)
                .failureRateThreshold(100.0f)
                .slowCallRateThreshold(100.0f)
                .slowCallDurationThreshold(Duration.ofHours(1))
                .permittedNumberOfCallsInHalfOpenState(1)
                .waitDurationInOpenState(resetTimeout)
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .recordException(ex -> UpstreamErrors.classify(ex).retryable())
                .build();
        this.delegate = CircuitBreaker.of(dependency, config);
        this.delegate.getEventPublisher().onStateTransition(event ->
                log.warn("Circuit breaker '{}' {}", dependency, event.getStateTransition()));
    }

    public String dependency() {
        return delegate.getName();
    }

    public boolean tryAcquirePermission() {
        return delegate.tryAcquirePermission();
    }

    /**
     * Checks admission without spending the permit, so a later {@link #tryAcquirePermission()} for
     * the actual call still succeeds.
     */
    public boolean isCallPermitted() {
        if (!delegate.tryAcquirePermission()) {
            return false;
        }
        delegate.releasePermission();
        return true;
    }

    public void onSuccess(long elapsedNanos) {
        delegate.onSuccess(elapsedNanos, TimeUnit.NANOSECONDS);
    }

    public void onFailure(long elapsedNanos, Throwable failure) {
        delegate.onError(elapsedNanos, TimeUnit.NANOSECONDS, failure);
    }

    /**
     * Gives back a permit whose call produced no outcome, e.g. a cancelled call or a cache hit.
     */
    public void release() {
        delegate.releasePermission();
    }

    public String state() {
        return delegate.getState().name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    public int bufferedFailures() {
        return delegate.getMetrics().getNumberOfFailedCalls();
    }
}
