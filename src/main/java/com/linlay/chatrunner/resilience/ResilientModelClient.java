package com.linlay.chatrunner.resilience;

import com.linlay.chatrunner.model.LlmDelta;
import com.linlay.chatrunner.model.ModelCall;
import com.linlay.chatrunner.monitor.PerformanceMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Upstream model calls wrapped as circuit breaker, then cache, then retry.
 * <p>
 * The circuit is checked first, so an open circuit fails fast with {@code service_degraded}
 * without touching the cache. A cache hit replays the stored deltas and skips the network. A miss
 * goes upstream under a per-chunk deadline and the retry policy; a successful text-only response is
 * stored. A cancelled call gives its circuit permit back and stores nothing.
 */
public class ResilientModelClient {

    private static final Logger log = LoggerFactory.getLogger(ResilientModelClient.class);

    private final UpstreamModelClient upstream;
    private final ResponseCache cache;
    private final RequestFingerprint fingerprint;
    private final RetryPolicy retryPolicy;
    private final UpstreamCircuitBreaker circuitBreaker;
    private final PerformanceMonitor monitor;
    private final Duration upstreamTimeout;
    private final boolean cacheEnabled;
    private final boolean skipToolRequests;

    public ResilientModelClient(
            UpstreamModelClient upstream,
            ResponseCache cache,
            RequestFingerprint fingerprint,
            RetryPolicy retryPolicy,
            UpstreamCircuitBreaker circuitBreaker,
            PerformanceMonitor monitor,
            Duration upstreamTimeout,
            boolean cacheEnabled,
            boolean skipToolRequests
    ) {
        this.upstream = Objects.requireNonNull(upstream, "upstream cannot be null");
        this.cache = Objects.requireNonNull(cache, "cache cannot be null");
        this.fingerprint = Objects.requireNonNull(fingerprint, "fingerprint cannot be null");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy cannot be null");
        this.circuitBreaker = Objects.requireNonNull(circuitBreaker, "circuitBreaker cannot be null");
        this.monitor = Objects.requireNonNull(monitor, "monitor cannot be null");
        this.upstreamTimeout = Objects.requireNonNull(upstreamTimeout, "upstreamTimeout cannot be null");
        this.cacheEnabled = cacheEnabled;
        this.skipToolRequests = skipToolRequests;
    }

    public Flux<LlmDelta> stream(ModelCall call) {
        Objects.requireNonNull(call, "call cannot be null");
        return Flux.defer(() -> {
            if (!circuitBreaker.tryAcquirePermission()) {
                monitor.recordCircuitRejection();
                log.warn("[{}] Rejected upstream call, circuit '{}' is {}",
                        call.stage(), circuitBreaker.dependency(), circuitBreaker.state());
                return Flux.error(UpstreamException.serviceDegraded(circuitBreaker.dependency()));
            }

            String key = isCacheable(call) ? fingerprint.fingerprint(call) : null;
            if (key != null) {
                Optional<CacheEntry> hit = cache.get(key);
                if (hit.isPresent()) {
                    circuitBreaker.release();
                    monitor.recordCacheHit();
                    log.debug("[{}] Serving upstream response from cache key={}", call.stage(), key);
                    return Flux.fromIterable(hit.get().deltas());
                }
                monitor.recordCacheMiss();
            }
            return callUpstream(call, key);
        });
    }

    /**
     * Whether a call arriving now would be admitted by the circuit breaker.
     */
    public boolean isCallPermitted() {
        return circuitBreaker.isCallPermitted();
    }

    public String circuitState() {
        return circuitBreaker.state();
    }

    public long cacheSize() {
        return cache.size();
    }

    private Flux<LlmDelta> callUpstream(ModelCall call, String cacheKey) {
        long startNanos = System.nanoTime();
        AtomicBoolean outputStarted = new AtomicBoolean(false);
        AtomicBoolean settled = new AtomicBoolean(false);
        List<LlmDelta> collected = new ArrayList<>();

        return Flux.defer(() -> upstream.stream(call))
                .timeout(upstreamTimeout)
                .doOnNext(delta -> {
                    outputStarted.set(true);
                    collected.add(delta);
                })
                .onErrorMap(UpstreamErrors::classify)
                .retryWhen(retryPolicy.spec(outputStarted::get, call.stage()))
                .doOnComplete(() -> {
                    if (!settled.compareAndSet(false, true)) {
                        return;
                    }
                    long elapsedNanos = System.nanoTime() - startNanos;
                    circuitBreaker.onSuccess(elapsedNanos);
                    monitor.recordSuccess(toMillis(elapsedNanos), countTokens(collected));
                    if (cacheKey != null && collected.stream().allMatch(delta -> delta.toolCalls().isEmpty())) {
                        cache.put(cacheKey, collected);
                    }
                })
                .doOnError(ex -> {
                    if (!settled.compareAndSet(false, true)) {
                        return;
                    }
                    long elapsedNanos = System.nanoTime() - startNanos;
                    circuitBreaker.onFailure(elapsedNanos, ex);
                    monitor.recordFailure(toMillis(elapsedNanos));
                    log.warn("[{}] Upstream call failed after {} ms: {}",
                            call.stage(), toMillis(elapsedNanos), ex.getMessage());
                })
                .doOnCancel(() -> {
                    if (!settled.compareAndSet(false, true)) {
                        return;
                    }
                    circuitBreaker.release();
                    log.info("[{}] Upstream call cancelled after {} ms",
                            call.stage(), toMillis(System.nanoTime() - startNanos));
                });
    }

    private boolean isCacheable(ModelCall call) {
        if (!cacheEnabled || !call.cacheable()) {
            return false;
        }
        return !(skipToolRequests && call.hasTools());
    }

    private long countTokens(List<LlmDelta> deltas) {
        long reported = deltas.stream().mapToLong(LlmDelta::completionTokens).sum();
        if (reported > 0) {
            return reported;
        }
        long chars = deltas.stream()
                .filter(LlmDelta::hasContent)
                .mapToLong(delta -> delta.content().length())
                .sum();
        return (chars + 3) / 4;
    }

    private long toMillis(long nanos) {
        return nanos / 1_000_000;
    }
}
