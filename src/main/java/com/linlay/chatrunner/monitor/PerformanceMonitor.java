package com.linlay.chatrunner.monitor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;

/**
 * Process-wide counters for upstream model calls, shared by every chat session.
 * <p>
 * Counters only grow; {@link #reset()} is the operator action that zeroes them.
 */
@Component
public class PerformanceMonitor {

    private static final Logger log = LoggerFactory.getLogger(PerformanceMonitor.class);

    private final Clock clock;
    private final LongAdder requestCount = new LongAdder();
    private final LongAdder totalLatencyMs = new LongAdder();
    private final LongAdder errorCount = new LongAdder();
    private final LongAdder tokensGenerated = new LongAdder();
    private final LongAdder cacheHits = new LongAdder();
    private final LongAdder cacheMisses = new LongAdder();
    private final LongAdder circuitRejections = new LongAdder();
    private final AtomicReference<Instant> lastReset;

    public PerformanceMonitor() {
        this(Clock.systemUTC());
    }

    public PerformanceMonitor(Clock clock) {
        this.clock = clock;
        this.lastReset = new AtomicReference<>(clock.instant());
    }

    public void recordSuccess(long latencyMs, long tokens) {
        requestCount.increment();
        totalLatencyMs.add(Math.max(0L, latencyMs));
        tokensGenerated.add(Math.max(0L, tokens));
    }

    public void recordFailure(long latencyMs) {
        requestCount.increment();
        errorCount.increment();
        totalLatencyMs.add(Math.max(0L, latencyMs));
    }

    public void recordCacheHit() {
        cacheHits.increment();
    }

    public void recordCacheMiss() {
        cacheMisses.increment();
    }

    public void recordCircuitRejection() {
        circuitRejections.increment();
    }

    public synchronized void reset() {
        requestCount.reset();
        totalLatencyMs.reset();
        errorCount.reset();
        tokensGenerated.reset();
        cacheHits.reset();
        cacheMisses.reset();
        circuitRejections.reset();
        lastReset.set(clock.instant());
        log.info("Performance metrics reset");
    }

    public synchronized PerformanceSnapshot snapshot() {
        return new PerformanceSnapshot(
                requestCount.sum(),
                totalLatencyMs.sum(),
                errorCount.sum(),
                tokensGenerated.sum(),
                cacheHits.sum(),
                cacheMisses.sum(),
                circuitRejections.sum(),
                lastReset.get(),
                clock.instant()
        );
    }
}
