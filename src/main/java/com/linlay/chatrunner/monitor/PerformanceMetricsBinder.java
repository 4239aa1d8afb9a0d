package com.linlay.chatrunner.monitor;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.stereotype.Component;

/**
 * Publishes the {@link PerformanceMonitor} counters as {@code chat.upstream.*} meters.
 */
@Component
public class PerformanceMetricsBinder implements MeterBinder {

    private final PerformanceMonitor monitor;

    public PerformanceMetricsBinder(PerformanceMonitor monitor) {
        this.monitor = monitor;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        FunctionCounter.builder("chat.upstream.requests", monitor, m -> m.snapshot().requestCount())
                .description("Upstream model calls since the last reset")
                .register(registry);
        FunctionCounter.builder("chat.upstream.errors", monitor, m -> m.snapshot().errorCount())
                .description("Failed upstream model calls since the last reset")
                .register(registry);
        FunctionCounter.builder("chat.upstream.tokens", monitor, m -> m.snapshot().tokensGenerated())
                .register(registry);
        FunctionCounter.builder("chat.upstream.cache.hits", monitor, m -> m.snapshot().cacheHits())
                .register(registry);
        FunctionCounter.builder("chat.upstream.cache.misses", monitor, m -> m.snapshot().cacheMisses())
                .register(registry);
        FunctionCounter.builder("chat.upstream.circuit.rejections", monitor, m -> m.snapshot().circuitRejections())
                .register(registry);
        Gauge.builder("chat.upstream.latency.avg", monitor, m -> m.snapshot().averageLatencyMs())
                .baseUnit("milliseconds")
                .register(registry);
    }
}
