package com.linlay.chatrunner.config;

import com.linlay.chatrunner.monitor.PerformanceMonitor;
import com.linlay.chatrunner.resilience.RequestFingerprint;
import com.linlay.chatrunner.resilience.ResilientModelClient;
import com.linlay.chatrunner.resilience.ResponseCache;
import com.linlay.chatrunner.resilience.RetryPolicy;
import com.linlay.chatrunner.resilience.UpstreamCircuitBreaker;
import com.linlay.chatrunner.resilience.UpstreamModelClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ResilienceConfiguration {

    public static final String MODEL_DEPENDENCY = "model-api";

    @Bean
    public UpstreamCircuitBreaker modelCircuitBreaker(ResilienceProperties properties) {
        return new UpstreamCircuitBreaker(
                MODEL_DEPENDENCY,
                properties.circuitBreaker().failureThreshold(),
                properties.circuitBreaker().resetTimeout()
        );
    }

    @Bean
    public RetryPolicy modelRetryPolicy(ResilienceProperties properties) {
        return RetryPolicy.from(properties.retry());
    }

    @Bean
    public ResilientModelClient resilientModelClient(
            UpstreamModelClient upstreamModelClient,
            ResponseCache responseCache,
            RequestFingerprint requestFingerprint,
            RetryPolicy modelRetryPolicy,
            UpstreamCircuitBreaker modelCircuitBreaker,
            PerformanceMonitor performanceMonitor,
            ResilienceProperties properties
    ) {
        return new ResilientModelClient(
                upstreamModelClient,
                responseCache,
                requestFingerprint,
                modelRetryPolicy,
                modelCircuitBreaker,
                performanceMonitor,
                properties.upstreamTimeout(),
                properties.cache().enabled(),
                properties.cache().skipToolRequests()
        );
    }
}
