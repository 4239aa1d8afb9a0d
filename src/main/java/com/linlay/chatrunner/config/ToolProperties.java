package com.linlay.chatrunner.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * @param maxSteps model turns that may request tools within one response
 * @param timeout  upper bound for a single tool body
 */
@ConfigurationProperties(prefix = "chat.tools")
public record ToolProperties(
        Integer maxSteps,
        Duration timeout
) {

    public ToolProperties {
        if (maxSteps == null || maxSteps < 1) {
            maxSteps = 5;
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            timeout = Duration.ofSeconds(60);
        }
    }
}
