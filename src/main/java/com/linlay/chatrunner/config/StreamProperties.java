package com.linlay.chatrunner.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "chat.stream")
public record StreamProperties(
        Duration timeout
) {

    public StreamProperties {
        if (timeout == null) {
            timeout = Duration.ofMinutes(5);
        }
    }
}
