package com.linlay.chatrunner.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "chat.llm.interaction-log")
public class LlmInteractionLogProperties {

    private boolean enabled = true;
    private boolean maskSensitive = true;
    private boolean logChunks = false;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isMaskSensitive() {
        return maskSensitive;
    }

    public void setMaskSensitive(boolean maskSensitive) {
        this.maskSensitive = maskSensitive;
    }

    public boolean isLogChunks() {
        return logChunks;
    }

    public void setLogChunks(boolean logChunks) {
        this.logChunks = logChunks;
    }
}
