package com.linlay.chatrunner.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Gradual rollout of a cheaper model behind the default chat model id.
 */
@ConfigurationProperties(prefix = "chat.routing")
public class RoutingProperties {

    private boolean enabled = false;
    private int trafficPercentage = 5;
    private String sourceModelId = "chat-model";
    private String targetModelId = "gemini-flash-lite";
    private String forceModelId;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getTrafficPercentage() {
        return trafficPercentage;
    }

    public void setTrafficPercentage(int trafficPercentage) {
        this.trafficPercentage = Math.max(0, Math.min(100, trafficPercentage));
    }

    public String getSourceModelId() {
        return sourceModelId;
    }

    public void setSourceModelId(String sourceModelId) {
        this.sourceModelId = sourceModelId;
    }

    public String getTargetModelId() {
        return targetModelId;
    }

    public void setTargetModelId(String targetModelId) {
        this.targetModelId = targetModelId;
    }

    public String getForceModelId() {
        return forceModelId;
    }

    public void setForceModelId(String forceModelId) {
        this.forceModelId = forceModelId;
    }
}
