package com.linlay.chatrunner.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "chat.memory")
public class ConversationMemoryProperties {

    private int windowSize = 20;
    private int maxConversations = 10_000;

    public int getWindowSize() {
        return windowSize;
    }

    public void setWindowSize(int windowSize) {
        this.windowSize = Math.max(1, windowSize);
    }

    public int getMaxConversations() {
        return maxConversations;
    }

    public void setMaxConversations(int maxConversations) {
        this.maxConversations = Math.max(1, maxConversations);
    }
}
