package com.linlay.chatrunner.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Upstream providers and the client model ids served by them.
 * <pre>
 * chat:
 *   default-model-id: chat-model
 *   providers:
 *     openrouter: { base-url: ..., api-key: ..., model: ... }
 *   models:
 *     chat-model: { provider: openrouter, model: google/gemini-2.0-flash-lite-001 }
 *     chat-model-reasoning: { provider: openrouter, model: ..., tools-enabled: false }
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "chat")
public class ChatProviderProperties {

    private String defaultModelId = "chat-model";
    private String artifactModelId = "artifact-model";
    private Map<String, ProviderConfig> providers = new LinkedHashMap<>();
    private Map<String, ModelConfig> models = new LinkedHashMap<>();

    public String getDefaultModelId() {
        return defaultModelId;
    }

    public void setDefaultModelId(String defaultModelId) {
        this.defaultModelId = defaultModelId;
    }

    public String getArtifactModelId() {
        return artifactModelId;
    }

    public void setArtifactModelId(String artifactModelId) {
        this.artifactModelId = artifactModelId;
    }

    public Map<String, ProviderConfig> getProviders() {
        return providers;
    }

    public void setProviders(Map<String, ProviderConfig> providers) {
        this.providers = providers == null ? new LinkedHashMap<>() : providers;
    }

    public ProviderConfig getProvider(String key) {
        return providers.get(key);
    }

    public Map<String, ModelConfig> getModels() {
        return models;
    }

    public void setModels(Map<String, ModelConfig> models) {
        this.models = models == null ? new LinkedHashMap<>() : models;
    }

    public static class ProviderConfig {
        private String baseUrl;
        private String apiKey;
        private String model;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }
    }

    public static class ModelConfig {
        private String provider;
        private String model;
        private boolean toolsEnabled = true;

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public boolean isToolsEnabled() {
            return toolsEnabled;
        }

        public void setToolsEnabled(boolean toolsEnabled) {
            this.toolsEnabled = toolsEnabled;
        }
    }
}
