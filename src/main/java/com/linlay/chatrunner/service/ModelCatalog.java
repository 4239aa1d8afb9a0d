package com.linlay.chatrunner.service;

import com.linlay.chatrunner.config.ChatProviderProperties;
import com.linlay.chatrunner.model.ResolvedModel;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Optional;
import java.util.Set;

/**
 * Resolves client model ids against {@code chat.models}.
 */
@Service
public class ModelCatalog {

    private final ChatProviderProperties properties;

    public ModelCatalog(ChatProviderProperties properties) {
        this.properties = properties;
    }

    public Optional<ResolvedModel> find(String modelId) {
        if (!StringUtils.hasText(modelId)) {
            return Optional.empty();
        }
        String key = modelId.trim();
        ChatProviderProperties.ModelConfig config = properties.getModels().get(key);
        if (config == null || !StringUtils.hasText(config.getProvider())) {
            return Optional.empty();
        }
        String model = StringUtils.hasText(config.getModel())
                ? config.getModel()
                : Optional.ofNullable(properties.getProvider(config.getProvider()))
                .map(ChatProviderProperties.ProviderConfig::getModel)
                .orElse(null);
        if (!StringUtils.hasText(model)) {
            return Optional.empty();
        }
        return Optional.of(new ResolvedModel(key, config.getProvider(), model, config.isToolsEnabled()));
    }

    /**
     * @throws IllegalArgumentException when the id is not configured
     */
    public ResolvedModel resolve(String modelId) {
        String effective = StringUtils.hasText(modelId) ? modelId.trim() : properties.getDefaultModelId();
        return find(effective).orElseThrow(() -> new IllegalArgumentException("Unknown model id: " + effective));
    }

    public ResolvedModel artifactModel() {
        return resolve(properties.getArtifactModelId());
    }

    public String defaultModelId() {
        return properties.getDefaultModelId();
    }

    public boolean isConfigured(String modelId) {
        return find(modelId).isPresent();
    }

    public Set<String> modelIds() {
        return Set.copyOf(properties.getModels().keySet());
    }
}
