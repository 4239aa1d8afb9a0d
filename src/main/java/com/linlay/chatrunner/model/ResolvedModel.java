package com.linlay.chatrunner.model;

/**
 * A client-facing model id bound to a provider and its concrete model name.
 *
 * @param toolsEnabled whether tool definitions are sent with calls to this model
 */
public record ResolvedModel(
        String modelId,
        String providerKey,
        String model,
        boolean toolsEnabled
) {

    public ResolvedModel {
        if (modelId == null || modelId.isBlank()) {
            throw new IllegalArgumentException("modelId must not be null or blank");
        }
        if (providerKey == null || providerKey.isBlank()) {
            throw new IllegalArgumentException("providerKey must not be null or blank");
        }
        if (model == null || model.isBlank()) {
            throw new IllegalArgumentException("model must not be null or blank");
        }
    }

    public ResolvedModel(String modelId, String providerKey, String model) {
        this(modelId, providerKey, model, true);
    }
}
