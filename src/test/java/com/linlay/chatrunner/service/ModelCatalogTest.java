package com.linlay.chatrunner.service;

import com.linlay.chatrunner.model.ResolvedModel;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelCatalogTest {

    private final ModelCatalog catalog = TestModels.catalog();

    @Test
    void shouldResolveConfiguredModelAndFallBackToProviderModel() {
        assertThat(catalog.resolve("chat-model"))
                .isEqualTo(new ResolvedModel("chat-model", "test", "test-chat", true));
        assertThat(catalog.artifactModel().model()).isEqualTo("test-default");
        assertThat(catalog.resolve(" ").modelId()).isEqualTo("chat-model");
    }

    @Test
    void reasoningModelShouldHaveToolsDisabled() {
        assertThat(catalog.resolve("chat-model-reasoning").toolsEnabled()).isFalse();
    }

    @Test
    void unknownModelShouldBeRejected() {
        assertThat(catalog.isConfigured("gpt-unknown")).isFalse();
        assertThatThrownBy(() -> catalog.resolve("gpt-unknown"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("gpt-unknown");
        assertThat(catalog.modelIds()).contains("chat-model", "artifact-model");
    }
}
