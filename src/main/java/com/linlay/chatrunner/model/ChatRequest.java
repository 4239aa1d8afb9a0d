package com.linlay.chatrunner.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ChatRequest(
        @NotBlank String conversationId,
        @NotBlank @Size(max = 32_000) String message,
        String modelId,
        ChatVisibility visibility
) {

    public ChatRequest {
        visibility = visibility == null ? ChatVisibility.PRIVATE : visibility;
    }
}
