package com.linlay.chatrunner.service;

/**
 * Payload of the {@code model-routing} frame that opens every response.
 */
public record RoutingDecision(
        String requestedModel,
        String selectedModel,
        boolean routed
) {
}
