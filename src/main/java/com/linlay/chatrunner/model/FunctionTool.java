package com.linlay.chatrunner.model;

import java.util.Map;

/**
 * Function definition advertised to the upstream model.
 */
public record FunctionTool(
        String name,
        String description,
        Map<String, Object> parameters
) {

    public FunctionTool {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        description = description == null ? "" : description;
        parameters = parameters == null ? Map.of("type", "object", "properties", Map.of()) : parameters;
    }
}
