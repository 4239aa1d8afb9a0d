package com.linlay.chatrunner.model;

public record ToolCallDelta(
        String id,
        Integer index,
        String type,
        String name,
        String arguments
) {

    public ToolCallDelta {
        if (type == null || type.isBlank()) {
            type = "function";
        }
    }

    public ToolCallDelta(String id, String name, String arguments) {
        this(id, null, null, name, arguments);
    }
}
