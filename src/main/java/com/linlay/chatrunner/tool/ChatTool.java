package com.linlay.chatrunner.tool;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * A server-side function the model may call during a response.
 * <p>
 * Arguments have already been validated against {@link #parametersSchema()} when
 * {@link #invoke(Map, ToolContext)} runs. A tool that streams its own content writes it through
 * {@link ToolContext#writer()}, which is the writer of the surrounding response. Failures are
 * reported by throwing.
 */
public interface ChatTool {

    String name();

    default String description() {
        return "";
    }

    Map<String, Object> parametersSchema();

    JsonNode invoke(Map<String, Object> args, ToolContext context);
}
