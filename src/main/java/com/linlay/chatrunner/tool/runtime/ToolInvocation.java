package com.linlay.chatrunner.tool.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.linlay.chatrunner.model.ErrorKind;

/**
 * Outcome of one tool call.
 *
 * @param result    tool output, set when {@code state} is {@code COMPLETED}
 * @param errorKind set when {@code state} is {@code FAILED}
 */
public record ToolInvocation(
        String callId,
        String toolName,
        String arguments,
        ToolInvocationState state,
        JsonNode result,
        ErrorKind errorKind,
        String errorMessage
) {

    public static ToolInvocation requested(String callId, String toolName, String arguments) {
        return new ToolInvocation(callId, toolName, arguments, ToolInvocationState.REQUESTED, null, null, null);
    }

    public ToolInvocation executing() {
        return new ToolInvocation(callId, toolName, arguments, ToolInvocationState.EXECUTING, null, null, null);
    }

    public ToolInvocation completed(JsonNode output) {
        return new ToolInvocation(callId, toolName, arguments, ToolInvocationState.COMPLETED, output, null, null);
    }

    public ToolInvocation failed(ErrorKind kind, String message) {
        return new ToolInvocation(callId, toolName, arguments, ToolInvocationState.FAILED, null, kind, message);
    }
}
