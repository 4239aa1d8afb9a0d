package com.linlay.chatrunner.model;

import java.util.List;
import java.util.Map;

/**
 * One parsed chunk of an upstream streaming completion.
 */
public record LlmDelta(
        String content,
        List<ToolCallDelta> toolCalls,
        String finishReason,
        Map<String, Object> usage
) {

    public LlmDelta {
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
        usage = usage == null ? Map.of() : Map.copyOf(usage);
    }

    public static LlmDelta content(String content) {
        return new LlmDelta(content, null, null, null);
    }

    public boolean hasContent() {
        return content != null && !content.isEmpty();
    }

    public long completionTokens() {
        Object raw = usage.get("completion_tokens");
        return raw instanceof Number number ? number.longValue() : 0L;
    }
}
