package com.linlay.chatrunner.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.chatrunner.model.LlmDelta;
import com.linlay.chatrunner.model.ToolCallDelta;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parses one OpenAI-compatible {@code chat.completion.chunk} event into an {@link LlmDelta}.
 * Keep-alives, the {@code [DONE]} marker and unparseable chunks yield {@code null}.
 */
public class OpenAiSseDeltaParser {

    private static final Logger log = LoggerFactory.getLogger(OpenAiSseDeltaParser.class);

    private final ObjectMapper objectMapper;

    public OpenAiSseDeltaParser(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
    }

    public LlmDelta parseOrNull(String rawChunk) {
        String payload = stripEnvelope(rawChunk);
        if (payload == null) {
            return null;
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (Exception ex) {
            log.warn("Skipping unparseable upstream chunk: {}", rawChunk);
            return null;
        }
        if (root == null || !root.isObject()) {
            return null;
        }

        Map<String, Object> usage = parseUsage(root.get("usage"));
        JsonNode choices = root.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            return usage.isEmpty() ? null : new LlmDelta(null, null, null, usage);
        }

        JsonNode choice = choices.get(0);
        JsonNode delta = choice.path("delta");
        String content = optionalText(delta.get("content"));
        String finishReason = optionalText(choice.get("finish_reason"));
        List<ToolCallDelta> toolCalls = parseToolCalls(delta.path("tool_calls"));

        if (isEmpty(content) && toolCalls.isEmpty() && isEmpty(finishReason) && usage.isEmpty()) {
            return null;
        }
        return new LlmDelta(content, toolCalls, finishReason, usage);
    }

    private List<ToolCallDelta> parseToolCalls(JsonNode toolCallsNode) {
        if (!toolCallsNode.isArray()) {
            return List.of();
        }
        List<ToolCallDelta> toolCalls = new ArrayList<>();
        for (JsonNode node : toolCallsNode) {
            String id = optionalText(node.get("id"));
            Integer index = node.path("index").canConvertToInt() ? node.path("index").asInt() : null;
            JsonNode function = node.path("function");
            String name = optionalText(function.get("name"));
            String arguments = optionalText(function.get("arguments"));
            if (isEmpty(id) && index == null && isEmpty(name) && isEmpty(arguments)) {
                continue;
            }
            toolCalls.add(new ToolCallDelta(id, index, optionalText(node.get("type")), name, arguments));
        }
        return toolCalls;
    }

    private Map<String, Object> parseUsage(JsonNode usageNode) {
        Map<String, Object> usage = new LinkedHashMap<>();
        if (usageNode == null || !usageNode.isObject()) {
            return usage;
        }
        usageNode.fields().forEachRemaining(entry -> {
            JsonNode value = entry.getValue();
            if (value.isIntegralNumber()) {
                usage.put(entry.getKey(), value.asLong());
            } else if (value.isNumber()) {
                usage.put(entry.getKey(), value.doubleValue());
            } else if (value.isTextual()) {
                usage.put(entry.getKey(), value.asText());
            }
        });
        return usage;
    }

    private String stripEnvelope(String rawChunk) {
        if (rawChunk == null || rawChunk.isBlank()) {
            return null;
        }
        String payload = rawChunk.trim();
        if (payload.startsWith("data:")) {
            payload = payload.substring(5).trim();
        }
        if (payload.isEmpty() || "[DONE]".equals(payload)) {
            return null;
        }
        return payload;
    }

    private String optionalText(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        return node.isTextual() ? node.asText() : node.toString();
    }

    private boolean isEmpty(String text) {
        return text == null || text.isEmpty();
    }
}
