package com.linlay.chatrunner.frame;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.TextNode;

/**
 * One typed unit of the response stream. Structured types carry a JSON object or array, or that
 * value still encoded as a JSON string; numbers and booleans are refused so every frame survives
 * encoding and decoding unchanged.
 */
public record Frame(
        FrameType type,
        JsonNode payload
) {

    public Frame {
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        if (payload == null || payload.isMissingNode()) {
            payload = JsonNodeFactory.instance.nullNode();
        }
        if (type.structured() && payload.isValueNode() && !payload.isNull() && !payload.isTextual()) {
            throw new IllegalArgumentException(
                    "Payload of " + type.wireName() + " must be a JSON object or array, got " + payload.getNodeType());
        }
    }

    public static Frame text(FrameType type, String content) {
        return new Frame(type, TextNode.valueOf(content == null ? "" : content));
    }

    public static Frame textDelta(String content) {
        return text(FrameType.TEXT_DELTA, content);
    }

    /**
     * Payload as plain text: the string value for string payloads, the JSON form otherwise.
     */
    public String payloadText() {
        if (payload.isNull()) {
            return "";
        }
        return payload.isTextual() ? payload.asText() : payload.toString();
    }
}
