package com.linlay.chatrunner.frame;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Optional;

/**
 * Brings a frame payload into the shape its type expects.
 * <p>
 * Structured frame types accept either an already-parsed JSON value or a JSON-encoded string; the
 * string is parsed once here. Nothing else in the pipeline parses payloads.
 */
public final class FramePayloads {

    private FramePayloads() {
    }

    public static Optional<JsonNode> normalize(FrameType type, JsonNode payload, ObjectMapper objectMapper) {
        if (payload == null || payload.isNull() || payload.isMissingNode()) {
            return Optional.of(objectMapper.getNodeFactory().nullNode());
        }
        if (!type.structured()) {
            return Optional.of(payload);
        }
        if (payload.isContainerNode()) {
            return Optional.of(payload);
        }
        if (!payload.isTextual()) {
            return Optional.empty();
        }
        try {
            JsonNode parsed = objectMapper.readTree(payload.asText());
            if (parsed == null || !parsed.isContainerNode()) {
                return Optional.empty();
            }
            return Optional.of(parsed);
        } catch (Exception ex) {
            return Optional.empty();
        }
    }
}
