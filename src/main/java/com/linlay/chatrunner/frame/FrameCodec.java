package com.linlay.chatrunner.frame;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/**
 * Newline-delimited frame codec.
 * <p>
 * Frames are written as {@code {"type":..., "content":...}} for string payloads and
 * {@code {"type":..., "data":{...}}} for structured payloads. The decoder additionally accepts the
 * numeric-prefixed forms {@code 1:<text>}, {@code 0:<json frame>} and {@code 9:<json error>},
 * an SSE {@code data:} prefix, and the {@code [DONE]} sentinel.
 */
public class FrameCodec {

    private static final Logger log = LoggerFactory.getLogger(FrameCodec.class);

    public static final String DONE_SENTINEL = "[DONE]";

    private static final String SSE_DATA_PREFIX = "data:";
    private static final String LEGACY_DATA_PREFIX = "0:";
    private static final String LEGACY_TEXT_PREFIX = "1:";
    private static final String LEGACY_ERROR_PREFIX = "9:";

    private final ObjectMapper objectMapper;

    public FrameCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
    }

    public byte[] encode(Frame frame) {
        return (encodeLine(frame) + '\n').getBytes(StandardCharsets.UTF_8);
    }

    public String encodeLine(Frame frame) {
        Objects.requireNonNull(frame, "frame cannot be null");
        ObjectNode root = objectMapper.createObjectNode();
        root.put("type", frame.type().wireName());
        JsonNode payload = frame.payload();
        if (!payload.isNull()) {
            if (frame.type().structured()) {
                if (payload.isTextual()) {
                    throw new IllegalArgumentException(
                            "Structured payload of " + frame.type().wireName() + " must not be a JSON string");
                }
                root.set("data", payload);
            } else {
                root.set("content", payload);
            }
        }
        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Cannot serialize frame " + frame.type().wireName(), ex);
        }
    }

    public byte[] encodeDone() {
        return (DONE_SENTINEL + '\n').getBytes(StandardCharsets.UTF_8);
    }

    public FrameDecodeResult decode(byte[] bytes) {
        if (bytes == null) {
            return new FrameDecodeResult.Blank();
        }
        return decode(new String(bytes, StandardCharsets.UTF_8));
    }

    public FrameDecodeResult decode(String rawLine) {
        String line = stripLineEnding(rawLine);
        if (line == null || line.isBlank()) {
            return new FrameDecodeResult.Blank();
        }
        if (line.startsWith(SSE_DATA_PREFIX)) {
            line = line.substring(SSE_DATA_PREFIX.length());
            if (line.startsWith(" ")) {
                line = line.substring(1);
            }
            if (line.isBlank()) {
                return new FrameDecodeResult.Blank();
            }
        }
        if (DONE_SENTINEL.equals(line.trim())) {
            return new FrameDecodeResult.EndOfStream();
        }
        if (line.startsWith(LEGACY_TEXT_PREFIX)) {
            return new FrameDecodeResult.Decoded(Frame.textDelta(line.substring(LEGACY_TEXT_PREFIX.length())));
        }
        if (line.startsWith(LEGACY_DATA_PREFIX)) {
            return decodeStructured(line, line.substring(LEGACY_DATA_PREFIX.length()));
        }
        if (line.startsWith(LEGACY_ERROR_PREFIX)) {
            return decodeLegacyError(line, line.substring(LEGACY_ERROR_PREFIX.length()));
        }
        if (line.trim().startsWith("{")) {
            return decodeStructured(line, line);
        }
        return dropped(line, "unrecognized frame encoding");
    }

    private FrameDecodeResult decodeStructured(String line, String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (Exception ex) {
            return dropped(line, "malformed JSON");
        }
        if (root == null || !root.isObject()) {
            return dropped(line, "frame is not a JSON object");
        }
        String typeName = root.path("type").isTextual() ? root.path("type").asText() : null;
        Optional<FrameType> type = FrameType.fromWireName(typeName);
        if (type.isEmpty()) {
            return dropped(line, "unknown frame type " + typeName);
        }
        JsonNode data = root.get("data");
        JsonNode payload = data != null && !data.isNull() ? data : root.get("content");
        Optional<JsonNode> normalized = FramePayloads.normalize(type.get(), payload, objectMapper);
        if (normalized.isEmpty()) {
            return dropped(line, "malformed payload for " + type.get().wireName());
        }
        return new FrameDecodeResult.Decoded(new Frame(type.get(), normalized.get()));
    }

    private FrameDecodeResult decodeLegacyError(String line, String json) {
        try {
            JsonNode root = objectMapper.readTree(json);
            if (root != null && root.isObject()) {
                return new FrameDecodeResult.Decoded(new Frame(FrameType.ERROR, root));
            }
            ObjectNode error = objectMapper.createObjectNode();
            error.set("error", root == null ? TextNode.valueOf("") : root);
            return new FrameDecodeResult.Decoded(new Frame(FrameType.ERROR, error));
        } catch (Exception ex) {
            return dropped(line, "malformed error frame");
        }
    }

    private FrameDecodeResult dropped(String line, String reason) {
        log.warn("Dropping undecodable frame ({}): {}", reason, abbreviate(line));
        return new FrameDecodeResult.DecodeError(line, reason);
    }

    private String stripLineEnding(String line) {
        if (line == null) {
            return null;
        }
        int end = line.length();
        while (end > 0 && (line.charAt(end - 1) == '\n' || line.charAt(end - 1) == '\r')) {
            end--;
        }
        return line.substring(0, end);
    }

    private String abbreviate(String line) {
        if (line == null || line.length() <= 200) {
            return line;
        }
        return line.substring(0, 200) + "...";
    }
}
