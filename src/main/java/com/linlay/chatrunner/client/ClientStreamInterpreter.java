package com.linlay.chatrunner.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.chatrunner.frame.Frame;
import com.linlay.chatrunner.frame.FramePayloads;
import com.linlay.chatrunner.frame.FrameType;
import com.linlay.chatrunner.model.ArtifactKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Rebuilds the {@link Artifact} of one response from its frame log.
 * <p>
 * {@link #consume(List)} may be called repeatedly with the same, growing log: a cursor remembers
 * how many frames were already applied, so every frame is applied exactly once. Structured frames
 * whose payload arrives as a JSON string are parsed here; one that cannot be parsed is skipped and
 * processing continues with the next frame. Not thread-safe: one interpreter per response.
 * <p>
 * A document is open from its {@code kind}, {@code id} or {@code clear} frame until
 * {@code finish}, {@code tool-complete}, {@code tool-error} or {@code error}. Only while a document
 * is open do {@code text-delta} frames feed the artifact; outside it they are the assistant's reply
 * and collect in {@link #messageText()}. Kind-specific deltas always belong to the artifact.
 */
public class ClientStreamInterpreter {

    private static final Logger log = LoggerFactory.getLogger(ClientStreamInterpreter.class);

    private final ObjectMapper objectMapper;
    private Artifact artifact = Artifact.initial();
    private final StringBuilder messageText = new StringBuilder();
    private boolean documentOpen;
    private JsonNode routing;
    private int cursor;
    private int skipped;

    public ClientStreamInterpreter(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
    }

    public Artifact consume(List<Frame> frameLog) {
        if (frameLog == null) {
            return artifact;
        }
        if (frameLog.size() < cursor) {
            throw new IllegalStateException("Frame log shrank from " + cursor + " to " + frameLog.size());
        }
        while (cursor < frameLog.size()) {
            Frame frame = frameLog.get(cursor++);
            if (frame != null) {
                apply(frame);
            }
        }
        return artifact;
    }

    public Artifact artifact() {
        return artifact;
    }

    public int cursor() {
        return cursor;
    }

    /**
     * Assistant reply text, i.e. the {@code text-delta} frames that arrived while no document was open.
     */
    public String messageText() {
        return messageText.toString();
    }

    public boolean documentOpen() {
        return documentOpen;
    }

    public int skippedFrames() {
        return skipped;
    }

    /**
     * Payload of the {@code model-routing} frame, empty until it arrives.
     */
    public Optional<JsonNode> routing() {
        return Optional.ofNullable(routing);
    }

    private void apply(Frame frame) {
        FrameType type = frame.type();
        JsonNode payload = frame.payload();
        if (type.structured()) {
            Optional<JsonNode> normalized = FramePayloads.normalize(type, payload, objectMapper);
            if (normalized.isEmpty()) {
                skipped++;
                log.warn("Skipping {} frame with unparseable payload: {}", type.wireName(), frame.payloadText());
                return;
            }
            payload = normalized.get();
        }

        switch (type) {
            case TEXT_DELTA -> {
                if (documentOpen) {
                    artifact = artifact.appendContent(frame.payloadText());
                } else {
                    messageText.append(frame.payloadText());
                }
            }
            case CODE_DELTA, SHEET_DELTA, IMAGE_DELTA -> artifact = artifact.appendContent(frame.payloadText());
            case ID -> {
                documentOpen = true;
                artifact = artifact.withDocumentId(frame.payloadText());
            }
            case TITLE -> artifact = artifact.withTitle(frame.payloadText());
            case KIND -> {
                documentOpen = true;
                artifact = artifact.withKind(ArtifactKind.fromWireName(frame.payloadText()).orElse(artifact.kind()));
            }
            case CLEAR -> {
                documentOpen = true;
                artifact = artifact.cleared().withStatus(ArtifactStatus.STREAMING);
            }
            case TOOL_START -> artifact = artifact.withStatus(ArtifactStatus.STREAMING);
            case FINISH, TOOL_COMPLETE -> {
                documentOpen = false;
                artifact = artifact.withStatus(ArtifactStatus.IDLE);
            }
            case TOOL_ERROR, ERROR -> {
                documentOpen = false;
                artifact = artifact.failed(errorMessage(payload));
            }
            case SUGGESTION -> artifact = artifact.withSuggestion(payload);
            case MODEL_ROUTING -> routing = payload;
            case TOOL_CALL, TOOL_RESULT -> {
                // tool traffic only; the artifact follows start/complete/error
            }
        }
    }

    private String errorMessage(JsonNode payload) {
        if (payload.hasNonNull("message")) {
            return payload.get("message").asText();
        }
        JsonNode legacy = payload.path("error");
        return legacy.isTextual() ? legacy.asText() : legacy.toString();
    }
}
