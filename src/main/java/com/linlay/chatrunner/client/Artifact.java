package com.linlay.chatrunner.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.linlay.chatrunner.model.ArtifactKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Client-side view of the document a response is producing.
 *
 * @param documentId  set once an {@code id} frame arrives
 * @param content     concatenation of the document's content deltas since the last {@code clear}
 * @param suggestions payloads of the {@code suggestion} frames, in arrival order
 * @param error       message of the last {@code tool-error} or {@code error} frame
 */
public record Artifact(
        String documentId,
        ArtifactKind kind,
        String title,
        String content,
        ArtifactStatus status,
        boolean visible,
        List<JsonNode> suggestions,
        String error
) {

    public Artifact {
        kind = kind == null ? ArtifactKind.TEXT : kind;
        title = title == null ? "" : title;
        content = content == null ? "" : content;
        status = status == null ? ArtifactStatus.IDLE : status;
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    public static Artifact initial() {
        return new Artifact(null, ArtifactKind.TEXT, "", "", ArtifactStatus.IDLE, false, List.of(), null);
    }

    Artifact withDocumentId(String value) {
        return new Artifact(value, kind, title, content, ArtifactStatus.STREAMING, true, suggestions, error);
    }

    Artifact withKind(ArtifactKind value) {
        return new Artifact(documentId, value, title, content, ArtifactStatus.STREAMING, true, suggestions, error);
    }

    Artifact withTitle(String value) {
        return new Artifact(documentId, kind, value, content, ArtifactStatus.STREAMING, visible, suggestions, error);
    }

    Artifact appendContent(String delta) {
        return new Artifact(documentId, kind, title, content + delta, ArtifactStatus.STREAMING, visible,
                suggestions, error);
    }

    Artifact cleared() {
        return new Artifact(documentId, kind, title, "", status, visible, suggestions, error);
    }

    Artifact withStatus(ArtifactStatus value) {
        return new Artifact(documentId, kind, title, content, value, visible, suggestions, error);
    }

    Artifact withSuggestion(JsonNode suggestion) {
        List<JsonNode> next = new ArrayList<>(suggestions);
        next.add(suggestion);
        return new Artifact(documentId, kind, title, content, status, visible, next, error);
    }

    Artifact failed(String message) {
        return new Artifact(documentId, kind, title, content, ArtifactStatus.IDLE, visible, suggestions, message);
    }
}
