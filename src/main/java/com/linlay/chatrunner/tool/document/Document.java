package com.linlay.chatrunner.tool.document;

import com.linlay.chatrunner.model.ArtifactKind;

import java.time.Instant;

public record Document(
        String id,
        String title,
        ArtifactKind kind,
        String content,
        String userId,
        Instant createdAt
) {

    public Document {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        title = title == null ? "" : title;
        content = content == null ? "" : content;
    }

    public Document withContent(String newContent) {
        return new Document(id, title, kind, newContent, userId, createdAt);
    }
}
