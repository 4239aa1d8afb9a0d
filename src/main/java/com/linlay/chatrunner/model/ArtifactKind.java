package com.linlay.chatrunner.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

public enum ArtifactKind {

    TEXT,
    CODE,
    SHEET,
    IMAGE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<ArtifactKind> fromWireName(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        for (ArtifactKind kind : values()) {
            if (kind.wireName().equalsIgnoreCase(raw.trim())) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
