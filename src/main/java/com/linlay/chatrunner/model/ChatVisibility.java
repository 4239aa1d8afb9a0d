package com.linlay.chatrunner.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ChatVisibility {

    PUBLIC,
    PRIVATE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ChatVisibility fromWireName(String raw) {
        if (raw == null || raw.isBlank()) {
            return PRIVATE;
        }
        for (ChatVisibility visibility : values()) {
            if (visibility.wireName().equalsIgnoreCase(raw.trim())) {
                return visibility;
            }
        }
        throw new IllegalArgumentException("Unknown visibility: " + raw);
    }
}
