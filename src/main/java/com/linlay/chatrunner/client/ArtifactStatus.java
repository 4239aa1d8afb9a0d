package com.linlay.chatrunner.client;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ArtifactStatus {

    IDLE,
    STREAMING;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
