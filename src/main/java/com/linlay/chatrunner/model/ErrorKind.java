package com.linlay.chatrunner.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ErrorKind {

    DECODE_ERROR("decode_error", false),
    INVALID_ARGUMENTS("invalid_arguments", false),
    TOOL_EXECUTION_ERROR("tool_execution_error", false),
    UPSTREAM_TIMEOUT("upstream_timeout", true),
    UPSTREAM_5XX("upstream_5xx", true),
    CONNECTION_ERROR("connection_error", true),
    UPSTREAM_4XX("upstream_4xx", false),
    AUTH_ERROR("auth_error", false),
    SERVICE_DEGRADED("service_degraded", false),
    INTERNAL_ERROR("internal_error", false);

    private final String code;
    private final boolean retryable;

    ErrorKind(String code, boolean retryable) {
        this.code = code;
        this.retryable = retryable;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public boolean retryable() {
        return retryable;
    }
}
