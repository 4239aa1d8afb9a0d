package com.linlay.chatrunner.resilience;

import com.linlay.chatrunner.model.ErrorKind;

public class UpstreamException extends RuntimeException {

    private final ErrorKind kind;
    private final Integer statusCode;

    public UpstreamException(ErrorKind kind, String message) {
        this(kind, message, null, null);
    }

    public UpstreamException(ErrorKind kind, String message, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.kind = kind == null ? ErrorKind.INTERNAL_ERROR : kind;
        this.statusCode = statusCode;
    }

    public static UpstreamException serviceDegraded(String dependency) {
        return new UpstreamException(
                ErrorKind.SERVICE_DEGRADED,
                "Upstream dependency '" + dependency + "' is temporarily unavailable"
        );
    }

    public ErrorKind kind() {
        return kind;
    }

    public Integer statusCode() {
        return statusCode;
    }

    public boolean retryable() {
        return kind.retryable();
    }
}
