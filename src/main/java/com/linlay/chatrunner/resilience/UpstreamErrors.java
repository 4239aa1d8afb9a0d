package com.linlay.chatrunner.resilience;

import com.linlay.chatrunner.model.ErrorKind;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Maps failures of an upstream call onto the {@link ErrorKind} taxonomy.
 */
public final class UpstreamErrors {

    private UpstreamErrors() {
    }

    public static UpstreamException classify(Throwable ex) {
        if (ex instanceof UpstreamException upstreamException) {
            return upstreamException;
        }
        if (ex instanceof WebClientResponseException responseException) {
            int status = responseException.getStatusCode().value();
            return new UpstreamException(kindForStatus(status),
                    "Upstream responded with HTTP " + status, status, ex);
        }
        if (ex instanceof TimeoutException || ex.getCause() instanceof TimeoutException) {
            return new UpstreamException(ErrorKind.UPSTREAM_TIMEOUT, "Upstream call timed out", null, ex);
        }
        if (isConnectionError(ex)) {
            return new UpstreamException(ErrorKind.CONNECTION_ERROR,
                    "Upstream connection failed: " + ex.getMessage(), null, ex);
        }
        return new UpstreamException(ErrorKind.INTERNAL_ERROR,
                ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage(), null, ex);
    }

    public static ErrorKind kindForStatus(int status) {
        if (status == 401 || status == 403) {
            return ErrorKind.AUTH_ERROR;
        }
        if (status >= 500) {
            return ErrorKind.UPSTREAM_5XX;
        }
        return ErrorKind.UPSTREAM_4XX;
    }

    private static boolean isConnectionError(Throwable ex) {
        if (ex instanceof WebClientRequestException || ex instanceof IOException) {
            return true;
        }
        Throwable cause = ex.getCause();
        return cause instanceof IOException;
    }
}
