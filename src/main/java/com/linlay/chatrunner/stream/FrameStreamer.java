package com.linlay.chatrunner.stream;

import com.linlay.chatrunner.frame.Frame;
import com.linlay.chatrunner.frame.FrameCodec;
import com.linlay.chatrunner.frame.FrameType;
import com.linlay.chatrunner.model.ErrorKind;
import com.linlay.chatrunner.resilience.UpstreamException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * Turns the frame flux of one response into encoded lines, closes it with the {@code [DONE]}
 * sentinel and converts a failure of the whole stream into a terminal {@code error} frame.
 */
public class FrameStreamer {

    private static final Logger log = LoggerFactory.getLogger(FrameStreamer.class);
    private static final Duration DEFAULT_STREAM_TIMEOUT = Duration.ofMinutes(5);

    private final FrameCodec frameCodec;
    private final ObjectMapper objectMapper;
    private final Duration streamTimeout;

    public FrameStreamer(FrameCodec frameCodec, ObjectMapper objectMapper, Duration streamTimeout) {
        this.frameCodec = Objects.requireNonNull(frameCodec, "frameCodec cannot be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
        this.streamTimeout = streamTimeout != null ? streamTimeout : DEFAULT_STREAM_TIMEOUT;
    }

    public Flux<byte[]> stream(Flux<Frame> frames) {
        Objects.requireNonNull(frames, "frames cannot be null");
        return frames
                .map(frameCodec::encode)
                .timeout(streamTimeout)
                .onErrorResume(ex -> Flux.just(frameCodec.encode(toErrorFrame(ex))))
                .concatWith(Mono.fromSupplier(frameCodec::encodeDone));
    }

    private Frame toErrorFrame(Throwable ex) {
        ErrorKind kind;
        String message;
        if (ex instanceof TimeoutException) {
            kind = ErrorKind.UPSTREAM_TIMEOUT;
            message = "Stream timed out after " + streamTimeout;
        } else if (ex instanceof UpstreamException upstreamException) {
            kind = upstreamException.kind();
            message = upstreamException.getMessage();
        } else {
            kind = ErrorKind.INTERNAL_ERROR;
            message = "Internal error while streaming the response";
        }
        log.warn("Response stream failed kind={}: {}", kind.code(), ex.getMessage(), ex);
        ObjectNode error = objectMapper.createObjectNode();
        error.put("kind", kind.code());
        error.put("message", message);
        return new Frame(FrameType.ERROR, error);
    }
}
