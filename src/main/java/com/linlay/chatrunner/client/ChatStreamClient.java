package com.linlay.chatrunner.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.chatrunner.frame.Frame;
import com.linlay.chatrunner.frame.FrameCodec;
import com.linlay.chatrunner.frame.FrameDecodeResult;
import com.linlay.chatrunner.model.ChatRequest;
import com.linlay.chatrunner.resilience.UpstreamErrors;
import com.linlay.chatrunner.resilience.UpstreamException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Consumes {@code POST /api/chat} and emits the artifact after every applied frame.
 * <p>
 * Lines are decoded with the {@link FrameCodec}, undecodable lines are dropped, and consumption
 * stops at {@code [DONE]} or when the body ends. Cancelling the returned flux closes the
 * connection and discards the partial artifact. A rejected request surfaces as an
 * {@link UpstreamException}: {@code auth_error} for 401, {@code service_degraded} for 503.
 */
public class ChatStreamClient {

    private static final Logger log = LoggerFactory.getLogger(ChatStreamClient.class);

    private final WebClient webClient;
    private final FrameCodec frameCodec;
    private final ObjectMapper objectMapper;

    public ChatStreamClient(WebClient webClient, FrameCodec frameCodec, ObjectMapper objectMapper) {
        this.webClient = Objects.requireNonNull(webClient, "webClient cannot be null");
        this.frameCodec = Objects.requireNonNull(frameCodec, "frameCodec cannot be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
    }

    public Flux<Artifact> stream(ChatRequest request, String bearerToken) {
        return Flux.defer(() -> {
            List<Frame> frameLog = new ArrayList<>();
            ClientStreamInterpreter interpreter = new ClientStreamInterpreter(objectMapper);
            return lines(request, bearerToken)
                    .map(frameCodec::decode)
                    .takeWhile(result -> !(result instanceof FrameDecodeResult.EndOfStream))
                    .ofType(FrameDecodeResult.Decoded.class)
                    .map(decoded -> {
                        frameLog.add(decoded.frame());
                        return interpreter.consume(frameLog);
                    })
                    .doOnCancel(() -> log.debug("Chat {} consumption cancelled after {} frame(s)",
                            request.conversationId(), interpreter.cursor()));
        });
    }

    private Flux<String> lines(ChatRequest request, String bearerToken) {
        return webClient.post()
                .uri("/api/chat")
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_NDJSON)
                .headers(headers -> {
                    if (StringUtils.hasText(bearerToken)) {
                        headers.set(HttpHeaders.AUTHORIZATION, "Bearer " + bearerToken);
                    }
                })
                .bodyValue(request)
                .retrieve()
                .bodyToFlux(String.class)
                .onErrorMap(WebClientResponseException.class, this::toUpstreamException);
    }

    private UpstreamException toUpstreamException(WebClientResponseException ex) {
        if (ex.getStatusCode().value() == HttpStatus.SERVICE_UNAVAILABLE.value()) {
            return UpstreamException.serviceDegraded("chat-api");
        }
        return UpstreamErrors.classify(ex);
    }
}
