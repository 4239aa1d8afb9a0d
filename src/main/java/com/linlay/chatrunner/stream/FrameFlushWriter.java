package com.linlay.chatrunner.stream;

import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Writes encoded frame lines to the HTTP response, flushing after every line so intermediaries
 * do not hold partial output back.
 */
public class FrameFlushWriter {

    public static final MediaType NDJSON = MediaType.APPLICATION_NDJSON;

    public Mono<Void> write(ServerHttpResponse response, Flux<byte[]> lines) {
        response.getHeaders().setContentType(NDJSON);
        response.getHeaders().set("X-Accel-Buffering", "no");
        response.getHeaders().set("Cache-Control", "no-cache, no-transform");

        return response.writeAndFlushWith(
                lines.map(response.bufferFactory()::wrap)
                        .map(Mono::just)
        );
    }
}
