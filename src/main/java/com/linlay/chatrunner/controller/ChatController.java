package com.linlay.chatrunner.controller;

import com.linlay.chatrunner.config.ResilienceConfiguration;
import com.linlay.chatrunner.model.ChatRequest;
import com.linlay.chatrunner.resilience.ResilientModelClient;
import com.linlay.chatrunner.resilience.UpstreamException;
import com.linlay.chatrunner.security.ApiJwtAuthWebFilter;
import com.linlay.chatrunner.security.AuthenticatedUser;
import com.linlay.chatrunner.service.ChatStreamService;
import com.linlay.chatrunner.service.ModelCatalog;
import com.linlay.chatrunner.stream.FrameFlushWriter;
import com.linlay.chatrunner.stream.FrameStreamer;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api")
public class ChatController {

    private static final Logger log = LoggerFactory.getLogger(ChatController.class);

    static final String ANONYMOUS_USER = "anonymous";

    private final ChatStreamService chatStreamService;
    private final ModelCatalog modelCatalog;
    private final ResilientModelClient modelClient;
    private final FrameStreamer frameStreamer;
    private final FrameFlushWriter frameFlushWriter;

    public ChatController(
            ChatStreamService chatStreamService,
            ModelCatalog modelCatalog,
            ResilientModelClient modelClient,
            FrameStreamer frameStreamer,
            FrameFlushWriter frameFlushWriter
    ) {
        this.chatStreamService = chatStreamService;
        this.modelCatalog = modelCatalog;
        this.modelClient = modelClient;
        this.frameStreamer = frameStreamer;
        this.frameFlushWriter = frameFlushWriter;
    }

    @PostMapping("/chat")
    public Mono<Void> chat(
            @Valid @RequestBody ChatRequest request,
            ServerHttpResponse response,
            ServerWebExchange exchange
    ) {
        if (StringUtils.hasText(request.modelId()) && !modelCatalog.isConfigured(request.modelId().trim())) {
            throw new IllegalArgumentException("Unknown model id: " + request.modelId());
        }
        if (!modelClient.isCallPermitted()) {
            log.warn("Refusing chat {}: circuit is {}", request.conversationId(), modelClient.circuitState());
            throw UpstreamException.serviceDegraded(ResilienceConfiguration.MODEL_DEPENDENCY);
        }
        String userId = resolveUserId(exchange);
        log.info("Chat {} from {} model={} visibility={}",
                request.conversationId(), userId, request.modelId(), request.visibility().wireName());
        return frameFlushWriter.write(response, frameStreamer.stream(chatStreamService.stream(request, userId)));
    }

    private String resolveUserId(ServerWebExchange exchange) {
        Object raw = exchange.getAttribute(ApiJwtAuthWebFilter.USER_ATTR);
        if (raw instanceof AuthenticatedUser user) {
            return user.subject();
        }
        return ANONYMOUS_USER;
    }
}
