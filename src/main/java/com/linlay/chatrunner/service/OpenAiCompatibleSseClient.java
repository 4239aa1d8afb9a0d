package com.linlay.chatrunner.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.chatrunner.config.ChatProviderProperties;
import com.linlay.chatrunner.model.FunctionTool;
import com.linlay.chatrunner.model.LlmDelta;
import com.linlay.chatrunner.model.ModelCall;
import com.linlay.chatrunner.resilience.UpstreamModelClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Streams {@code chat/completions} from an OpenAI-compatible provider and parses every SSE chunk into
 * an {@link LlmDelta}.
 * <p>
 * Timeouts, retries and circuit breaking are applied by the caller.
 */
@Component
public class OpenAiCompatibleSseClient implements UpstreamModelClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleSseClient.class);

    private final ChatProviderProperties providerProperties;
    private final WebClient.Builder webClientBuilder;
    private final OpenAiSseDeltaParser deltaParser;
    private final LlmCallLogger callLogger;
    private final Map<String, WebClient> clientsByProvider = new ConcurrentHashMap<>();

    public OpenAiCompatibleSseClient(
            ChatProviderProperties providerProperties,
            WebClient.Builder upstreamWebClientBuilder,
            ObjectMapper objectMapper,
            LlmCallLogger callLogger
    ) {
        this.providerProperties = providerProperties;
        this.webClientBuilder = upstreamWebClientBuilder;
        this.deltaParser = new OpenAiSseDeltaParser(objectMapper);
        this.callLogger = callLogger;
    }

    @Override
    public Flux<LlmDelta> stream(ModelCall call) {
        return Flux.defer(() -> {
            ChatProviderProperties.ProviderConfig config = resolveProviderConfig(call.model().providerKey());
            WebClient webClient = clientsByProvider.computeIfAbsent(
                    call.model().providerKey(), key -> buildWebClient(config));
            String traceId = callLogger.newTraceId();
            long startNanos = System.nanoTime();
            StringBuilder transcript = new StringBuilder();
            callLogger.requestStart(traceId, call);

            return webClient.post()
                    .uri(resolveCompletionsUri(config.getBaseUrl()))
                    .accept(MediaType.TEXT_EVENT_STREAM)
                    .bodyValue(buildRequestBody(call))
                    .retrieve()
                    .bodyToFlux(String.class)
                    .doOnNext(rawChunk -> callLogger.rawChunk(traceId, call.stage(), rawChunk))
                    .<LlmDelta>handle((rawChunk, sink) -> {
                        LlmDelta delta = deltaParser.parseOrNull(rawChunk);
                        if (delta != null) {
                            sink.next(delta);
                        }
                    })
                    .doOnNext(delta -> callLogger.appendDelta(transcript, delta))
                    .doOnComplete(() -> callLogger.finished(traceId, call.stage(), elapsedMs(startNanos), transcript))
                    .doOnError(ex -> callLogger.failed(traceId, call.stage(), elapsedMs(startNanos), ex))
                    .doOnCancel(() -> callLogger.cancelled(traceId, call.stage(), elapsedMs(startNanos)));
        });
    }

    Map<String, Object> buildRequestBody(ModelCall call) {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("model", call.model().model());
        request.put("stream", true);
        request.put("stream_options", Map.of("include_usage", true));
        request.put("messages", toRawMessages(call.messages()));
        if (call.hasTools()) {
            request.put("tools", toRawTools(call.tools()));
            request.put("tool_choice", "auto");
            request.put("parallel_tool_calls", false);
        }
        return request;
    }

    private ChatProviderProperties.ProviderConfig resolveProviderConfig(String providerKey) {
        ChatProviderProperties.ProviderConfig config = providerProperties.getProvider(providerKey);
        if (config == null) {
            throw new IllegalStateException("No provider config found for key: " + providerKey);
        }
        if (!StringUtils.hasText(config.getBaseUrl())) {
            throw new IllegalStateException("Missing base-url for provider: " + providerKey);
        }
        if (!StringUtils.hasText(config.getApiKey())) {
            log.warn("Provider '{}' has no api-key configured, calling without Authorization", providerKey);
        }
        return config;
    }

    private WebClient buildWebClient(ChatProviderProperties.ProviderConfig config) {
        WebClient.Builder builder = webClientBuilder.clone()
                .baseUrl(config.getBaseUrl())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (StringUtils.hasText(config.getApiKey())) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey());
        }
        return builder.build();
    }

    private String resolveCompletionsUri(String baseUrl) {
        String normalized = baseUrl == null ? "" : baseUrl.trim().toLowerCase(Locale.ROOT);
        if (normalized.endsWith("/v1") || normalized.endsWith("/v1/")) {
            return "/chat/completions";
        }
        return "/v1/chat/completions";
    }

    private List<Map<String, Object>> toRawMessages(List<Message> messages) {
        List<Map<String, Object>> raw = new ArrayList<>();
        for (Message message : messages) {
            if (message instanceof AssistantMessage assistantMessage) {
                raw.add(toRawAssistant(assistantMessage));
            } else if (message instanceof ToolResponseMessage toolResponseMessage) {
                for (ToolResponseMessage.ToolResponse response : toolResponseMessage.getResponses()) {
                    Map<String, Object> tool = new LinkedHashMap<>();
                    tool.put("role", "tool");
                    tool.put("tool_call_id", response.id());
                    tool.put("name", response.name());
                    tool.put("content", response.responseData());
                    raw.add(tool);
                }
            } else if (message != null) {
                Map<String, Object> text = new LinkedHashMap<>();
                text.put("role", message.getMessageType().getValue());
                text.put("content", message.getText() == null ? "" : message.getText());
                raw.add(text);
            }
        }
        return raw;
    }

    private Map<String, Object> toRawAssistant(AssistantMessage message) {
        Map<String, Object> assistant = new LinkedHashMap<>();
        assistant.put("role", "assistant");
        assistant.put("content", message.getText() == null ? "" : message.getText());
        if (message.hasToolCalls()) {
            List<Map<String, Object>> toolCalls = new ArrayList<>();
            for (AssistantMessage.ToolCall toolCall : message.getToolCalls()) {
                Map<String, Object> function = new LinkedHashMap<>();
                function.put("name", toolCall.name());
                function.put("arguments", toolCall.arguments());
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("id", toolCall.id());
                entry.put("type", toolCall.type() == null ? "function" : toolCall.type());
                entry.put("function", function);
                toolCalls.add(entry);
            }
            assistant.put("tool_calls", toolCalls);
        }
        return assistant;
    }

    private List<Map<String, Object>> toRawTools(List<FunctionTool> tools) {
        List<Map<String, Object>> raw = new ArrayList<>();
        for (FunctionTool tool : tools) {
            Map<String, Object> function = new LinkedHashMap<>();
            function.put("name", tool.name());
            if (!tool.description().isBlank()) {
                function.put("description", tool.description());
            }
            function.put("parameters", tool.parameters());
            raw.add(Map.of("type", "function", "function", function));
        }
        return raw;
    }

    private long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
