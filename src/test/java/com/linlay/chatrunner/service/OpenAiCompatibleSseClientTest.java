package com.linlay.chatrunner.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.chatrunner.config.LlmInteractionLogProperties;
import com.linlay.chatrunner.model.ChatVisibility;
import com.linlay.chatrunner.model.FunctionTool;
import com.linlay.chatrunner.model.LlmDelta;
import com.linlay.chatrunner.model.ModelCall;
import com.linlay.chatrunner.model.ResolvedModel;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class OpenAiCompatibleSseClientTest {

    private static final ResolvedModel MODEL = new ResolvedModel("chat-model", "test", "test-chat", true);

    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();

    @Test
    void shouldStreamParsedDeltasFromSseBody() {
        String body = """
                data: {"choices":[{"delta":{"content":"Hel"}}]}

                data: {"choices":[{"delta":{"content":"lo"},"finish_reason":"stop"}]}

                data: {"choices":[],"usage":{"completion_tokens":2}}

                data: [DONE]

                """;
        OpenAiCompatibleSseClient client = client(body);

        StepVerifier.create(client.stream(call(List.of())))
                .assertNext(delta -> assertThat(delta.content()).isEqualTo("Hel"))
                .assertNext(delta -> assertThat(delta.finishReason()).isEqualTo("stop"))
                .assertNext(delta -> assertThat(delta.completionTokens()).isEqualTo(2))
                .verifyComplete();

        ClientRequest request = lastRequest.get();
        assertThat(request.url().toString()).isEqualTo("http://localhost:1/v1/chat/completions");
        assertThat(request.headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer test-key");
    }

    @Test
    void requestBodyShouldCarryToolsAndToolTraffic() {
        OpenAiCompatibleSseClient client = client("");
        FunctionTool weather = new FunctionTool("getWeather", "Weather lookup", Map.of("type", "object"));
        ModelCall call = new ModelCall(MODEL, List.of(
                new SystemMessage("system"),
                new UserMessage("weather?"),
                new AssistantMessage("", Map.of(), List.of(
                        new AssistantMessage.ToolCall("call_1", "function", "getWeather", "{\"latitude\":1}"))),
                new ToolResponseMessage(List.of(new ToolResponseMessage.ToolResponse("call_1", "getWeather", "{\"t\":3}")))
        ), List.of(weather), ChatVisibility.PRIVATE, true, "chat-turn-2");

        Map<String, Object> body = client.buildRequestBody(call);

        assertThat(body).containsEntry("model", "test-chat").containsEntry("stream", true)
                .containsEntry("tool_choice", "auto").containsEntry("parallel_tool_calls", false);
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> messages = (List<Map<String, Object>>) body.get("messages");
        assertThat(messages).extracting(message -> message.get("role"))
                .containsExactly("system", "user", "assistant", "tool");
        assertThat(messages.get(2)).containsKey("tool_calls");
        assertThat(messages.get(3)).containsEntry("tool_call_id", "call_1").containsEntry("content", "{\"t\":3}");
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> tools = (List<Map<String, Object>>) body.get("tools");
        assertThat(tools).singleElement().satisfies(tool -> assertThat(tool).containsEntry("type", "function"));
    }

    @Test
    void requestBodyWithoutToolsShouldOmitToolFields() {
        Map<String, Object> body = client("").buildRequestBody(call(List.of()));

        assertThat(body).doesNotContainKeys("tools", "tool_choice", "parallel_tool_calls");
    }

    private OpenAiCompatibleSseClient client(String sseBody) {
        LlmInteractionLogProperties logProperties = new LlmInteractionLogProperties();
        logProperties.setEnabled(false);
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            lastRequest.set(request);
            return Mono.just(ClientResponse.create(HttpStatus.OK)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.TEXT_EVENT_STREAM_VALUE)
                    .body(sseBody)
                    .build());
        });
        return new OpenAiCompatibleSseClient(TestModels.properties(), builder, new ObjectMapper(),
                new LlmCallLogger(logProperties));
    }

    private static ModelCall call(List<FunctionTool> tools) {
        return new ModelCall(MODEL, List.of(new UserMessage("hi")), tools, ChatVisibility.PRIVATE, false, "chat-turn-1");
    }
}
