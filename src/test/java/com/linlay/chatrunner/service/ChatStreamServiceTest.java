package com.linlay.chatrunner.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.chatrunner.client.Artifact;
import com.linlay.chatrunner.client.ArtifactStatus;
import com.linlay.chatrunner.client.ClientStreamInterpreter;
import com.linlay.chatrunner.config.ConversationMemoryProperties;
import com.linlay.chatrunner.config.RoutingProperties;
import com.linlay.chatrunner.config.ToolProperties;
import com.linlay.chatrunner.frame.Frame;
import com.linlay.chatrunner.frame.FrameType;
import com.linlay.chatrunner.memory.ConversationMemory;
import com.linlay.chatrunner.model.ChatRequest;
import com.linlay.chatrunner.model.ChatVisibility;
import com.linlay.chatrunner.model.ErrorKind;
import com.linlay.chatrunner.model.LlmDelta;
import com.linlay.chatrunner.model.ModelCall;
import com.linlay.chatrunner.model.ToolCallDelta;
import com.linlay.chatrunner.resilience.ResilientClients;
import com.linlay.chatrunner.resilience.ResilientModelClient;
import com.linlay.chatrunner.resilience.ScriptedUpstreamClient;
import com.linlay.chatrunner.resilience.UpstreamException;
import com.linlay.chatrunner.tool.ChatTool;
import com.linlay.chatrunner.tool.CreateDocumentTool;
import com.linlay.chatrunner.tool.GetWeatherTool;
import com.linlay.chatrunner.tool.ToolArgumentValidator;
import com.linlay.chatrunner.tool.ToolRegistry;
import com.linlay.chatrunner.tool.document.DocumentContentGenerator;
import com.linlay.chatrunner.tool.document.InMemoryDocumentRepository;
import com.linlay.chatrunner.tool.runtime.ToolExecutionCoordinator;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.chat.messages.UserMessage;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ChatStreamServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ScriptedUpstreamClient upstream = new ScriptedUpstreamClient();
    private final ConversationMemory memory = new ConversationMemory(new ConversationMemoryProperties());
    private final ResilientModelClient modelClient = ResilientClients.passThrough(upstream);

    @Test
    void textOnlyAnswerShouldStreamRoutingThenDeltas() {
        upstream.thenReturn(LlmDelta.content("Hello "), new LlmDelta("World", null, "stop", null));

        List<Frame> frames = collect(service(5).stream(request("chat-model", "hi"), "user-1"));

        assertThat(frames).extracting(Frame::type)
                .containsExactly(FrameType.MODEL_ROUTING, FrameType.TEXT_DELTA, FrameType.TEXT_DELTA);
        assertThat(frames.get(0).payload().path("selectedModel").asText()).isEqualTo("chat-model");
        assertThat(frames.get(0).payload().path("routed").asBoolean()).isFalse();
        assertThat(upstream.calls()).singleElement().satisfies(call -> {
            assertThat(call.hasTools()).isTrue();
            assertThat(call.stage()).isEqualTo("chat-turn-1");
        });
    }

    @Test
    void toolCallShouldRunAndFeedResultIntoNextTurn() {
        upstream.thenReturn(weatherCall("call_1"))
                .thenReturn(LlmDelta.content("It is mild in Berlin."));

        List<Frame> frames = collect(service(5).stream(request("chat-model", "Weather in Berlin?"), "user-1"));

        assertThat(frames).extracting(Frame::type).containsExactly(
                FrameType.MODEL_ROUTING,
                FrameType.TOOL_CALL, FrameType.TOOL_START, FrameType.TOOL_RESULT, FrameType.TOOL_COMPLETE,
                FrameType.TEXT_DELTA);
        List<Message> secondTurn = upstream.calls().get(1).messages();
        assertThat(secondTurn.get(secondTurn.size() - 2)).isInstanceOfSatisfying(AssistantMessage.class,
                message -> assertThat(message.getToolCalls()).extracting(AssistantMessage.ToolCall::id).containsExactly("call_1"));
        assertThat(secondTurn.get(secondTurn.size() - 1)).isInstanceOfSatisfying(ToolResponseMessage.class,
                message -> assertThat(message.getResponses().get(0).responseData()).contains("temperature_2m"));
    }

    @Test
    void modelStillCallingToolsAfterMaxStepsShouldGetFinalTurnWithoutTools() {
        upstream.thenReturn(weatherCall("call_1"))
                .thenReturn(weatherCall("call_2"))
                .thenReturn(LlmDelta.content("Done."));

        List<Frame> frames = collect(service(2).stream(request("chat-model", "loop"), "user-1"));

        List<ModelCall> calls = upstream.calls();
        assertThat(calls).hasSize(3);
        assertThat(calls.get(2).hasTools()).isFalse();
        assertThat(calls.get(2).stage()).isEqualTo("chat-final");
        assertThat(frames).filteredOn(frame -> frame.type() == FrameType.TOOL_COMPLETE).hasSize(2);
        assertThat(frames.get(frames.size() - 1).payloadText()).isEqualTo("Done.");
    }

    @Test
    void upstreamFailureShouldEndWithErrorFrame() {
        upstream.thenFail(new UpstreamException(ErrorKind.UPSTREAM_5XX, "Upstream responded with HTTP 502"));

        List<Frame> frames = collect(service(5).stream(request("chat-model", "hi"), "user-1"));

        assertThat(frames).extracting(Frame::type).containsExactly(FrameType.MODEL_ROUTING, FrameType.ERROR);
        Frame error = frames.get(1);
        assertThat(error.payload().path("kind").asText()).isEqualTo("upstream_5xx");
        assertThat(error.payload().path("message").asText()).contains("502");
    }

    @Test
    void replyAfterCreatedDocumentShouldStayOutOfTheArtifact() {
        CreateDocumentTool createDocument = new CreateDocumentTool(
                new InMemoryDocumentRepository(),
                new DocumentContentGenerator(modelClient, TestModels.catalog()),
                objectMapper
        );
        upstream.thenReturn(new LlmDelta(null, List.of(new ToolCallDelta("call_1", 0, "function", "createDocument",
                        "{\"title\":\"Report\",\"kind\":\"text\"}")), "tool_calls", null))
                .thenReturn(LlmDelta.content("DOC BODY"))
                .thenReturn(LlmDelta.content("I created the document for you."));

        List<Frame> frames = collect(service(5, createDocument).stream(request("chat-model", "Write a report"), "user-1"));
        ClientStreamInterpreter interpreter = new ClientStreamInterpreter(objectMapper);
        Artifact artifact = interpreter.consume(frames);

        assertThat(frames).extracting(Frame::type).containsSubsequence(
                FrameType.CLEAR, FrameType.TEXT_DELTA, FrameType.FINISH, FrameType.TOOL_COMPLETE, FrameType.TEXT_DELTA);
        assertThat(artifact.title()).isEqualTo("Report");
        assertThat(artifact.content()).isEqualTo("DOC BODY");
        assertThat(artifact.status()).isEqualTo(ArtifactStatus.IDLE);
        assertThat(interpreter.messageText()).isEqualTo("I created the document for you.");
    }

    @Test
    void reasoningModelShouldBeCalledWithoutTools() {
        collect(service(5).stream(request("chat-model-reasoning", "think"), "user-1"));

        assertThat(upstream.calls()).singleElement().satisfies(call -> {
            assertThat(call.hasTools()).isFalse();
            assertThat(call.model().modelId()).isEqualTo("chat-model-reasoning");
        });
    }

    @Test
    void followUpShouldReplayConversationHistoryOfSameUser() {
        ChatStreamService service = service(5);
        upstream.thenReturn(LlmDelta.content("First answer"))
                .thenReturn(LlmDelta.content("Second answer"))
                .thenReturn(LlmDelta.content("Stranger answer"));

        collect(service.stream(request("chat-model", "first question"), "user-1"));
        collect(service.stream(request("chat-model", "second question"), "user-1"));
        collect(service.stream(request("chat-model", "third question"), "user-2"));

        assertThat(upstream.calls().get(1).messages()).extracting(Message::getText)
                .containsSubsequence("first question", "First answer", "second question");
        assertThat(upstream.calls().get(2).messages()).extracting(Message::getText)
                .doesNotContain("first question");
        assertThat(upstream.calls().get(2).messages()).filteredOn(UserMessage.class::isInstance).hasSize(1);
    }

    @Test
    void cancellingTheStreamShouldCancelTheUpstreamCall() throws InterruptedException {
        CountDownLatch upstreamCancelled = new CountDownLatch(1);
        upstream.then(call -> Flux.<LlmDelta>never().doOnCancel(upstreamCancelled::countDown));

        StepVerifier.create(service(5).stream(request("chat-model", "hi"), "user-1"))
                .assertNext(frame -> assertThat(frame.type()).isEqualTo(FrameType.MODEL_ROUTING))
                .thenCancel()
                .verify(Duration.ofSeconds(5));

        assertThat(upstreamCancelled.await(5, TimeUnit.SECONDS)).isTrue();
    }

    private ChatStreamService service(int maxSteps) {
        return service(maxSteps, new GetWeatherTool(objectMapper));
    }

    private ChatStreamService service(int maxSteps, ChatTool... tools) {
        ModelCatalog catalog = TestModels.catalog();
        ToolProperties toolProperties = new ToolProperties(maxSteps, Duration.ofSeconds(5));
        ToolRegistry registry = new ToolRegistry(List.of(tools));
        return new ChatStreamService(
                new ModelRouter(new RoutingProperties(), catalog),
                catalog,
                modelClient,
                registry,
                new ToolExecutionCoordinator(registry, new ToolArgumentValidator(objectMapper), objectMapper, toolProperties),
                memory,
                toolProperties,
                objectMapper
        );
    }

    private static ChatRequest request(String modelId, String message) {
        return new ChatRequest("conv-1", message, modelId, ChatVisibility.PRIVATE);
    }

    private static LlmDelta weatherCall(String id) {
        return new LlmDelta(null, List.of(new ToolCallDelta(id, 0, "function", "getWeather",
                "{\"latitude\":52.52,\"longitude\":13.41}")), "tool_calls", null);
    }

    private static List<Frame> collect(Flux<Frame> frames) {
        return frames.collectList().block(Duration.ofSeconds(10));
    }
}
