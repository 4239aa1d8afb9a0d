package com.linlay.chatrunner.tool.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.chatrunner.config.ToolProperties;
import com.linlay.chatrunner.frame.Frame;
import com.linlay.chatrunner.frame.FrameType;
import com.linlay.chatrunner.model.ChatVisibility;
import com.linlay.chatrunner.model.ErrorKind;
import com.linlay.chatrunner.stream.RecordingFrameWriter;
import com.linlay.chatrunner.tool.ChatTool;
import com.linlay.chatrunner.tool.ToolArgumentValidator;
import com.linlay.chatrunner.tool.ToolContext;
import com.linlay.chatrunner.tool.ToolRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.ToolResponseMessage;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiFunction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ToolExecutionCoordinatorTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final RecordingFrameWriter writer = new RecordingFrameWriter();
    private final ToolContext context = new ToolContext("conv-1", "user-1", ChatVisibility.PRIVATE, writer);
    private final CountingTool echo = new CountingTool("echo", (args, toolContext) -> objectMapper.valueToTree(Map.of("echo", args.get("text"))));

    @Test
    void validCallShouldEmitCallStartResultCompleteInOrder() {
        ToolBatchResult result = coordinator(Duration.ofSeconds(5), echo)
                .execute(List.of(call("call_1", "echo", "{\"text\":\"hi\"}")), context);

        assertThat(writer.types()).containsExactly(
                FrameType.TOOL_CALL, FrameType.TOOL_START, FrameType.TOOL_RESULT, FrameType.TOOL_COMPLETE);
        Frame start = writer.framesOf(FrameType.TOOL_START).get(0);
        assertThat(start.payload().path("id").asText()).isEqualTo("call_1");
        assertThat(start.payload().path("arguments").path("text").asText()).isEqualTo("hi");
        Frame toolResult = writer.framesOf(FrameType.TOOL_RESULT).get(0);
        assertThat(toolResult.payload().path("result").path("echo").asText()).isEqualTo("hi");

        assertThat(result.invocations()).singleElement()
                .satisfies(invocation -> assertThat(invocation.state()).isEqualTo(ToolInvocationState.COMPLETED));
        ToolResponseMessage.ToolResponse response = result.responseMessage().getResponses().get(0);
        assertThat(response.id()).isEqualTo("call_1");
        assertThat(response.name()).isEqualTo("echo");
        assertThat(response.responseData()).isEqualTo("{\"echo\":\"hi\"}");
    }

    @Test
    void invalidArgumentsShouldNeverReachTheToolBody() {
        ToolBatchResult result = coordinator(Duration.ofSeconds(5), echo)
                .execute(List.of(
                        call("call_1", "echo", "{\"text\":42}"),
                        call("call_2", "echo", "{not json"),
                        call("call_3", "echo", "{}")
                ), context);

        assertThat(echo.invocations.get()).isZero();
        assertThat(writer.framesOf(FrameType.TOOL_START)).isEmpty();
        assertThat(writer.framesOf(FrameType.TOOL_ERROR)).hasSize(3)
                .allSatisfy(frame -> assertThat(frame.payload().path("kind").asText()).isEqualTo("invalid_arguments"));
        assertThat(result.invocations()).allSatisfy(invocation -> {
            assertThat(invocation.state()).isEqualTo(ToolInvocationState.FAILED);
            assertThat(invocation.errorKind()).isEqualTo(ErrorKind.INVALID_ARGUMENTS);
        });
        assertThat(result.responseMessage().getResponses().get(1).responseData())
                .contains("\"ok\":false")
                .contains("invalid_arguments");
    }

    @Test
    void unknownToolShouldBeRejectedAsInvalidArguments() {
        coordinator(Duration.ofSeconds(5), echo).execute(List.of(call("call_1", "teleport", "{}")), context);

        assertThat(writer.types()).containsExactly(FrameType.TOOL_CALL, FrameType.TOOL_ERROR);
        Frame error = writer.framesOf(FrameType.TOOL_ERROR).get(0);
        assertThat(error.payload().path("kind").asText()).isEqualTo("invalid_arguments");
        assertThat(error.payload().path("errors").get(0).asText()).contains("teleport");
    }

    @Test
    void throwingToolShouldEndWithExecutionError() {
        ChatTool failing = new CountingTool("failing", (args, toolContext) -> {
            throw new IllegalStateException("database unavailable");
        });

        ToolBatchResult result = coordinator(Duration.ofSeconds(5), failing)
                .execute(List.of(call("call_1", "failing", "{\"text\":\"x\"}")), context);

        assertThat(writer.types()).containsExactly(FrameType.TOOL_CALL, FrameType.TOOL_START, FrameType.TOOL_ERROR);
        Frame error = writer.framesOf(FrameType.TOOL_ERROR).get(0);
        assertThat(error.payload().path("kind").asText()).isEqualTo("tool_execution_error");
        assertThat(error.payload().path("message").asText()).isEqualTo("database unavailable");
        assertThat(result.invocations().get(0).errorKind()).isEqualTo(ErrorKind.TOOL_EXECUTION_ERROR);
    }

    @Test
    void slowToolShouldTimeOutAndBeInterrupted() throws InterruptedException {
        CountDownLatch interrupted = new CountDownLatch(1);
        ChatTool slow = new CountingTool("slow", (args, toolContext) -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException ex) {
                interrupted.countDown();
                Thread.currentThread().interrupt();
            }
            return null;
        });

        coordinator(Duration.ofMillis(100), slow).execute(List.of(call("call_1", "slow", "{\"text\":\"x\"}")), context);

        Frame error = writer.framesOf(FrameType.TOOL_ERROR).get(0);
        assertThat(error.payload().path("kind").asText()).isEqualTo("tool_execution_error");
        assertThat(error.payload().path("message").asText()).contains("timed out");
        assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void toolFramesShouldInterleaveInsideItsStartAndComplete() {
        ChatTool streaming = new CountingTool("streaming", (args, toolContext) -> {
            toolContext.writer().writeTextDelta("chunk-1");
            toolContext.writer().writeTextDelta("chunk-2");
            return objectMapper.createObjectNode().put("ok", true);
        });

        coordinator(Duration.ofSeconds(5), streaming).execute(List.of(call("call_1", "streaming", "{\"text\":\"x\"}")), context);

        assertThat(writer.types()).containsExactly(
                FrameType.TOOL_CALL, FrameType.TOOL_START, FrameType.TEXT_DELTA, FrameType.TEXT_DELTA,
                FrameType.TOOL_RESULT, FrameType.TOOL_COMPLETE);
    }

    @Test
    void writesFromTimedOutToolShouldNotLeakIntoLaterFrames() throws InterruptedException {
        CountDownLatch stubbornDone = new CountDownLatch(1);
        ChatTool stubborn = new CountingTool("stubborn", (args, toolContext) -> {
            long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(400);
            while (System.nanoTime() < deadline) {
                Thread.onSpinWait();
            }
            toolContext.writer().writeTextDelta("LATE-FROM-STUBBORN");
            stubbornDone.countDown();
            return null;
        });
        ChatTool second = new CountingTool("second", (args, toolContext) -> {
            toolContext.writer().writeTextDelta("second-body");
            return objectMapper.createObjectNode().put("ok", true);
        });

        coordinator(Duration.ofMillis(100), stubborn, second).execute(List.of(
                call("call_1", "stubborn", "{\"text\":\"x\"}"),
                call("call_2", "second", "{\"text\":\"y\"}")
        ), context);
        assertThat(stubbornDone.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(writer.framesOf(FrameType.TEXT_DELTA)).extracting(Frame::payloadText).containsExactly("second-body");
        assertThat(writer.types()).containsExactly(
                FrameType.TOOL_CALL, FrameType.TOOL_START, FrameType.TOOL_ERROR,
                FrameType.TOOL_CALL, FrameType.TOOL_START, FrameType.TEXT_DELTA,
                FrameType.TOOL_RESULT, FrameType.TOOL_COMPLETE);
    }

    @Test
    void interruptDuringLastToolShouldAbortTheBatch() throws InterruptedException {
        CountDownLatch started = new CountDownLatch(1);
        ChatTool slow = new CountingTool("slow", (args, toolContext) -> {
            started.countDown();
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            return null;
        });
        ToolExecutionCoordinator coordinator = coordinator(Duration.ofSeconds(30), slow);
        AtomicReference<Object> outcome = new AtomicReference<>();
        Thread caller = new Thread(() -> {
            try {
                outcome.set(coordinator.execute(List.of(call("call_1", "slow", "{\"text\":\"x\"}")), context));
            } catch (RuntimeException ex) {
                outcome.set(ex);
            }
        });

        caller.start();
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        caller.interrupt();
        caller.join(5_000);

        assertThat(outcome.get()).isInstanceOf(CancellationException.class);
        assertThat(writer.framesOf(FrameType.TOOL_ERROR)).isEmpty();
    }

    @Test
    void callsShouldRunSequentiallyInRequestedOrder() {
        ToolBatchResult result = coordinator(Duration.ofSeconds(5), echo).execute(List.of(
                call("call_a", "echo", "{\"text\":\"a\"}"),
                call("call_b", "echo", "{\"text\":\"b\"}")
        ), context);

        List<String> completedIds = writer.framesOf(FrameType.TOOL_COMPLETE).stream()
                .map(frame -> frame.payload().path("id").asText())
                .toList();
        assertThat(completedIds).containsExactly("call_a", "call_b");
        assertThat(writer.types().indexOf(FrameType.TOOL_COMPLETE))
                .isLessThan(writer.types().lastIndexOf(FrameType.TOOL_CALL));
        assertThat(result.responseMessage().getResponses())
                .extracting(ToolResponseMessage.ToolResponse::id)
                .containsExactly("call_a", "call_b");
    }

    @Test
    void cancelledResponseShouldStopBeforeNextCall() {
        writer.cancel();

        assertThatThrownBy(() -> coordinator(Duration.ofSeconds(5), echo)
                .execute(List.of(call("call_1", "echo", "{\"text\":\"a\"}")), context))
                .isInstanceOf(CancellationException.class);
        assertThat(echo.invocations.get()).isZero();
        assertThat(writer.frames()).isEmpty();
    }

    private ToolExecutionCoordinator coordinator(Duration timeout, ChatTool... tools) {
        return new ToolExecutionCoordinator(
                new ToolRegistry(List.of(tools)),
                new ToolArgumentValidator(objectMapper),
                objectMapper,
                new ToolProperties(5, timeout)
        );
    }

    private static AssistantMessage.ToolCall call(String id, String name, String arguments) {
        return new AssistantMessage.ToolCall(id, "function", name, arguments);
    }

    private static final class CountingTool implements ChatTool {

        private final String name;
        private final BiFunction<Map<String, Object>, ToolContext, JsonNode> body;
        private final AtomicInteger invocations = new AtomicInteger();

        private CountingTool(String name, BiFunction<Map<String, Object>, ToolContext, JsonNode> body) {
            this.name = name;
            this.body = body;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public Map<String, Object> parametersSchema() {
            return Map.of(
                    "type", "object",
                    "properties", Map.of("text", Map.of("type", "string")),
                    "required", List.of("text")
            );
        }

        @Override
        public JsonNode invoke(Map<String, Object> args, ToolContext context) {
            invocations.incrementAndGet();
            return body.apply(args, context);
        }
    }
}
