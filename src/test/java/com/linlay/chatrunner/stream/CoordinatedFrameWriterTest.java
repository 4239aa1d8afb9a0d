package com.linlay.chatrunner.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.chatrunner.frame.Frame;
import com.linlay.chatrunner.frame.FrameType;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CoordinatedFrameWriterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void shouldEmitFramesInWriteOrder() {
        List<Frame> frames = Flux.<Frame>create(sink -> {
            CoordinatedFrameWriter writer = new CoordinatedFrameWriter(sink, objectMapper);
            writer.writeLifecycle(FrameType.ID, "doc-1");
            writer.writeToolEvent(FrameType.TOOL_START, Map.of("id", "call_1"));
            writer.writeTextDelta("Hello");
            writer.writeTextDelta("");
            writer.writeContentDelta(FrameType.CODE_DELTA, "x = 1");
            writer.writeError("upstream_5xx", "boom");
            sink.complete();
        }).collectList().block(Duration.ofSeconds(5));

        assertThat(frames).extracting(Frame::type).containsExactly(
                FrameType.ID, FrameType.TOOL_START, FrameType.TEXT_DELTA, FrameType.CODE_DELTA, FrameType.ERROR);
        assertThat(frames.get(0).payloadText()).isEqualTo("doc-1");
        assertThat(frames.get(1).payload().path("id").asText()).isEqualTo("call_1");
        assertThat(frames.get(4).payload().path("kind").asText()).isEqualTo("upstream_5xx");
    }

    @Test
    void shouldRejectStringPayloadsForStructuredFrames() {
        AtomicReference<CoordinatedFrameWriter> writer = new AtomicReference<>();
        Flux.<Frame>create(sink -> writer.set(new CoordinatedFrameWriter(sink, objectMapper)))
                .subscribe();

        assertThatThrownBy(() -> writer.get().writeToolEvent(FrameType.TOOL_RESULT, "{\"ok\":true}"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> writer.get().writeToolEvent(FrameType.TITLE, Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> writer.get().writeContentDelta(FrameType.FINISH, "x"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldKeepEveryFrameWhenToolThreadAndResponseThreadWriteConcurrently() throws Exception {
        int perThread = 500;
        CountDownLatch start = new CountDownLatch(1);
        List<Frame> frames = Flux.<Frame>create(sink -> {
            CoordinatedFrameWriter writer = new CoordinatedFrameWriter(sink, objectMapper);
            Thread tool = new Thread(() -> {
                await(start);
                for (int i = 0; i < perThread; i++) {
                    writer.writeContentDelta(FrameType.CODE_DELTA, "t" + i);
                }
            });
            Thread response = new Thread(() -> {
                await(start);
                for (int i = 0; i < perThread; i++) {
                    writer.writeTextDelta("r" + i);
                }
            });
            tool.start();
            response.start();
            start.countDown();
            try {
                tool.join();
                response.join();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            sink.complete();
        }, FluxSink.OverflowStrategy.BUFFER).collectList().block(Duration.ofSeconds(10));

        assertThat(frames).hasSize(perThread * 2);
        List<String> toolOrder = frames.stream()
                .filter(frame -> frame.type() == FrameType.CODE_DELTA)
                .map(Frame::payloadText)
                .toList();
        assertThat(toolOrder).first().isEqualTo("t0");
        assertThat(toolOrder).last().isEqualTo("t" + (perThread - 1));
        assertThat(toolOrder).doesNotHaveDuplicates().hasSize(perThread);
    }

    @Test
    void shouldDiscardWritesAfterCancellation() {
        AtomicReference<CoordinatedFrameWriter> writer = new AtomicReference<>();
        Flux.<Frame>create(sink -> writer.set(new CoordinatedFrameWriter(sink, objectMapper)))
                .take(1)
                .subscribe();

        writer.get().writeTextDelta("first");
        writer.get().writeTextDelta("second");

        assertThat(writer.get().isCancelled()).isTrue();
        assertThat(writer.get().framesWritten()).isEqualTo(1);
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }
}
