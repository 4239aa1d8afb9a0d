package com.linlay.chatrunner.stream;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.linlay.chatrunner.frame.Frame;
import com.linlay.chatrunner.frame.FrameType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.FluxSink;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link FrameWriter} over the {@link FluxSink} of one chat response.
 * <p>
 * {@code FluxSink} serializes concurrent {@code next} calls, which is what keeps frames from a tool
 * thread and the response thread in a single order. Writes after cancellation are discarded.
 */
public class CoordinatedFrameWriter implements FrameWriter {

    private static final Logger log = LoggerFactory.getLogger(CoordinatedFrameWriter.class);

    private final FluxSink<Frame> sink;
    private final ObjectMapper objectMapper;
    private final AtomicLong written = new AtomicLong();

    public CoordinatedFrameWriter(FluxSink<Frame> sink, ObjectMapper objectMapper) {
        this.sink = Objects.requireNonNull(sink, "sink cannot be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
    }

    @Override
    public void writeTextDelta(String content) {
        if (content == null || content.isEmpty()) {
            return;
        }
        emit(Frame.textDelta(content));
    }

    @Override
    public void writeContentDelta(FrameType type, String content) {
        if (type == null || !type.contentDelta()) {
            throw new IllegalArgumentException("Not a content delta frame type: " + type);
        }
        if (content == null || content.isEmpty()) {
            return;
        }
        emit(Frame.text(type, content));
    }

    @Override
    public void writeToolEvent(FrameType type, Object data) {
        if (type == null || type.category() != FrameType.Category.TOOL) {
            throw new IllegalArgumentException("Not a tool frame type: " + type);
        }
        emit(new Frame(type, structured(type, data)));
    }

    @Override
    public void writeLifecycle(FrameType type, Object data) {
        if (type == null || type.category() != FrameType.Category.LIFECYCLE) {
            throw new IllegalArgumentException("Not a lifecycle frame type: " + type);
        }
        if (type.structured()) {
            emit(new Frame(type, structured(type, data)));
            return;
        }
        emit(Frame.text(type, data == null ? "" : String.valueOf(data)));
    }

    @Override
    public void writeError(String kind, String message) {
        ObjectNode error = objectMapper.createObjectNode();
        error.put("kind", kind);
        error.put("message", message == null ? "" : message);
        emit(new Frame(FrameType.ERROR, error));
    }

    @Override
    public boolean isCancelled() {
        return sink.isCancelled();
    }

    public long framesWritten() {
        return written.get();
    }

    private JsonNode structured(FrameType type, Object data) {
        if (data == null) {
            return objectMapper.createObjectNode();
        }
        if (data instanceof CharSequence) {
            throw new IllegalArgumentException(
                    "Payload of " + type.wireName() + " must be structured, got a string");
        }
        JsonNode node = data instanceof JsonNode jsonNode ? jsonNode : objectMapper.valueToTree(data);
        if (node == null || !node.isContainerNode()) {
            throw new IllegalArgumentException("Payload of " + type.wireName() + " must be an object or array");
        }
        return node;
    }

    private void emit(Frame frame) {
        if (sink.isCancelled()) {
            log.debug("Discarding {} frame written after cancellation", frame.type().wireName());
            return;
        }
        written.incrementAndGet();
        sink.next(frame);
    }
}
