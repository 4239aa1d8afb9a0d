package com.linlay.chatrunner.stream;

import com.linlay.chatrunner.frame.FrameType;

/**
 * The single writer of a chat response stream.
 * <p>
 * The model-token loop and every tool invoked during the response write through the same instance,
 * so tool output is interleaved with the surrounding text in production order. Implementations must
 * be safe to call from the tool executor thread as well as from the response thread.
 */
public interface FrameWriter {

    void writeTextDelta(String content);

    /**
     * Kind-specific artifact content such as {@code code-delta} or {@code sheet-delta}.
     */
    void writeContentDelta(FrameType type, String content);

    /**
     * {@code tool-*} and {@code suggestion} frames. {@code data} must be a structured value, never a
     * pre-serialized JSON string.
     */
    void writeToolEvent(FrameType type, Object data);

    /**
     * {@code id}, {@code title}, {@code kind}, {@code clear}, {@code finish} and {@code model-routing}.
     */
    void writeLifecycle(FrameType type, Object data);

    /**
     * Terminal error frame; nothing but the end of the stream follows it.
     */
    void writeError(String kind, String message);

    boolean isCancelled();
}
