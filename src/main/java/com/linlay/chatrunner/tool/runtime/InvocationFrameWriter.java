package com.linlay.chatrunner.tool.runtime;

import com.linlay.chatrunner.frame.FrameType;
import com.linlay.chatrunner.stream.FrameWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The response writer as seen by one tool invocation.
 * <p>
 * Writes pass straight to the shared writer until the invocation ends. After {@link #close()} they
 * are dropped, so a body that outlives its timeout cannot write into the frames of later tools or
 * model turns. Closing waits for a write already in progress.
 */
final class InvocationFrameWriter implements FrameWriter {

    private static final Logger log = LoggerFactory.getLogger(InvocationFrameWriter.class);

    private final FrameWriter delegate;
    private final String toolName;
    private final String callId;
    private boolean closed;
    private int dropped;

    InvocationFrameWriter(FrameWriter delegate, String toolName, String callId) {
        this.delegate = delegate;
        this.toolName = toolName;
        this.callId = callId;
    }

    @Override
    public synchronized void writeTextDelta(String content) {
        if (accept(FrameType.TEXT_DELTA)) {
            delegate.writeTextDelta(content);
        }
    }

    @Override
    public synchronized void writeContentDelta(FrameType type, String content) {
        if (accept(type)) {
            delegate.writeContentDelta(type, content);
        }
    }

    @Override
    public synchronized void writeToolEvent(FrameType type, Object data) {
        if (accept(type)) {
            delegate.writeToolEvent(type, data);
        }
    }

    @Override
    public synchronized void writeLifecycle(FrameType type, Object data) {
        if (accept(type)) {
            delegate.writeLifecycle(type, data);
        }
    }

    @Override
    public synchronized void writeError(String kind, String message) {
        if (accept(FrameType.ERROR)) {
            delegate.writeError(kind, message);
        }
    }

    /**
     * True once the response is cancelled or this invocation has ended.
     */
    @Override
    public synchronized boolean isCancelled() {
        return closed || delegate.isCancelled();
    }

    synchronized void close() {
        closed = true;
    }

    synchronized int droppedFrames() {
        return dropped;
    }

    private boolean accept(FrameType type) {
        if (!closed) {
            return true;
        }
        dropped++;
        log.warn("Dropping {} frame written by tool '{}' call={} after the call ended", type.wireName(), toolName, callId);
        return false;
    }
}
