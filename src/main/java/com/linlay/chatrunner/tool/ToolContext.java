package com.linlay.chatrunner.tool;

import com.linlay.chatrunner.model.ChatVisibility;
import com.linlay.chatrunner.stream.FrameWriter;

/**
 * Per-response state handed to every tool invocation.
 *
 * @param writer the writer of the response that requested the tool, never a separate one
 */
public record ToolContext(
        String conversationId,
        String userId,
        ChatVisibility visibility,
        FrameWriter writer
) {

    public ToolContext {
        if (writer == null) {
            throw new IllegalArgumentException("writer must not be null");
        }
        visibility = visibility == null ? ChatVisibility.PRIVATE : visibility;
    }
}
