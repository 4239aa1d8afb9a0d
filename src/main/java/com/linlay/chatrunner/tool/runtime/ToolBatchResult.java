package com.linlay.chatrunner.tool.runtime;

import org.springframework.ai.chat.messages.ToolResponseMessage;

import java.util.List;

/**
 * @param responseMessage one response per executed call, in call order, ready to append to the conversation
 */
public record ToolBatchResult(
        List<ToolInvocation> invocations,
        ToolResponseMessage responseMessage
) {

    public ToolBatchResult {
        invocations = invocations == null ? List.of() : List.copyOf(invocations);
    }
}
