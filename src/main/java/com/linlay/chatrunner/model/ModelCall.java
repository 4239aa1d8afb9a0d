package com.linlay.chatrunner.model;

import org.springframework.ai.chat.messages.Message;

import java.util.List;

/**
 * Everything needed for one streaming call to the upstream model.
 *
 * @param cacheable whether the response cache may serve or store this call
 * @param stage     short label used in logs, e.g. {@code chat-turn-2} or {@code document-create}
 */
public record ModelCall(
        ResolvedModel model,
        List<Message> messages,
        List<FunctionTool> tools,
        ChatVisibility visibility,
        boolean cacheable,
        String stage
) {

    public ModelCall {
        if (model == null) {
            throw new IllegalArgumentException("model must not be null");
        }
        messages = messages == null ? List.of() : List.copyOf(messages);
        tools = tools == null ? List.of() : List.copyOf(tools);
        visibility = visibility == null ? ChatVisibility.PRIVATE : visibility;
        stage = stage == null || stage.isBlank() ? "chat" : stage;
    }

    public boolean hasTools() {
        return !tools.isEmpty();
    }
}
