package com.linlay.chatrunner.service;

import com.linlay.chatrunner.model.LlmDelta;
import com.linlay.chatrunner.model.ToolCallDelta;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects the streamed deltas of one model turn into its text and complete tool calls.
 * <p>
 * Tool call fragments are matched by {@code index} when the provider sends one, otherwise by
 * {@code id}; a fragment with neither continues the most recent call. Calls that never received a
 * name are dropped. Not thread-safe: one instance per turn.
 */
class ModelTurnAccumulator {

    private final String idPrefix;
    private final StringBuilder text = new StringBuilder();
    private final Map<String, PendingToolCall> pending = new LinkedHashMap<>();
    private String finishReason;
    private int generatedIds;

    ModelTurnAccumulator(String idPrefix) {
        this.idPrefix = StringUtils.hasText(idPrefix) ? idPrefix : "call";
    }

    void accept(LlmDelta delta) {
        if (delta == null) {
            return;
        }
        if (delta.hasContent()) {
            text.append(delta.content());
        }
        if (StringUtils.hasText(delta.finishReason())) {
            finishReason = delta.finishReason();
        }
        for (ToolCallDelta fragment : delta.toolCalls()) {
            merge(fragment);
        }
    }

    String text() {
        return text.toString();
    }

    String finishReason() {
        return finishReason;
    }

    boolean hasToolCalls() {
        return !toolCalls().isEmpty();
    }

    List<AssistantMessage.ToolCall> toolCalls() {
        List<AssistantMessage.ToolCall> calls = new ArrayList<>();
        for (PendingToolCall call : pending.values()) {
            if (!StringUtils.hasText(call.name)) {
                continue;
            }
            calls.add(new AssistantMessage.ToolCall(call.id, "function", call.name, call.arguments.toString()));
        }
        return calls;
    }

    private void merge(ToolCallDelta fragment) {
        if (fragment == null) {
            return;
        }
        String key = fragment.index() != null ? "#" + fragment.index() : fragment.id();
        if (!StringUtils.hasText(key)) {
            key = latestKey();
        }
        if (!StringUtils.hasText(key)) {
            key = "#auto-" + pending.size();
        }
        PendingToolCall call = pending.computeIfAbsent(key, ignored -> new PendingToolCall());
        if (StringUtils.hasText(fragment.id()) && call.id == null) {
            call.id = fragment.id();
        }
        if (call.id == null) {
            call.id = idPrefix + "_" + (++generatedIds);
        }
        if (StringUtils.hasText(fragment.name())) {
            call.name = fragment.name();
        }
        if (fragment.arguments() != null) {
            call.arguments.append(fragment.arguments());
        }
    }

    private String latestKey() {
        String latest = null;
        for (String key : pending.keySet()) {
            latest = key;
        }
        return latest;
    }

    private static final class PendingToolCall {
        private String id;
        private String name;
        private final StringBuilder arguments = new StringBuilder();
    }
}
