package com.linlay.chatrunner.service;

import com.linlay.chatrunner.config.LlmInteractionLogProperties;
import com.linlay.chatrunner.model.LlmDelta;
import com.linlay.chatrunner.model.ModelCall;
import com.linlay.chatrunner.model.ToolCallDelta;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.UUID;

/**
 * Interaction log of upstream model calls, switched by {@code chat.llm.interaction-log}.
 */
@Component
public class LlmCallLogger {

    private static final Logger log = LoggerFactory.getLogger(LlmCallLogger.class);

    private final boolean enabled;
    private final boolean maskSensitive;
    private final boolean logChunks;

    public LlmCallLogger(LlmInteractionLogProperties properties) {
        this.enabled = properties == null || properties.isEnabled();
        this.maskSensitive = properties == null || properties.isMaskSensitive();
        this.logChunks = properties != null && properties.isLogChunks();
    }

    public String newTraceId() {
        return "llm-" + UUID.randomUUID().toString().replace("-", "");
    }

    public String sanitize(String text) {
        return LlmLogSanitizer.maskText(text, maskSensitive);
    }

    public void requestStart(String traceId, ModelCall call) {
        if (!enabled) {
            return;
        }
        log.info("[{}][{}] upstream request start provider={}, model={}, messages={}, tools={}",
                traceId, call.stage(), call.model().providerKey(), call.model().model(),
                call.messages().size(), call.tools().size());
        if (log.isDebugEnabled()) {
            log.debug("[{}][{}] upstream messages:\n{}", traceId, call.stage(), describeMessages(call));
        }
    }

    public void rawChunk(String traceId, String stage, String rawChunk) {
        if (enabled && logChunks) {
            log.debug("[{}][{}][raw] {}", traceId, stage, sanitize(rawChunk));
        }
    }

    public void appendDelta(StringBuilder transcript, LlmDelta delta) {
        if (!enabled || delta == null) {
            return;
        }
        if (delta.hasContent()) {
            transcript.append(sanitize(delta.content()));
        }
        for (ToolCallDelta toolCall : delta.toolCalls()) {
            transcript.append("\n[tool_call] id=").append(toolCall.id())
                    .append(", name=").append(toolCall.name() == null ? "" : toolCall.name())
                    .append(", args=").append(sanitize(toolCall.arguments()));
        }
        if (delta.finishReason() != null && !delta.finishReason().isBlank()) {
            transcript.append("\n[finish_reason] ").append(delta.finishReason());
        }
    }

    public void finished(String traceId, String stage, long elapsedMs, CharSequence transcript) {
        if (enabled) {
            log.info("[{}][{}] upstream stream finished in {} ms:\n{}", traceId, stage, elapsedMs, transcript);
        }
    }

    public void cancelled(String traceId, String stage, long elapsedMs) {
        if (enabled) {
            log.info("[{}][{}] upstream stream cancelled in {} ms", traceId, stage, elapsedMs);
        }
    }

    /**
     * Failures are logged even when the interaction log is off.
     */
    public void failed(String traceId, String stage, long elapsedMs, Throwable ex) {
        log.warn("[{}][{}] upstream stream failed in {} ms: {}", traceId, stage, elapsedMs, ex.toString());
    }

    private String describeMessages(ModelCall call) {
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < call.messages().size(); i++) {
            Message message = call.messages().get(i);
            builder.append('[').append(i).append("] ")
                    .append(message.getMessageType().name().toLowerCase(Locale.ROOT))
                    .append(": ")
                    .append(sanitize(message.getText()));
            if (message instanceof AssistantMessage assistantMessage && assistantMessage.hasToolCalls()) {
                builder.append(" (toolCalls=").append(assistantMessage.getToolCalls().size()).append(')');
            }
            if (message instanceof ToolResponseMessage toolResponseMessage) {
                builder.append(" (toolResponses=").append(toolResponseMessage.getResponses().size()).append(')');
            }
            builder.append('\n');
        }
        return builder.toString();
    }
}
