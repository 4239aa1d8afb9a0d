package com.linlay.chatrunner.resilience;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.linlay.chatrunner.model.FunctionTool;
import com.linlay.chatrunner.model.ModelCall;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Stable cache key for a model call: resolved model, visibility, advertised tool names and the
 * whitespace-normalized conversation. Tool call ids are left out because they are minted per call.
 */
@Component
public class RequestFingerprint {

    private final ObjectMapper objectMapper;

    public RequestFingerprint(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String fingerprint(ModelCall call) {
        return DigestUtils.sha256Hex(canonicalize(call));
    }

    String canonicalize(ModelCall call) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("provider", call.model().providerKey());
        root.put("model", call.model().model());
        root.put("visibility", call.visibility().wireName());

        ArrayNode tools = root.putArray("tools");
        call.tools().stream()
                .map(FunctionTool::name)
                .sorted()
                .forEach(tools::add);

        ArrayNode messages = root.putArray("messages");
        for (Message message : call.messages()) {
            if (message == null) {
                continue;
            }
            ObjectNode node = messages.addObject();
            node.put("role", message.getMessageType().name().toLowerCase(Locale.ROOT));
            node.put("content", normalizeText(message.getText()));
            if (message instanceof AssistantMessage assistantMessage && assistantMessage.hasToolCalls()) {
                ArrayNode calls = node.putArray("toolCalls");
                for (AssistantMessage.ToolCall toolCall : assistantMessage.getToolCalls()) {
                    calls.addObject()
                            .put("name", toolCall.name())
                            .put("arguments", normalizeText(toolCall.arguments()));
                }
            }
            if (message instanceof ToolResponseMessage toolResponseMessage) {
                ArrayNode responses = node.putArray("toolResponses");
                for (ToolResponseMessage.ToolResponse response : toolResponseMessage.getResponses()) {
                    responses.addObject()
                            .put("name", response.name())
                            .put("data", normalizeText(response.responseData()));
                }
            }
        }
        return root.toString();
    }

    private String normalizeText(String text) {
        if (text == null) {
            return "";
        }
        return text.trim().replaceAll("\\s+", " ");
    }
}
