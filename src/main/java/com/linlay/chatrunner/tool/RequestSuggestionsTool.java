package com.linlay.chatrunner.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.linlay.chatrunner.frame.FrameType;
import com.linlay.chatrunner.service.ChatPrompts;
import com.linlay.chatrunner.tool.document.Document;
import com.linlay.chatrunner.tool.document.DocumentContentGenerator;
import com.linlay.chatrunner.tool.document.DocumentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Asks the artifact model for edit suggestions and writes one {@code suggestion} frame per usable
 * item. Items missing any of the three text fields are skipped.
 */
@Component
public class RequestSuggestionsTool implements ChatTool {

    private static final Logger log = LoggerFactory.getLogger(RequestSuggestionsTool.class);

    private final DocumentRepository documentRepository;
    private final DocumentContentGenerator contentGenerator;
    private final ObjectMapper objectMapper;

    public RequestSuggestionsTool(
            DocumentRepository documentRepository,
            DocumentContentGenerator contentGenerator,
            ObjectMapper objectMapper
    ) {
        this.documentRepository = documentRepository;
        this.contentGenerator = contentGenerator;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return "requestSuggestions";
    }

    @Override
    public String description() {
        return "Request suggestions for a document";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "documentId", Map.of(
                                "type", "string",
                                "description", "The ID of the document to request suggestions for",
                                "minLength", 1
                        )
                ),
                "required", List.of("documentId")
        );
    }

    @Override
    public JsonNode invoke(Map<String, Object> args, ToolContext context) {
        String documentId = String.valueOf(args.get("documentId")).trim();
        Document document = documentRepository.findById(documentId)
                .filter(found -> !found.content().isBlank())
                .orElseThrow(() -> new IllegalStateException("Document not found or has no content: " + documentId));

        String raw = contentGenerator.complete(ChatPrompts.SUGGESTIONS_SYSTEM, document.content(), context,
                "document-suggestions");
        JsonNode items = parseSuggestions(raw);

        int written = 0;
        for (JsonNode item : items) {
            String original = item.path("originalSentence").asText("");
            String suggested = item.path("suggestedSentence").asText("");
            String description = item.path("description").asText("");
            if (original.isBlank() || suggested.isBlank() || description.isBlank()) {
                log.debug("Skipping incomplete suggestion {}", item);
                continue;
            }
            ObjectNode suggestion = objectMapper.createObjectNode();
            suggestion.put("id", UUID.randomUUID().toString());
            suggestion.put("documentId", documentId);
            suggestion.put("originalText", original);
            suggestion.put("suggestedText", suggested);
            suggestion.put("description", description);
            suggestion.put("isResolved", false);
            context.writer().writeToolEvent(FrameType.SUGGESTION, suggestion);
            written++;
        }

        ObjectNode result = objectMapper.createObjectNode();
        result.put("id", documentId);
        result.put("title", document.title());
        result.put("kind", document.kind().wireName());
        result.put("message", "Suggestions have been added to the document");
        result.put("suggestionsCount", written);
        return result;
    }

    private JsonNode parseSuggestions(String raw) {
        String json = stripCodeFence(raw);
        JsonNode parsed;
        try {
            parsed = objectMapper.readTree(json);
        } catch (Exception ex) {
            throw new IllegalStateException("Failed to parse suggestions from model response", ex);
        }
        if (parsed != null && parsed.isArray()) {
            return parsed;
        }
        if (parsed != null && parsed.path("suggestions").isArray()) {
            return parsed.path("suggestions");
        }
        throw new IllegalStateException("Model response does not contain a suggestion list");
    }

    private String stripCodeFence(String raw) {
        String text = raw == null ? "" : raw.trim();
        if (text.startsWith("```")) {
            int firstLineEnd = text.indexOf('\n');
            int closing = text.lastIndexOf("```");
            if (firstLineEnd > 0 && closing > firstLineEnd) {
                return text.substring(firstLineEnd + 1, closing).trim();
            }
        }
        return text;
    }
}
