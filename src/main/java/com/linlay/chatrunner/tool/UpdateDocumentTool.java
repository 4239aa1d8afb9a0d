package com.linlay.chatrunner.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.linlay.chatrunner.frame.FrameType;
import com.linlay.chatrunner.tool.document.Document;
import com.linlay.chatrunner.tool.document.DocumentContentGenerator;
import com.linlay.chatrunner.tool.document.DocumentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
public class UpdateDocumentTool implements ChatTool {

    private static final Logger log = LoggerFactory.getLogger(UpdateDocumentTool.class);

    private final DocumentRepository documentRepository;
    private final DocumentContentGenerator contentGenerator;
    private final ObjectMapper objectMapper;

    public UpdateDocumentTool(
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
        return "updateDocument";
    }

    @Override
    public String description() {
        return "Update a document with the given description.";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "id", Map.of(
                                "type", "string",
                                "description", "The ID of the document to update",
                                "minLength", 1
                        ),
                        "description", Map.of(
                                "type", "string",
                                "description", "The description of changes that need to be made",
                                "minLength", 1,
                                "maxLength", 1000
                        )
                ),
                "required", List.of("id", "description")
        );
    }

    @Override
    public JsonNode invoke(Map<String, Object> args, ToolContext context) {
        String id = String.valueOf(args.get("id")).trim();
        String description = String.valueOf(args.get("description"));
        Document document = documentRepository.findById(id)
                .orElseThrow(() -> new IllegalStateException("Document not found: " + id));
        log.info("Updating document id={} conversation={}", id, context.conversationId());

        context.writer().writeLifecycle(FrameType.CLEAR, document.title());
        String content = contentGenerator.update(document, description, context);
        documentRepository.save(document.withContent(content));
        context.writer().writeLifecycle(FrameType.FINISH, "");

        ObjectNode result = objectMapper.createObjectNode();
        result.put("id", id);
        result.put("title", document.title());
        result.put("kind", document.kind().wireName());
        result.put("content", "The document has been updated successfully.");
        return result;
    }
}
