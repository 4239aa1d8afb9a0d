package com.linlay.chatrunner.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.linlay.chatrunner.frame.FrameType;
import com.linlay.chatrunner.model.ArtifactKind;
import com.linlay.chatrunner.stream.FrameWriter;
import com.linlay.chatrunner.tool.document.Document;
import com.linlay.chatrunner.tool.document.DocumentContentGenerator;
import com.linlay.chatrunner.tool.document.DocumentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Component
public class CreateDocumentTool implements ChatTool {

    private static final Logger log = LoggerFactory.getLogger(CreateDocumentTool.class);

    private final DocumentRepository documentRepository;
    private final DocumentContentGenerator contentGenerator;
    private final ObjectMapper objectMapper;

    public CreateDocumentTool(
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
        return "createDocument";
    }

    @Override
    public String description() {
        return "Create a document for writing or content creation activities. The content is generated "
                + "from the title and kind.";
    }

    @Override
    public Map<String, Object> parametersSchema() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "title", Map.of(
                                "type", "string",
                                "description", "The title of the document to create",
                                "minLength", 1,
                                "maxLength", 200
                        ),
                        "kind", Map.of(
                                "type", "string",
                                "description", "The type of document to create",
                                "enum", List.of("text", "code", "sheet")
                        )
                ),
                "required", List.of("title", "kind")
        );
    }

    @Override
    public JsonNode invoke(Map<String, Object> args, ToolContext context) {
        String title = String.valueOf(args.get("title")).trim();
        ArtifactKind kind = ArtifactKind.fromWireName(String.valueOf(args.get("kind")))
                .orElseThrow(() -> new IllegalArgumentException("Unsupported document kind: " + args.get("kind")));
        String id = UUID.randomUUID().toString();
        log.info("Creating {} document '{}' id={} conversation={}", kind.wireName(), title, id, context.conversationId());

        FrameWriter writer = context.writer();
        writer.writeLifecycle(FrameType.KIND, kind.wireName());
        writer.writeLifecycle(FrameType.ID, id);
        writer.writeLifecycle(FrameType.TITLE, title);
        writer.writeLifecycle(FrameType.CLEAR, "");

        String content = contentGenerator.create(kind, title, context);
        documentRepository.save(new Document(id, title, kind, content, context.userId(), Instant.now()));

        writer.writeLifecycle(FrameType.FINISH, "");

        ObjectNode result = objectMapper.createObjectNode();
        result.put("id", id);
        result.put("title", title);
        result.put("kind", kind.wireName());
        result.put("content", "A document was created and is now visible to the user.");
        return result;
    }
}
