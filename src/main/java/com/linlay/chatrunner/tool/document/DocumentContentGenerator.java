package com.linlay.chatrunner.tool.document;

import com.linlay.chatrunner.frame.FrameType;
import com.linlay.chatrunner.model.ArtifactKind;
import com.linlay.chatrunner.model.LlmDelta;
import com.linlay.chatrunner.model.ModelCall;
import com.linlay.chatrunner.resilience.ResilientModelClient;
import com.linlay.chatrunner.service.ChatPrompts;
import com.linlay.chatrunner.service.ModelCatalog;
import com.linlay.chatrunner.stream.FrameWriter;
import com.linlay.chatrunner.tool.ToolContext;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Generates document bodies with the artifact model, streaming every chunk into the response that
 * invoked the tool. Blocks the calling tool thread until the model finishes; an interrupt of that
 * thread cancels the model call.
 */
@Component
public class DocumentContentGenerator {

    private final ResilientModelClient modelClient;
    private final ModelCatalog modelCatalog;

    public DocumentContentGenerator(ResilientModelClient modelClient, ModelCatalog modelCatalog) {
        this.modelClient = modelClient;
        this.modelCatalog = modelCatalog;
    }

    public String create(ArtifactKind kind, String title, ToolContext context) {
        return generate(kind, ChatPrompts.createDocument(kind), title, context, "document-create");
    }

    public String update(Document document, String description, ToolContext context) {
        return generate(document.kind(), ChatPrompts.updateDocument(document.kind(), document.content()),
                description, context, "document-update");
    }

    /**
     * Runs the artifact model without streaming its output to the client.
     */
    public String complete(String systemPrompt, String userPrompt, ToolContext context, String stage) {
        StringBuilder content = new StringBuilder();
        modelClient.stream(artifactCall(systemPrompt, userPrompt, context, stage))
                .filter(LlmDelta::hasContent)
                .doOnNext(delta -> content.append(delta.content()))
                .blockLast();
        return content.toString();
    }

    private String generate(ArtifactKind kind, String systemPrompt, String userPrompt, ToolContext context, String stage) {
        StringBuilder content = new StringBuilder();
        modelClient.stream(artifactCall(systemPrompt, userPrompt, context, stage))
                .filter(LlmDelta::hasContent)
                .doOnNext(delta -> {
                    content.append(delta.content());
                    write(context.writer(), kind, delta.content());
                })
                .blockLast();
        return content.toString();
    }

    private ModelCall artifactCall(String systemPrompt, String userPrompt, ToolContext context, String stage) {
        return new ModelCall(
                modelCatalog.artifactModel(),
                List.of(new SystemMessage(systemPrompt), new UserMessage(userPrompt)),
                List.of(),
                context.visibility(),
                true,
                stage
        );
    }

    private void write(FrameWriter writer, ArtifactKind kind, String chunk) {
        switch (kind) {
            case CODE -> writer.writeContentDelta(FrameType.CODE_DELTA, chunk);
            case SHEET -> writer.writeContentDelta(FrameType.SHEET_DELTA, chunk);
            case IMAGE -> writer.writeContentDelta(FrameType.IMAGE_DELTA, chunk);
            case TEXT -> writer.writeTextDelta(chunk);
        }
    }
}
