package com.linlay.chatrunner.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.linlay.chatrunner.config.ToolProperties;
import com.linlay.chatrunner.frame.Frame;
import com.linlay.chatrunner.frame.FrameType;
import com.linlay.chatrunner.memory.ConversationMemory;
import com.linlay.chatrunner.model.ChatRequest;
import com.linlay.chatrunner.model.ErrorKind;
import com.linlay.chatrunner.model.FunctionTool;
import com.linlay.chatrunner.model.ModelCall;
import com.linlay.chatrunner.model.ResolvedModel;
import com.linlay.chatrunner.resilience.ResilientModelClient;
import com.linlay.chatrunner.resilience.UpstreamException;
import com.linlay.chatrunner.stream.CoordinatedFrameWriter;
import com.linlay.chatrunner.stream.FrameWriter;
import com.linlay.chatrunner.tool.ToolContext;
import com.linlay.chatrunner.tool.ToolRegistry;
import com.linlay.chatrunner.tool.runtime.ToolBatchResult;
import com.linlay.chatrunner.tool.runtime.ToolExecutionCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;

/**
 * Produces the frame stream of one chat response.
 * <p>
 * The response starts with a {@code model-routing} frame. The model then gets up to
 * {@code chat.tools.max-steps} turns in which it may call tools; text is forwarded as
 * {@code text-delta} while it streams, and requested tools run through the
 * {@link ToolExecutionCoordinator} with the response's own writer. A model still asking for tools
 * after the last step gets one more turn without tool definitions.
 * <p>
 * The loop runs on a bounded-elastic worker. Cancelling the returned flux interrupts that worker,
 * which cancels the upstream call or the running tool.
 */
@Service
public class ChatStreamService {

    private static final Logger log = LoggerFactory.getLogger(ChatStreamService.class);

    private final ModelRouter modelRouter;
    private final ModelCatalog modelCatalog;
    private final ResilientModelClient modelClient;
    private final ToolRegistry toolRegistry;
    private final ToolExecutionCoordinator toolCoordinator;
    private final ConversationMemory conversationMemory;
    private final ToolProperties toolProperties;
    private final ObjectMapper objectMapper;

    public ChatStreamService(
            ModelRouter modelRouter,
            ModelCatalog modelCatalog,
            ResilientModelClient modelClient,
            ToolRegistry toolRegistry,
            ToolExecutionCoordinator toolCoordinator,
            ConversationMemory conversationMemory,
            ToolProperties toolProperties,
            ObjectMapper objectMapper
    ) {
        this.modelRouter = modelRouter;
        this.modelCatalog = modelCatalog;
        this.modelClient = modelClient;
        this.toolRegistry = toolRegistry;
        this.toolCoordinator = toolCoordinator;
        this.conversationMemory = conversationMemory;
        this.toolProperties = toolProperties;
        this.objectMapper = objectMapper;
    }

    public Flux<Frame> stream(ChatRequest request, String userId) {
        return Flux.create(sink -> {
            CoordinatedFrameWriter writer = new CoordinatedFrameWriter(sink, objectMapper);
            Disposable task = Schedulers.boundedElastic().schedule(() -> run(request, userId, writer, sink));
            sink.onCancel(task);
        }, FluxSink.OverflowStrategy.BUFFER);
    }

    private void run(ChatRequest request, String userId, CoordinatedFrameWriter writer, FluxSink<Frame> sink) {
        try {
            RoutingDecision routing = modelRouter.route(request.modelId(), userId);
            writeRouting(writer, routing);
            ResolvedModel model = modelCatalog.resolve(routing.selectedModel());

            String assistantText = runTurns(request, userId, model, writer);
            conversationMemory.append(userId, request.conversationId(), request.message(), assistantText);
            log.info("Chat {} finished, model={}, frames={}",
                    request.conversationId(), model.modelId(), writer.framesWritten());
        } catch (UpstreamException ex) {
            log.warn("Chat {} ended with upstream error kind={}: {}",
                    request.conversationId(), ex.kind().code(), ex.getMessage());
            writer.writeError(ex.kind().code(), ex.getMessage());
        } catch (RuntimeException ex) {
            if (isCancellation(ex, writer)) {
                log.info("Chat {} cancelled by client", request.conversationId());
                return;
            }
            log.error("Chat {} failed", request.conversationId(), ex);
            writer.writeError(ErrorKind.INTERNAL_ERROR.code(), "Internal error while generating the response");
        }
        if (!sink.isCancelled()) {
            sink.complete();
        }
    }

    private String runTurns(ChatRequest request, String userId, ResolvedModel model, FrameWriter writer) {
        List<FunctionTool> tools = model.toolsEnabled() ? toolRegistry.functionTools() : List.of();
        String systemPrompt = tools.isEmpty() ? ChatPrompts.CHAT_SYSTEM_NO_TOOLS : ChatPrompts.CHAT_SYSTEM;

        List<Message> messages = new ArrayList<>();
        messages.add(new SystemMessage(systemPrompt));
        messages.addAll(conversationMemory.loadHistory(userId, request.conversationId()));
        messages.add(new UserMessage(request.message()));

        ToolContext toolContext = new ToolContext(request.conversationId(), userId, request.visibility(), writer);
        StringBuilder assistantText = new StringBuilder();
        int maxSteps = toolProperties.maxSteps();
        for (int step = 1; step <= maxSteps; step++) {
            ModelTurnAccumulator turn = streamTurn(
                    new ModelCall(model, messages, tools, request.visibility(), true, "chat-turn-" + step),
                    writer
            );
            assistantText.append(turn.text());
            if (!turn.hasToolCalls()) {
                return assistantText.toString();
            }
            List<AssistantMessage.ToolCall> toolCalls = turn.toolCalls();
            log.debug("Chat {} step {} requested tools {}", request.conversationId(), step,
                    toolCalls.stream().map(AssistantMessage.ToolCall::name).toList());
            messages.add(new AssistantMessage(turn.text(), Map.of(), toolCalls));
            ToolBatchResult batch = toolCoordinator.execute(toolCalls, toolContext);
            messages.add(batch.responseMessage());
        }

        log.info("Chat {} reached {} tool steps, asking for a final answer without tools",
                request.conversationId(), maxSteps);
        ModelTurnAccumulator last = streamTurn(
                new ModelCall(model, messages, List.of(), request.visibility(), true, "chat-final"),
                writer
        );
        assistantText.append(last.text());
        return assistantText.toString();
    }

    private ModelTurnAccumulator streamTurn(ModelCall call, FrameWriter writer) {
        ModelTurnAccumulator turn = new ModelTurnAccumulator(call.stage());
        modelClient.stream(call)
                .doOnNext(delta -> {
                    if (writer.isCancelled()) {
                        throw new CancellationException("Response cancelled during " + call.stage());
                    }
                    turn.accept(delta);
                    if (delta.hasContent()) {
                        writer.writeTextDelta(delta.content());
                    }
                })
                .blockLast();
        return turn;
    }

    private void writeRouting(FrameWriter writer, RoutingDecision routing) {
        ObjectNode data = objectMapper.createObjectNode();
        data.put("requestedModel", routing.requestedModel());
        data.put("selectedModel", routing.selectedModel());
        data.put("routed", routing.routed());
        writer.writeLifecycle(FrameType.MODEL_ROUTING, data);
    }

    private boolean isCancellation(Throwable ex, FrameWriter writer) {
        if (writer.isCancelled() || Thread.currentThread().isInterrupted()) {
            return true;
        }
        Throwable cursor = ex;
        while (cursor != null) {
            if (cursor instanceof CancellationException || cursor instanceof InterruptedException) {
                return true;
            }
            cursor = cursor.getCause();
        }
        return false;
    }
}
