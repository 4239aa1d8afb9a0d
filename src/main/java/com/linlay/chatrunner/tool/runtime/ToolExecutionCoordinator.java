package com.linlay.chatrunner.tool.runtime;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.linlay.chatrunner.config.ToolProperties;
import com.linlay.chatrunner.frame.FrameType;
import com.linlay.chatrunner.model.ErrorKind;
import com.linlay.chatrunner.stream.FrameWriter;
import com.linlay.chatrunner.tool.ChatTool;
import com.linlay.chatrunner.tool.ToolArgumentValidator;
import com.linlay.chatrunner.tool.ToolContext;
import com.linlay.chatrunner.tool.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the tool calls of one model turn, one after another in the order the model listed them.
 * <p>
 * Every call first gets a {@code tool-call} frame. Arguments that fail to parse or to match the
 * tool's schema end the call with {@code tool-error}/{@code invalid_arguments} and the tool body
 * never runs. Otherwise {@code tool-start} is written, the body runs on a worker thread with a view
 * of the response's own {@link FrameWriter} that stops accepting writes once the call has ended, and
 * the call ends with {@code tool-result} plus
 * {@code tool-complete}, or with {@code tool-error}/{@code tool_execution_error} on exception or
 * timeout. A failed call still contributes a tool response, carrying the error, so the model can
 * continue the conversation.
 * <p>
 * Interrupting the calling thread cancels the running tool and aborts the batch with
 * {@link CancellationException}.
 */
@Component
public class ToolExecutionCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ToolExecutionCoordinator.class);

    private static final ExecutorService TOOL_EXECUTOR = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "chat-runner-tool");
        thread.setDaemon(true);
        return thread;
    });

    private final ToolRegistry toolRegistry;
    private final ToolArgumentValidator argumentValidator;
    private final ObjectMapper objectMapper;
    private final Duration toolTimeout;

    public ToolExecutionCoordinator(
            ToolRegistry toolRegistry,
            ToolArgumentValidator argumentValidator,
            ObjectMapper objectMapper,
            ToolProperties toolProperties
    ) {
        this.toolRegistry = toolRegistry;
        this.argumentValidator = argumentValidator;
        this.objectMapper = objectMapper;
        this.toolTimeout = toolProperties.timeout();
    }

    public ToolBatchResult execute(List<AssistantMessage.ToolCall> toolCalls, ToolContext context) {
        List<ToolInvocation> invocations = new ArrayList<>();
        List<ToolResponseMessage.ToolResponse> responses = new ArrayList<>();
        for (AssistantMessage.ToolCall toolCall : toolCalls) {
            if (context.writer().isCancelled() || Thread.currentThread().isInterrupted()) {
                throw new CancellationException("Response cancelled before tool " + toolCall.name());
            }
            ToolInvocation invocation = executeOne(toolCall, context);
            invocations.add(invocation);
            responses.add(new ToolResponseMessage.ToolResponse(
                    toolCall.id(),
                    toolCall.name(),
                    responseData(invocation)
            ));
        }
        return new ToolBatchResult(invocations, new ToolResponseMessage(responses));
    }

    private ToolInvocation executeOne(AssistantMessage.ToolCall toolCall, ToolContext context) {
        FrameWriter writer = context.writer();
        ToolInvocation invocation = ToolInvocation.requested(toolCall.id(), toolCall.name(), toolCall.arguments());

        ObjectNode callFrame = frameBase(invocation);
        callFrame.put("arguments", StringUtils.hasText(toolCall.arguments()) ? toolCall.arguments() : "{}");
        writer.writeToolEvent(FrameType.TOOL_CALL, callFrame);

        ChatTool tool = toolRegistry.find(toolCall.name()).orElse(null);
        if (tool == null) {
            return reject(invocation, writer, List.of("unknown tool '" + toolCall.name() + "'"));
        }
        ToolArgumentValidator.Result validation = argumentValidator.validate(tool, toolCall.arguments());
        if (!validation.isValid()) {
            return reject(invocation, writer, validation.errors());
        }

        ToolInvocation executing = invocation.executing();
        ObjectNode startFrame = frameBase(executing);
        startFrame.set("arguments", validation.arguments());
        writer.writeToolEvent(FrameType.TOOL_START, startFrame);

        Map<String, Object> args = objectMapper.convertValue(validation.arguments(), new TypeReference<>() {
        });
        try {
            JsonNode output = invokeWithTimeout(tool, args, context, executing);
            ToolInvocation completed = executing.completed(output == null ? objectMapper.getNodeFactory().nullNode() : output);
            ObjectNode resultFrame = frameBase(completed);
            resultFrame.set("result", completed.result());
            writer.writeToolEvent(FrameType.TOOL_RESULT, resultFrame);
            writer.writeToolEvent(FrameType.TOOL_COMPLETE, frameBase(completed));
            log.debug("Tool '{}' call={} completed", completed.toolName(), completed.callId());
            return completed;
        } catch (TimeoutException ex) {
            return fail(executing, writer, "Tool timed out after " + toolTimeout.toMillis() + " ms");
        } catch (CancellationException ex) {
            if (writer.isCancelled() || Thread.currentThread().isInterrupted()) {
                throw ex;
            }
            log.warn("Tool '{}' call={} was cancelled: {}", executing.toolName(), executing.callId(), ex.toString());
            return fail(executing, writer, resolveErrorMessage(ex));
        } catch (RuntimeException ex) {
            log.warn("Tool '{}' call={} failed: {}", executing.toolName(), executing.callId(), ex.toString());
            return fail(executing, writer, resolveErrorMessage(ex));
        }
    }

    private JsonNode invokeWithTimeout(
            ChatTool tool,
            Map<String, Object> args,
            ToolContext context,
            ToolInvocation invocation
    ) throws TimeoutException {
        InvocationFrameWriter scopedWriter = new InvocationFrameWriter(
                context.writer(), invocation.toolName(), invocation.callId());
        ToolContext scopedContext = new ToolContext(
                context.conversationId(), context.userId(), context.visibility(), scopedWriter);
        Future<JsonNode> future = TOOL_EXECUTOR.submit(() -> tool.invoke(args, scopedContext));
        try {
            return future.get(toolTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            throw ex;
        } catch (InterruptedException ex) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            CancellationException cancellation = new CancellationException("Tool " + tool.name() + " cancelled");
            cancellation.initCause(ex);
            throw cancellation;
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new IllegalStateException(cause == null ? ex : cause);
        } finally {
            scopedWriter.close();
        }
    }

    private ToolInvocation reject(ToolInvocation invocation, FrameWriter writer, List<String> errors) {
        String message = String.join("; ", errors);
        log.info("Rejected tool call '{}' call={}: {}", invocation.toolName(), invocation.callId(), message);
        ToolInvocation failed = invocation.failed(ErrorKind.INVALID_ARGUMENTS, message);
        ObjectNode errorFrame = errorFrame(failed);
        errors.forEach(errorFrame.putArray("errors")::add);
        writer.writeToolEvent(FrameType.TOOL_ERROR, errorFrame);
        return failed;
    }

    private ToolInvocation fail(ToolInvocation invocation, FrameWriter writer, String message) {
        ToolInvocation failed = invocation.failed(ErrorKind.TOOL_EXECUTION_ERROR, message);
        writer.writeToolEvent(FrameType.TOOL_ERROR, errorFrame(failed));
        return failed;
    }

    private ObjectNode frameBase(ToolInvocation invocation) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("id", invocation.callId());
        node.put("name", invocation.toolName());
        return node;
    }

    private ObjectNode errorFrame(ToolInvocation failed) {
        ObjectNode node = frameBase(failed);
        node.put("kind", failed.errorKind().code());
        node.put("message", failed.errorMessage());
        return node;
    }

    private String responseData(ToolInvocation invocation) {
        if (invocation.state() == ToolInvocationState.COMPLETED) {
            return invocation.result().toString();
        }
        ObjectNode error = objectMapper.createObjectNode();
        error.put("ok", false);
        error.put("kind", invocation.errorKind().code());
        error.put("error", invocation.errorMessage());
        return error.toString();
    }

    private String resolveErrorMessage(Throwable throwable) {
        Throwable cursor = throwable;
        while (cursor != null) {
            if (StringUtils.hasText(cursor.getMessage())) {
                return cursor.getMessage();
            }
            cursor = cursor.getCause();
        }
        return "unknown error";
    }
}
