/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.agent.domain.system.toolloop;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.component.AgentTool;
import me.golemcore.agent.domain.loop.AgentCallbacks;
import me.golemcore.agent.domain.model.AgentRunContext;
import me.golemcore.agent.domain.model.CancellationToken;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.SpanContext;
import me.golemcore.agent.domain.model.ToolContext;
import me.golemcore.agent.domain.model.ToolErrorCode;
import me.golemcore.agent.domain.model.ToolExecutionException;
import me.golemcore.agent.domain.model.ToolExecutionResult;
import me.golemcore.agent.domain.model.ToolOutput;
import me.golemcore.agent.domain.model.ToolResponse;
import me.golemcore.agent.domain.system.LlmErrorClassifier;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Default {@link ToolInvoker}.
 *
 * <p>
 * Content sent to the model:
 * <ul>
 * <li>plain text output: the text itself;
 * <li>structured output or any failure: the {@link ToolResponse} as JSON.
 * </ul>
 * Observers always receive a {@link ToolResponse}; plain text is reported as a
 * success with message {@value ToolResponse#EXECUTED_SUCCESSFULLY}. A missing
 * tool produces a {@code NOT_FOUND} result without start/end callbacks.
 */
@Slf4j
public class DefaultToolInvoker implements ToolInvoker {

    private final ObjectMapper objectMapper;
    private final Duration timeout;

    /**
     * @param timeout
     *            per-call deadline; {@code null} or zero disables it
     */
    public DefaultToolInvoker(ObjectMapper objectMapper, Duration timeout) {
        this.objectMapper = objectMapper;
        this.timeout = timeout;
    }

    @Override
    public ToolExecutionResult invoke(AgentRunContext run, Message.ToolCall call, SpanContext span) {
        String toolName = call.getName();
        AgentCallbacks callbacks = run.getCallbacks() != null ? run.getCallbacks() : AgentCallbacks.NONE;

        Optional<AgentTool> tool = run.getTools() != null ? run.getTools().find(toolName) : Optional.empty();
        if (tool.isEmpty()) {
            String message = "Tool '" + toolName + "' not found";
            log.debug("[Tools] {}", message);
            callbacks.onDebug(message, Map.of("toolCall", call));
            return failed(call, ToolResponse.failure(ToolErrorCode.NOT_FOUND, message));
        }

        if (run.isCancelled()) {
            return failed(call, ToolResponse.failure(ToolErrorCode.ABORTED, "Tool execution cancelled"));
        }

        Map<String, Object> arguments = call.getArguments() != null ? call.getArguments() : Map.of();
        callbacks.onToolStart(span, toolName, arguments);

        ToolContext toolContext = ToolContext.builder()
                .sessionId(run.getSessionId())
                .messageId(run.getMessageId())
                .callId(call.getId())
                .cancellationToken(run.getToken())
                .metadataSink((key, value) -> callbacks.onToolMetadata(span, toolName, key, value))
                .build();

        ToolExecutionResult result;
        try {
            ToolOutput output = await(tool.get().execute(arguments, toolContext), run.getToken());
            result = normalize(call, output);
        } catch (Exception e) { // NOSONAR
            ToolResponse failure = toFailure(toolName, e, run.getToken());
            log.debug("[Tools] {} failed: {} {}", toolName, failure.getError(), failure.getMessage());
            result = failed(call, failure);
        }

        callbacks.onToolEnd(span, toolName, result.response());
        return result;
    }

    private ToolOutput await(CompletableFuture<ToolOutput> future, CancellationToken token)
            throws ExecutionException, InterruptedException, TimeoutException {
        if (future == null) {
            return null;
        }
        if (token != null) {
            token.bind(future);
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return future.get();
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        }
    }

    private ToolExecutionResult normalize(Message.ToolCall call, ToolOutput output) {
        if (output == null) {
            return failed(call, ToolResponse.failure(ToolErrorCode.UNKNOWN,
                    "Tool '" + call.getName() + "' returned no output"));
        }
        if (output.isText()) {
            ToolResponse synthetic = ToolResponse.success(output.getText(), ToolResponse.EXECUTED_SUCCESSFULLY);
            return new ToolExecutionResult(call.getName(), call.getId(), output.getText(), synthetic);
        }
        ToolResponse response = output.getResponse();
        return new ToolExecutionResult(call.getName(), call.getId(), toJson(response), response);
    }

    private ToolExecutionResult failed(Message.ToolCall call, ToolResponse failure) {
        return new ToolExecutionResult(call.getName(), call.getId(), toJson(failure), failure);
    }

    private ToolResponse toFailure(String toolName, Exception exception, CancellationToken token) {
        if (exception instanceof InterruptedException) {
            Thread.currentThread().interrupt();
            return ToolResponse.failure(ToolErrorCode.ABORTED, "Tool execution interrupted");
        }
        if (exception instanceof TimeoutException) {
            return ToolResponse.failure(ToolErrorCode.TIMEOUT,
                    "Tool '" + toolName + "' timed out after " + timeout.toMillis() + "ms");
        }
        Throwable cause = LlmErrorClassifier.unwrap(exception);
        if (cause instanceof ToolExecutionException toolException) {
            return ToolResponse.failure(toolException.getCode(), safeMessage(toolException));
        }
        if (cause instanceof CancellationException || (token != null && token.isCancelled())) {
            return ToolResponse.failure(ToolErrorCode.ABORTED, "Tool execution cancelled");
        }
        if (cause instanceof TimeoutException) {
            return ToolResponse.failure(ToolErrorCode.TIMEOUT, safeMessage(cause));
        }
        return ToolResponse.failure(ToolErrorCode.UNKNOWN, safeMessage(cause));
    }

    private static String safeMessage(Throwable throwable) {
        String message = throwable.getMessage();
        return message != null && !message.isBlank() ? message : "Unknown error";
    }

    String toJson(ToolResponse response) {
        try {
            return objectMapper.writeValueAsString(response);
        } catch (JsonProcessingException e) {
            log.warn("[Tools] Failed to serialize tool response: {}", e.getMessage());
            ObjectNode fallback = objectMapper.createObjectNode();
            fallback.put("success", response.isSuccess());
            if (response.getError() != null) {
                fallback.put("error", response.getError().name());
            }
            fallback.put("message", response.getMessage());
            return fallback.toString();
        }
    }
}
