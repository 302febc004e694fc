package me.golemcore.agent.domain.system.toolloop;

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

import me.golemcore.agent.domain.loop.AgentCallbacks;
import me.golemcore.agent.domain.model.AgentErrorCode;
import me.golemcore.agent.domain.model.AgentErrorResponse;
import me.golemcore.agent.domain.model.AgentRunContext;
import me.golemcore.agent.domain.model.LlmRequest;
import me.golemcore.agent.domain.model.LlmResponse;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.RetryContext;
import me.golemcore.agent.domain.model.SpanContext;
import me.golemcore.agent.domain.model.ToolErrorCode;
import me.golemcore.agent.domain.model.ToolExecutionResult;
import me.golemcore.agent.domain.model.ToolResponse;
import me.golemcore.agent.domain.system.LlmErrorClassifier;
import me.golemcore.agent.domain.system.RetryExecutor;
import me.golemcore.agent.domain.system.RetryListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.CancellationException;

/**
 * Tool loop orchestrator.
 *
 * <p>
 * Each iteration calls the model through the {@link RetryExecutor}. A response
 * without tool calls is the final answer. Otherwise the assistant tool-call
 * message is appended, the calls are executed one after another in the order
 * the model listed them, one tool message is appended per call, and the loop
 * continues. A failed model call ends the run immediately; retries happen only
 * inside the executor. Running out of iterations is reported as
 * {@link AgentErrorCode#MAX_ITERATIONS_EXCEEDED}.
 */
public class DefaultToolLoopSystem implements ToolLoopSystem {

    private static final Logger log = LoggerFactory.getLogger(DefaultToolLoopSystem.class);

    private final ToolInvoker toolInvoker;
    private final HistoryWriter historyWriter;
    private final RetryExecutor retryExecutor;
    private final int maxIterations;

    public DefaultToolLoopSystem(ToolInvoker toolInvoker, HistoryWriter historyWriter, RetryExecutor retryExecutor,
            int maxIterations) {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be positive: " + maxIterations);
        }
        this.toolInvoker = toolInvoker;
        this.historyWriter = historyWriter;
        this.retryExecutor = retryExecutor;
        this.maxIterations = maxIterations;
    }

    public int getMaxIterations() {
        return maxIterations;
    }

    @Override
    public ToolLoopTurnResult processTurn(AgentRunContext run) {
        AgentCallbacks callbacks = run.getCallbacks() != null ? run.getCallbacks() : AgentCallbacks.NONE;

        while (run.getLlmCalls() < maxIterations) {
            if (run.isCancelled()) {
                return aborted(run);
            }

            // 1) LLM call
            SpanContext llmSpan = run.getRootSpan().child();
            int iteration = run.getLlmCalls() + 1;
            callbacks.onLlmStart(llmSpan, run.getModel(), run.getMessages());
            callbacks.onDebug("LLM iteration " + iteration,
                    Map.of("messages", run.getMessages().size(), "toolsEnabled", run.isToolsEnabled()));

            LlmRequest request = buildRequest(run);
            LlmResponse response;
            try {
                response = retryExecutor.execute(() -> run.getLlm().chat(request), run.getToken(),
                        retryListener(callbacks));
            } catch (CancellationException e) {
                run.setLlmCalls(iteration);
                return aborted(run);
            } catch (RuntimeException e) { // NOSONAR
                run.setLlmCalls(iteration);
                return failed(run, modelFailure(run, e));
            }
            run.setLlmCalls(iteration);

            if (response == null) {
                return failed(run, AgentErrorResponse.of(AgentErrorCode.INVALID_RESPONSE,
                        "Model returned no response"));
            }
            run.addUsage(response.getUsage());
            callbacks.onLlmEnd(llmSpan, response.getContent(), response.getUsage());

            // 2) Final answer
            if (!response.hasToolCalls() || !run.isToolsEnabled()) {
                String answer = response.getContent() != null ? response.getContent() : "";
                historyWriter.appendFinalAssistantAnswer(run, response, answer);
                log.debug("[ToolLoop] Final answer after {} LLM calls, {} tool executions", run.getLlmCalls(),
                        run.getToolExecutions());
                return ToolLoopTurnResult.answered(answer, run.getLlmCalls(), run.getToolExecutions());
            }

            // 3) Tool calls, strictly in the order requested
            historyWriter.appendAssistantToolCalls(run, response);
            for (Message.ToolCall call : response.getToolCalls()) {
                ToolExecutionResult result = invokeTool(run, call);
                run.setToolExecutions(run.getToolExecutions() + 1);
                historyWriter.appendToolResult(run, result);

                if (result.isCancelled() || run.isCancelled()) {
                    return aborted(run);
                }
            }
        }

        String message = "Maximum iterations (" + maxIterations + ") reached";
        log.warn("[ToolLoop] {}", message);
        return failed(run, AgentErrorResponse.of(AgentErrorCode.MAX_ITERATIONS_EXCEEDED, message));
    }

    private ToolExecutionResult invokeTool(AgentRunContext run, Message.ToolCall call) {
        SpanContext toolSpan = run.getRootSpan().child();
        try {
            return toolInvoker.invoke(run, call, toolSpan);
        } catch (RuntimeException e) { // NOSONAR
            log.warn("[ToolLoop] Tool invoker failed for {}: {}", call.getName(), e.getMessage());
            String message = e.getMessage() != null ? e.getMessage() : "Unknown error";
            ToolResponse failure = ToolResponse.failure(ToolErrorCode.UNKNOWN, message);
            return new ToolExecutionResult(call.getName(), call.getId(), "Error: " + message, failure);
        }
    }

    private LlmRequest buildRequest(AgentRunContext run) {
        return LlmRequest.builder()
                .model(run.getModel())
                .messages(run.getMessages())
                .sessionId(run.getSessionId())
                .build();
    }

    private RetryListener retryListener(AgentCallbacks callbacks) {
        return new RetryListener() {
            @Override
            public void onRetry(RetryContext context) {
                callbacks.onRetry(context);
            }

            @Override
            public void onError(AgentErrorCode code, String message) {
                callbacks.onDebug("LLM call failed", Map.of("code", code, "message", message));
            }
        };
    }

    private AgentErrorResponse modelFailure(AgentRunContext run, RuntimeException exception) {
        AgentErrorResponse error = LlmErrorClassifier.toErrorResponse(exception, run.getLlm().getProviderId(),
                run.getModel());
        log.warn("[ToolLoop] Model call failed ({}): {}", error.getError(), error.getMessage());
        return error;
    }

    private ToolLoopTurnResult aborted(AgentRunContext run) {
        log.info("[ToolLoop] Run aborted after {} LLM calls", run.getLlmCalls());
        return failed(run, AgentErrorResponse.of(AgentErrorCode.ABORTED, "Operation aborted"));
    }

    private ToolLoopTurnResult failed(AgentRunContext run, AgentErrorResponse error) {
        return ToolLoopTurnResult.failed(error, run.getLlmCalls(), run.getToolExecutions());
    }
}
