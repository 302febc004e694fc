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

package me.golemcore.agent.domain.loop;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.model.AgentErrorCode;
import me.golemcore.agent.domain.model.AgentErrorResponse;
import me.golemcore.agent.domain.model.AgentRunContext;
import me.golemcore.agent.domain.model.AgentRunResult;
import me.golemcore.agent.domain.model.CancellationToken;
import me.golemcore.agent.domain.model.LlmChunk;
import me.golemcore.agent.domain.model.LlmRequest;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.RetryContext;
import me.golemcore.agent.domain.model.SpanContext;
import me.golemcore.agent.domain.model.TokenUsage;
import me.golemcore.agent.domain.model.ToolSet;
import me.golemcore.agent.domain.system.LlmErrorClassifier;
import me.golemcore.agent.domain.system.RetryExecutor;
import me.golemcore.agent.domain.system.RetryListener;
import me.golemcore.agent.domain.system.StreamListener;
import me.golemcore.agent.domain.system.StreamRelay;
import me.golemcore.agent.domain.system.toolloop.ToolLoopSystem;
import me.golemcore.agent.domain.system.toolloop.ToolLoopTurnResult;
import me.golemcore.agent.domain.system.toolloop.view.ConversationView;
import me.golemcore.agent.domain.system.toolloop.view.MessageAssembler;
import me.golemcore.agent.port.outbound.LlmPort;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Agent entry point: answers a query, calling tools as the model requests.
 *
 * <p>
 * Two modes:
 * <ul>
 * <li>{@link #run} / {@link #runDetailed} - blocking, with tool calling when the
 * provider supports tool binding and tools are registered;</li>
 * <li>{@link #runStream} - lazy stream of text deltas, tools are ignored.</li>
 * </ul>
 * Neither mode throws. A failure is reported to {@link AgentCallbacks#onError}
 * and returned (or emitted last) as {@code "Error: <message>"}.
 *
 * <p>
 * Each invocation gets a fresh {@link CancellationToken}; {@link #abort()}
 * cancels the most recent one. Aborting never affects a later run.
 */
@Slf4j
public class AgentLoop {

    static final String ERROR_PREFIX = "Error: ";
    static final String ABORTED_MESSAGE = "Operation aborted";

    private final LlmPort llm;
    private final ToolSet tools;
    private final boolean toolsEnabled;
    private final String model;
    private final MessageAssembler messageAssembler;
    private final ToolLoopSystem toolLoopSystem;
    private final RetryExecutor retryExecutor;
    private final AgentCallbacks callbacks;
    private final Clock clock;
    private final String sessionId;
    private final AtomicReference<CancellationToken> activeToken = new AtomicReference<>();

    public AgentLoop(LlmPort llm, ToolSet tools, boolean toolsEnabled, String model, MessageAssembler messageAssembler,
            ToolLoopSystem toolLoopSystem, RetryExecutor retryExecutor, AgentCallbacks callbacks, Clock clock) {
        this.llm = llm;
        this.tools = tools != null ? tools : ToolSet.empty();
        this.toolsEnabled = toolsEnabled;
        this.model = model != null ? model : llm.getCurrentModel();
        this.messageAssembler = messageAssembler;
        this.toolLoopSystem = toolLoopSystem;
        this.retryExecutor = retryExecutor;
        this.callbacks = SafeAgentCallbacks.wrap(callbacks);
        this.clock = clock;
        this.sessionId = "session-" + clock.millis() + "-" + randomHex();
    }

    public String getSessionId() {
        return sessionId;
    }

    /**
     * Runs the query to completion and returns the final answer or an
     * {@code "Error: ..."} string.
     */
    public String run(String query, List<Message> history) {
        return runDetailed(query, history).getAnswer();
    }

    public String run(String query) {
        return run(query, null);
    }

    /**
     * Same as {@link #run} but also returns counters, usage, the structured error
     * and the final message sequence.
     */
    public AgentRunResult runDetailed(String query, List<Message> history) {
        CancellationToken token = CancellationToken.create();
        activeToken.set(token);
        SpanContext root = SpanContext.root();
        callbacks.onAgentStart(root, query);

        AgentRunContext run = null;
        try {
            ConversationView view = messageAssembler.assemble(query, history);
            reportDiagnostics(view);

            boolean useTools = resolveToolMode();
            run = AgentRunContext.builder()
                    .sessionId(sessionId)
                    .messageId(newMessageId())
                    .rootSpan(root)
                    .token(token)
                    .callbacks(callbacks)
                    .llm(useTools ? llm.bindTools(tools.definitions()) : llm)
                    .model(model)
                    .tools(useTools ? tools : ToolSet.empty())
                    .toolsEnabled(useTools)
                    .messages(view.messages())
                    .build();

            ToolLoopTurnResult result = toolLoopSystem.processTurn(run);
            if (result.finalAnswerReady()) {
                callbacks.onAgentEnd(root, result.answer());
                return AgentRunResult.builder()
                        .answer(result.answer())
                        .success(true)
                        .llmCalls(result.llmCalls())
                        .toolExecutions(result.toolExecutions())
                        .usage(run.getUsage())
                        .messages(run.getMessages())
                        .build();
            }
            return failedResult(root, result.error(), run);
        } catch (RuntimeException e) { // NOSONAR
            log.error("[Agent] Run failed unexpectedly", e);
            callbacks.onDebug("Agent.run error", Map.of("error", String.valueOf(e.getMessage())));
            AgentErrorResponse error = LlmErrorClassifier.toErrorResponse(e, llm.getProviderId(), model);
            return failedResult(root, error, run);
        } finally {
            activeToken.compareAndSet(token, null);
        }
    }

    /**
     * Streams the answer as text deltas. Tool calling is not available in this
     * mode. Connection failures before the first delta are retried; failures
     * after it end the stream with a final {@code "Error: ..."} element.
     */
    public Flux<String> runStream(String query, List<Message> history) {
        return Flux.defer(() -> {
            CancellationToken token = CancellationToken.create();
            activeToken.set(token);
            SpanContext root = SpanContext.root();
            callbacks.onAgentStart(root, query);
            try {
                return streamAnswer(query, history, token, root)
                        .doFinally(signal -> activeToken.compareAndSet(token, null));
            } catch (RuntimeException e) { // NOSONAR
                activeToken.compareAndSet(token, null);
                return Flux.just(emitError(root, LlmErrorClassifier.toErrorResponse(e, llm.getProviderId(), model)));
            }
        });
    }

    public Flux<String> runStream(String query) {
        return runStream(query, null);
    }

    /**
     * Cancels the run in progress, if any.
     *
     * @return {@code true} if a running invocation was signalled
     */
    public boolean abort() {
        CancellationToken token = activeToken.get();
        if (token == null) {
            return false;
        }
        boolean cancelled = token.cancel();
        if (cancelled) {
            log.info("[Agent] Abort requested");
        }
        return cancelled;
    }

    private Flux<String> streamAnswer(String query, List<Message> history, CancellationToken token,
            SpanContext root) {
        ConversationView view = messageAssembler.assemble(query, history);
        reportDiagnostics(view);
        if (!tools.isEmpty()) {
            callbacks.onDebug("Streaming mode does not support tool calling, tools are ignored",
                    Map.of("tools", tools.names()));
        }

        SpanContext llmSpan = root.child();
        callbacks.onLlmStart(llmSpan, model, view.messages());

        LlmRequest request = LlmRequest.builder()
                .model(model)
                .messages(view.messages())
                .sessionId(sessionId)
                .build();

        StringBuilder fullText = new StringBuilder();
        AtomicReference<TokenUsage> usage = new AtomicReference<>();
        StreamListener listener = new StreamListener() {
            @Override
            public void onChunk(String text) {
                fullText.append(text);
                callbacks.onLlmStream(llmSpan, text);
            }

            @Override
            public void onEnd(TokenUsage finalUsage) {
                usage.set(finalUsage);
            }
        };

        Flux<LlmChunk> chunks = retryExecutor.executeStream(() -> llm.chatStream(request), token,
                retryListener());

        return StreamRelay.relay(chunks, listener)
                .filter(LlmChunk::hasText)
                .map(LlmChunk::getText)
                .takeUntilOther(token.whenCancelled())
                .concatWith(Flux.defer(() -> {
                    if (token.isCancelled()) {
                        return Flux.just(emitError(root, AgentErrorResponse.of(AgentErrorCode.ABORTED,
                                ABORTED_MESSAGE)));
                    }
                    String answer = fullText.toString();
                    callbacks.onLlmEnd(llmSpan, answer, usage.get());
                    callbacks.onAgentEnd(root, answer);
                    return Flux.empty();
                }))
                .onErrorResume(error -> {
                    AgentErrorResponse response = error instanceof CancellationException || token.isCancelled()
                            ? AgentErrorResponse.of(AgentErrorCode.ABORTED, ABORTED_MESSAGE)
                            : LlmErrorClassifier.toErrorResponse(error, llm.getProviderId(), model);
                    log.warn("[Agent] Stream failed ({}): {}", response.getError(), response.getMessage());
                    return Flux.just(emitError(root, response));
                });
    }

    private boolean resolveToolMode() {
        if (!toolsEnabled || tools.isEmpty()) {
            return false;
        }
        if (!llm.supportsToolBinding()) {
            callbacks.onDebug("Provider does not support function calling, skipping tool binding",
                    Map.of("provider", llm.getProviderId()));
            return false;
        }
        return true;
    }

    private void reportDiagnostics(ConversationView view) {
        for (String diagnostic : view.diagnostics()) {
            callbacks.onDebug(diagnostic, Map.of());
        }
    }

    private RetryListener retryListener() {
        return new RetryListener() {
            @Override
            public void onRetry(RetryContext context) {
                callbacks.onRetry(context);
            }

            @Override
            public void onError(AgentErrorCode code, String message) {
                callbacks.onDebug("LLM stream failed", Map.of("code", code, "message", message));
            }
        };
    }

    private AgentRunResult failedResult(SpanContext root, AgentErrorResponse error, AgentRunContext run) {
        String answer = emitError(root, error);
        return AgentRunResult.builder()
                .answer(answer)
                .success(false)
                .error(error)
                .llmCalls(run != null ? run.getLlmCalls() : 0)
                .toolExecutions(run != null ? run.getToolExecutions() : 0)
                .usage(run != null ? run.getUsage() : TokenUsage.empty())
                .messages(run != null ? run.getMessages() : List.of())
                .build();
    }

    /**
     * Reports a terminal failure: {@code onError} first, then {@code onAgentEnd}
     * with the error text.
     */
    private String emitError(SpanContext root, AgentErrorResponse error) {
        String text = ERROR_PREFIX + error.getMessage();
        callbacks.onError(root, error);
        callbacks.onAgentEnd(root, text);
        return text;
    }

    private String newMessageId() {
        return "msg-" + clock.millis() + "-" + randomHex();
    }

    private static String randomHex() {
        return String.format("%08x", ThreadLocalRandom.current().nextInt());
    }
}
