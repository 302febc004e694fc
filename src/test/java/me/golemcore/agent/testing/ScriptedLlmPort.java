package me.golemcore.agent.testing;

import me.golemcore.agent.domain.model.LlmChunk;
import me.golemcore.agent.domain.model.LlmRequest;
import me.golemcore.agent.domain.model.LlmResponse;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.TokenUsage;
import me.golemcore.agent.port.outbound.LlmPort;
import reactor.core.publisher.Flux;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Model provider that answers from a script and records every request.
 */
public class ScriptedLlmPort implements LlmPort {

    private final Deque<Function<LlmRequest, CompletableFuture<LlmResponse>>> script = new ArrayDeque<>();
    private final List<LlmRequest> requests = new CopyOnWriteArrayList<>();
    private Function<LlmRequest, CompletableFuture<LlmResponse>> fallback;
    private Function<LlmRequest, Flux<LlmChunk>> streamHandler;
    private boolean toolBinding = true;

    public ScriptedLlmPort reply(LlmResponse response) {
        script.add(request -> CompletableFuture.completedFuture(response));
        return this;
    }

    public ScriptedLlmPort fail(Throwable error) {
        script.add(request -> CompletableFuture.failedFuture(error));
        return this;
    }

    public ScriptedLlmPort then(Function<LlmRequest, CompletableFuture<LlmResponse>> step) {
        script.add(step);
        return this;
    }

    public ScriptedLlmPort always(LlmResponse response) {
        fallback = request -> CompletableFuture.completedFuture(response);
        return this;
    }

    public ScriptedLlmPort stream(Function<LlmRequest, Flux<LlmChunk>> handler) {
        streamHandler = handler;
        return this;
    }

    public ScriptedLlmPort withoutToolBinding() {
        toolBinding = false;
        return this;
    }

    public List<LlmRequest> getRequests() {
        return requests;
    }

    public static LlmResponse text(String content) {
        return LlmResponse.builder()
                .content(content)
                .usage(TokenUsage.of(10, 5))
                .build();
    }

    public static LlmResponse toolCalls(Message.ToolCall... calls) {
        return LlmResponse.builder()
                .toolCalls(List.of(calls))
                .usage(TokenUsage.of(10, 5))
                .build();
    }

    public static Message.ToolCall call(String id, String name, Map<String, Object> arguments) {
        return Message.ToolCall.builder()
                .id(id)
                .name(name)
                .arguments(arguments)
                .build();
    }

    @Override
    public String getProviderId() {
        return "scripted";
    }

    @Override
    public String getCurrentModel() {
        return "scripted-model";
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        requests.add(request);
        Function<LlmRequest, CompletableFuture<LlmResponse>> step = script.poll();
        if (step == null) {
            step = fallback;
        }
        if (step == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("No scripted response"));
        }
        return step.apply(request);
    }

    @Override
    public Flux<LlmChunk> chatStream(LlmRequest request) {
        requests.add(request);
        if (streamHandler == null) {
            return LlmPort.super.chatStream(request);
        }
        return streamHandler.apply(request);
    }

    @Override
    public boolean supportsStreaming() {
        return streamHandler != null;
    }

    @Override
    public boolean supportsToolBinding() {
        return toolBinding;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }
}
