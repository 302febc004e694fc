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
import me.golemcore.agent.domain.model.AgentErrorResponse;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.RetryContext;
import me.golemcore.agent.domain.model.SpanContext;
import me.golemcore.agent.domain.model.TokenUsage;
import me.golemcore.agent.domain.model.ToolResponse;

import java.util.List;
import java.util.Map;

/**
 * Decorator that isolates the run from failures in a caller-supplied
 * {@link AgentCallbacks}.
 */
@Slf4j
public final class SafeAgentCallbacks implements AgentCallbacks {

    private final AgentCallbacks delegate;

    private SafeAgentCallbacks(AgentCallbacks delegate) {
        this.delegate = delegate;
    }

    public static AgentCallbacks wrap(AgentCallbacks callbacks) {
        if (callbacks == null) {
            return AgentCallbacks.NONE;
        }
        if (callbacks instanceof SafeAgentCallbacks) {
            return callbacks;
        }
        return new SafeAgentCallbacks(callbacks);
    }

    @Override
    public void onAgentStart(SpanContext ctx, String query) {
        guard("onAgentStart", () -> delegate.onAgentStart(ctx, query));
    }

    @Override
    public void onAgentEnd(SpanContext ctx, String answer) {
        guard("onAgentEnd", () -> delegate.onAgentEnd(ctx, answer));
    }

    @Override
    public void onLlmStart(SpanContext ctx, String model, List<Message> messages) {
        guard("onLlmStart", () -> delegate.onLlmStart(ctx, model, messages));
    }

    @Override
    public void onLlmStream(SpanContext ctx, String chunk) {
        guard("onLlmStream", () -> delegate.onLlmStream(ctx, chunk));
    }

    @Override
    public void onLlmEnd(SpanContext ctx, String response, TokenUsage usage) {
        guard("onLlmEnd", () -> delegate.onLlmEnd(ctx, response, usage));
    }

    @Override
    public void onToolStart(SpanContext ctx, String toolName, Map<String, Object> arguments) {
        guard("onToolStart", () -> delegate.onToolStart(ctx, toolName, arguments));
    }

    @Override
    public void onToolEnd(SpanContext ctx, String toolName, ToolResponse result) {
        guard("onToolEnd", () -> delegate.onToolEnd(ctx, toolName, result));
    }

    @Override
    public void onToolMetadata(SpanContext ctx, String toolName, String key, Object value) {
        guard("onToolMetadata", () -> delegate.onToolMetadata(ctx, toolName, key, value));
    }

    @Override
    public void onError(SpanContext ctx, AgentErrorResponse error) {
        guard("onError", () -> delegate.onError(ctx, error));
    }

    @Override
    public void onRetry(RetryContext retry) {
        guard("onRetry", () -> delegate.onRetry(retry));
    }

    @Override
    public void onDebug(String message, Map<String, Object> data) {
        guard("onDebug", () -> delegate.onDebug(message, data));
    }

    private void guard(String name, Runnable call) {
        try {
            call.run();
        } catch (RuntimeException e) { // NOSONAR
            log.warn("[Callbacks] {} failed: {}", name, e.getMessage());
        }
    }
}
