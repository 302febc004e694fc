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

import me.golemcore.agent.domain.model.AgentErrorResponse;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.RetryContext;
import me.golemcore.agent.domain.model.SpanContext;
import me.golemcore.agent.domain.model.TokenUsage;
import me.golemcore.agent.domain.model.ToolResponse;

import java.util.List;
import java.util.Map;

/**
 * Observer of an agent run. Every method is optional and fire-and-forget; the
 * loop wraps implementations in {@link SafeAgentCallbacks} so a throwing
 * callback never affects the run.
 */
public interface AgentCallbacks {

    AgentCallbacks NONE = new AgentCallbacks() {
    };

    default void onAgentStart(SpanContext ctx, String query) {
    }

    /**
     * Called once per run with the final answer, or with the
     * {@code "Error: ..."} text after {@link #onError}.
     */
    default void onAgentEnd(SpanContext ctx, String answer) {
    }

    default void onLlmStart(SpanContext ctx, String model, List<Message> messages) {
    }

    default void onLlmStream(SpanContext ctx, String chunk) {
    }

    default void onLlmEnd(SpanContext ctx, String response, TokenUsage usage) {
    }

    default void onToolStart(SpanContext ctx, String toolName, Map<String, Object> arguments) {
    }

    default void onToolEnd(SpanContext ctx, String toolName, ToolResponse result) {
    }

    /**
     * Intermediate metadata published by a running tool.
     */
    default void onToolMetadata(SpanContext ctx, String toolName, String key, Object value) {
    }

    default void onError(SpanContext ctx, AgentErrorResponse error) {
    }

    default void onRetry(RetryContext retry) {
    }

    default void onDebug(String message, Map<String, Object> data) {
    }
}
