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
 * Callbacks that write run lifecycle events to the application log.
 */
@Slf4j
public class LoggingAgentCallbacks implements AgentCallbacks {

    @Override
    public void onAgentStart(SpanContext ctx, String query) {
        log.info("[Agent] Run started (trace {}): {} chars", ctx.traceId(), query != null ? query.length() : 0);
    }

    @Override
    public void onAgentEnd(SpanContext ctx, String answer) {
        log.info("[Agent] Run finished (trace {}): {} chars", ctx.traceId(), answer != null ? answer.length() : 0);
    }

    @Override
    public void onLlmStart(SpanContext ctx, String model, List<Message> messages) {
        log.debug("[LLM] Calling {} with {} messages (span {})", model, messages.size(), ctx.spanId());
    }

    @Override
    public void onLlmEnd(SpanContext ctx, String response, TokenUsage usage) {
        if (usage != null) {
            log.debug("[LLM] Response received (span {}): {} prompt / {} completion tokens", ctx.spanId(),
                    usage.getPromptTokens(), usage.getCompletionTokens());
        } else {
            log.debug("[LLM] Response received (span {})", ctx.spanId());
        }
    }

    @Override
    public void onToolStart(SpanContext ctx, String toolName, Map<String, Object> arguments) {
        log.debug("[Tools] {} started (span {})", toolName, ctx.spanId());
    }

    @Override
    public void onToolEnd(SpanContext ctx, String toolName, ToolResponse result) {
        if (result != null && !result.isSuccess()) {
            log.info("[Tools] {} failed: {} {}", toolName, result.getError(), result.getMessage());
        } else {
            log.debug("[Tools] {} finished (span {})", toolName, ctx.spanId());
        }
    }

    @Override
    public void onError(SpanContext ctx, AgentErrorResponse error) {
        log.error("[Agent] Run failed (trace {}): {} {}", ctx.traceId(), error.getError(), error.getMessage());
    }

    @Override
    public void onRetry(RetryContext retry) {
        log.info("[Agent] Retrying model call {}/{} in {}ms after {}", retry.attempt(), retry.maxRetries(),
                retry.delayMs(), retry.error());
    }

    @Override
    public void onDebug(String message, Map<String, Object> data) {
        log.debug("[Agent] {} {}", message, data != null ? data : "");
    }
}
