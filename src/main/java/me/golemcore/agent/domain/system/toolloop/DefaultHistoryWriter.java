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

import me.golemcore.agent.domain.model.AgentRunContext;
import me.golemcore.agent.domain.model.LlmResponse;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.ToolExecutionResult;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Appends by copy: every call replaces the run's message list with a new
 * immutable list one element longer.
 */
public class DefaultHistoryWriter implements HistoryWriter {

    private final Clock clock;

    public DefaultHistoryWriter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void appendAssistantToolCalls(AgentRunContext run, LlmResponse response) {
        Message assistant = Message.builder()
                .id(UUID.randomUUID().toString())
                .role(Message.ROLE_ASSISTANT)
                .content(response != null ? response.getContent() : null)
                .toolCalls(response != null && response.getToolCalls() != null
                        ? List.copyOf(response.getToolCalls())
                        : List.of())
                .timestamp(now())
                .build();
        append(run, assistant);
    }

    @Override
    public void appendToolResult(AgentRunContext run, ToolExecutionResult result) {
        Message toolMessage = Message.builder()
                .id(UUID.randomUUID().toString())
                .role(Message.ROLE_TOOL)
                .toolCallId(result.id())
                .name(result.name())
                .content(result.content())
                .timestamp(now())
                .build();
        append(run, toolMessage);
    }

    @Override
    public void appendFinalAssistantAnswer(AgentRunContext run, LlmResponse response, String finalText) {
        Message assistant = Message.builder()
                .id(UUID.randomUUID().toString())
                .role(Message.ROLE_ASSISTANT)
                .content(finalText)
                .timestamp(now())
                .build();
        append(run, assistant);
    }

    private void append(AgentRunContext run, Message message) {
        List<Message> current = run.getMessages() != null ? run.getMessages() : List.of();
        List<Message> next = new ArrayList<>(current.size() + 1);
        next.addAll(current);
        next.add(message);
        run.setMessages(List.copyOf(next));
    }

    private Instant now() {
        return clock != null ? clock.instant() : Instant.now();
    }
}
