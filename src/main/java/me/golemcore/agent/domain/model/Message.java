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

package me.golemcore.agent.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Single immutable entry of a conversation sent to the model. Roles are
 * {@code system}, {@code user}, {@code assistant} and {@code tool}. A tool
 * message carries the id of the tool call it answers in {@link #toolCallId}.
 *
 * <p>
 * Sequences of messages are extended by building new lists, never by mutating
 * an existing message.
 */
@Value
@Builder(toBuilder = true)
public class Message {

    public static final String ROLE_SYSTEM = "system";
    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_TOOL = "tool";

    String id;
    String role;
    String content;
    String name;
    String toolCallId;
    List<ToolCall> toolCalls;
    Instant timestamp;

    public boolean isSystemMessage() {
        return ROLE_SYSTEM.equals(role);
    }

    public boolean isUserMessage() {
        return ROLE_USER.equals(role);
    }

    public boolean isAssistantMessage() {
        return ROLE_ASSISTANT.equals(role);
    }

    public boolean isToolMessage() {
        return ROLE_TOOL.equals(role);
    }

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    public static Message system(String content) {
        return Message.builder().role(ROLE_SYSTEM).content(content).build();
    }

    public static Message user(String content) {
        return Message.builder().role(ROLE_USER).content(content).build();
    }

    public static Message assistant(String content) {
        return Message.builder().role(ROLE_ASSISTANT).content(content).build();
    }

    public static Message tool(String toolCallId, String toolName, String content) {
        return Message.builder()
                .role(ROLE_TOOL)
                .toolCallId(toolCallId)
                .name(toolName)
                .content(content)
                .build();
    }

    /**
     * A tool invocation requested by the model. The id may be empty when the
     * provider omits one.
     */
    @Value
    @Builder
    public static class ToolCall {
        String id;
        String name;
        Map<String, Object> arguments;
    }
}
