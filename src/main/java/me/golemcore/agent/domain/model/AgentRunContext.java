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
import lombok.Data;
import me.golemcore.agent.domain.loop.AgentCallbacks;
import me.golemcore.agent.port.outbound.LlmPort;

import java.util.List;

/**
 * State of a single agent run. Owned by the loop for the duration of the run;
 * nothing keeps a reference to it afterwards.
 *
 * <p>
 * {@link #messages} is always an immutable list. Appending replaces it with a
 * longer copy.
 */
@Data
@Builder
public class AgentRunContext {

    private String sessionId;
    private String messageId;
    private SpanContext rootSpan;
    private CancellationToken token;
    private AgentCallbacks callbacks;

    private LlmPort llm;
    private String model;
    private ToolSet tools;
    private boolean toolsEnabled;

    @Builder.Default
    private List<Message> messages = List.of();
    @Builder.Default
    private TokenUsage usage = TokenUsage.empty();
    private int llmCalls;
    private int toolExecutions;

    public void addUsage(TokenUsage delta) {
        this.usage = usage.plus(delta);
    }

    public boolean isCancelled() {
        return token != null && token.isCancelled();
    }
}
