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

import me.golemcore.agent.domain.model.LlmChunk;
import me.golemcore.agent.domain.model.LlmRequest;
import me.golemcore.agent.domain.model.LlmResponse;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.port.outbound.LlmPort;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Decorator around {@link LlmPort} that attaches a fixed list of tool
 * definitions to every chat request. Streaming requests pass through without
 * tools.
 */
public class ToolBoundLlmPort implements LlmPort {

    private final LlmPort delegate;
    private final List<ToolDefinition> tools;

    public ToolBoundLlmPort(LlmPort delegate, List<ToolDefinition> tools) {
        this.delegate = delegate;
        this.tools = List.copyOf(tools);
    }

    public List<ToolDefinition> getTools() {
        return tools;
    }

    @Override
    public String getProviderId() {
        return delegate.getProviderId();
    }

    @Override
    public String getCurrentModel() {
        return delegate.getCurrentModel();
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return delegate.chat(request.toBuilder().tools(tools).build());
    }

    @Override
    public Flux<LlmChunk> chatStream(LlmRequest request) {
        return delegate.chatStream(request.toBuilder().tools(null).build());
    }

    @Override
    public boolean supportsStreaming() {
        return delegate.supportsStreaming();
    }

    @Override
    public boolean supportsToolBinding() {
        return true;
    }

    @Override
    public LlmPort bindTools(List<ToolDefinition> newTools) {
        return new ToolBoundLlmPort(delegate, newTools);
    }

    @Override
    public boolean isAvailable() {
        return delegate.isAvailable();
    }
}
