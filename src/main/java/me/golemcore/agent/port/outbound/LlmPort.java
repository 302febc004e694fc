package me.golemcore.agent.port.outbound;

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

import me.golemcore.agent.domain.model.LlmChunk;
import me.golemcore.agent.domain.model.LlmRequest;
import me.golemcore.agent.domain.model.LlmResponse;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.system.toolloop.ToolBoundLlmPort;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for model provider interactions. Implementations translate requests to a
 * specific provider API and report failures as exceptions that
 * {@link me.golemcore.agent.domain.system.LlmErrorClassifier} understands.
 */
public interface LlmPort {

    String getProviderId();

    String getCurrentModel();

    /**
     * Sends a request and returns the complete response.
     */
    CompletableFuture<LlmResponse> chat(LlmRequest request);

    /**
     * Streams a response as incremental chunks. Tool definitions on the request
     * are ignored.
     */
    default Flux<LlmChunk> chatStream(LlmRequest request) {
        return Flux.error(new UnsupportedOperationException("Streaming not supported by " + getProviderId()));
    }

    default boolean supportsStreaming() {
        return false;
    }

    /**
     * Whether this provider accepts tool definitions and returns tool calls. When
     * {@code false} the agent runs without tools.
     */
    boolean supportsToolBinding();

    /**
     * Returns a view of this provider that sends the given tools with every
     * request.
     *
     * @throws UnsupportedOperationException
     *             if {@link #supportsToolBinding()} is {@code false}
     */
    default LlmPort bindTools(List<ToolDefinition> tools) {
        if (!supportsToolBinding()) {
            throw new UnsupportedOperationException("Provider " + getProviderId() + " does not support tool binding");
        }
        return new ToolBoundLlmPort(this, tools);
    }

    boolean isAvailable();
}
