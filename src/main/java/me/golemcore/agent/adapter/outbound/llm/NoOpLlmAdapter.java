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

package me.golemcore.agent.adapter.outbound.llm;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.model.AgentErrorCode;
import me.golemcore.agent.domain.model.LlmChunk;
import me.golemcore.agent.domain.model.LlmProviderException;
import me.golemcore.agent.domain.model.LlmRequest;
import me.golemcore.agent.domain.model.LlmResponse;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.util.concurrent.CompletableFuture;

/**
 * Fallback adapter used when no model provider is configured.
 *
 * <p>
 * Every call fails with {@link AgentErrorCode#PROVIDER_NOT_CONFIGURED}, so the
 * agent reports a configuration problem instead of a placeholder answer.
 *
 * <p>
 * Provider ID: {@code "none"}
 */
@Component
@Slf4j
public class NoOpLlmAdapter implements LlmProviderAdapter {

    static final String PROVIDER_ID = "none";
    private static final String NOT_CONFIGURED = "No model provider configured. Set agent.llm.provider "
            + "and the provider API key.";

    @Override
    public String getProviderId() {
        return PROVIDER_ID;
    }

    @Override
    public String getCurrentModel() {
        return PROVIDER_ID;
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        log.warn("NoOpLlmAdapter: chat() called - no model provider configured");
        return CompletableFuture.failedFuture(notConfigured());
    }

    @Override
    public Flux<LlmChunk> chatStream(LlmRequest request) {
        log.warn("NoOpLlmAdapter: chatStream() called - no model provider configured");
        return Flux.error(notConfigured());
    }

    @Override
    public boolean supportsToolBinding() {
        return false;
    }

    @Override
    public boolean isAvailable() {
        return false;
    }

    private static LlmProviderException notConfigured() {
        return new LlmProviderException(AgentErrorCode.PROVIDER_NOT_CONFIGURED, NOT_CONFIGURED);
    }
}
