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

import lombok.RequiredArgsConstructor;
import me.golemcore.agent.domain.service.ToolRegistry;
import me.golemcore.agent.domain.system.RetryExecutor;
import me.golemcore.agent.domain.system.toolloop.ToolLoopSystem;
import me.golemcore.agent.domain.system.toolloop.view.MessageAssembler;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.LlmPort;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Creates {@link AgentLoop} instances bound to the configured provider, the
 * current tool registry contents and the caller's callbacks.
 */
@Component
@RequiredArgsConstructor
public class AgentLoopFactory {

    private final LlmPort llmPort;
    private final ToolRegistry toolRegistry;
    private final MessageAssembler messageAssembler;
    private final ToolLoopSystem toolLoopSystem;
    private final RetryExecutor retryExecutor;
    private final AgentProperties properties;
    private final Clock clock;
    private final LoggingAgentCallbacks loggingCallbacks = new LoggingAgentCallbacks();

    public AgentLoop create() {
        return create(loggingCallbacks);
    }

    public AgentLoop create(AgentCallbacks callbacks) {
        return new AgentLoop(
                llmPort,
                toolRegistry.snapshot(),
                properties.getTools().isEnabled(),
                properties.getLlm().getModel(),
                messageAssembler,
                toolLoopSystem,
                retryExecutor,
                callbacks,
                clock);
    }
}
