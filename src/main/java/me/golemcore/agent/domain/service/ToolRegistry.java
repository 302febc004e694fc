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

package me.golemcore.agent.domain.service;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.domain.component.AgentTool;
import me.golemcore.agent.domain.model.ToolSet;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Registry of tools available to agent runs.
 *
 * <p>
 * Enabled {@link AgentTool} beans are registered at startup; more can be added
 * or removed at runtime. Runs never see the live registry: each run takes an
 * immutable {@link #snapshot()}.
 */
@Service
@Slf4j
public class ToolRegistry {

    private static final Pattern TOOL_NAME = Pattern.compile("[a-zA-Z0-9_-]{1,64}");

    private final Map<String, AgentTool> tools = new LinkedHashMap<>();

    public ToolRegistry(List<AgentTool> tools) {
        for (AgentTool tool : tools) {
            if (tool.isEnabled()) {
                register(tool);
            } else {
                log.debug("[Tools] Skipping disabled tool: {}", tool.getToolName());
            }
        }
        log.info("[Tools] Registered {} tools", this.tools.size());
    }

    /**
     * Adds a tool, replacing any tool with the same name.
     *
     * @throws IllegalArgumentException
     *             if the tool name is not accepted by function-calling APIs
     */
    public synchronized void register(AgentTool tool) {
        String name = tool.getToolName();
        if (name == null || !TOOL_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid tool name: '" + name + "'");
        }
        tool.initialize();
        AgentTool previous = tools.put(name, tool);
        if (previous != null && previous != tool) {
            log.warn("[Tools] Tool '{}' replaced", name);
            previous.destroy();
        }
        log.debug("[Tools] Registered tool: {}", name);
    }

    public synchronized void unregister(Collection<String> names) {
        for (String name : names) {
            AgentTool removed = tools.remove(name);
            if (removed != null) {
                removed.destroy();
            }
        }
        log.debug("[Tools] Unregistered tools: {}", names);
    }

    public synchronized Optional<AgentTool> getTool(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public synchronized ToolSet snapshot() {
        return ToolSet.of(tools.values());
    }
}
