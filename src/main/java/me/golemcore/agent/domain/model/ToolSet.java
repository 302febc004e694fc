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

import me.golemcore.agent.domain.component.AgentTool;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, ordered set of tools available to one run, keyed by tool name.
 */
public final class ToolSet {

    private static final ToolSet EMPTY = new ToolSet(Map.of());

    private final Map<String, AgentTool> tools;

    private ToolSet(Map<String, AgentTool> tools) {
        this.tools = tools;
    }

    public static ToolSet empty() {
        return EMPTY;
    }

    /**
     * Builds a tool set. A later tool with the same name replaces an earlier one.
     */
    public static ToolSet of(Collection<? extends AgentTool> tools) {
        Map<String, AgentTool> byName = new LinkedHashMap<>();
        for (AgentTool tool : tools) {
            byName.put(tool.getToolName(), tool);
        }
        return new ToolSet(Collections.unmodifiableMap(byName));
    }

    public static ToolSet of(AgentTool... tools) {
        return of(List.of(tools));
    }

    public Optional<AgentTool> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tools.get(name));
    }

    public List<ToolDefinition> definitions() {
        return tools.values().stream().map(AgentTool::getDefinition).toList();
    }

    public List<String> names() {
        return List.copyOf(tools.keySet());
    }

    public int size() {
        return tools.size();
    }

    public boolean isEmpty() {
        return tools.isEmpty();
    }
}
