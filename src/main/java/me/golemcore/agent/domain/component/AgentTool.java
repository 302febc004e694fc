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

package me.golemcore.agent.domain.component;

import me.golemcore.agent.domain.model.ToolContext;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolOutput;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * A capability the model can invoke by name. Tools expose their JSON Schema
 * definition for function calling and implement the execution.
 *
 * <p>
 * A tool returns either plain text ({@link ToolOutput#text(String)}) or a
 * structured response ({@link ToolOutput#response}). Structured failures may
 * also be reported by completing exceptionally with a
 * {@link me.golemcore.agent.domain.model.ToolExecutionException}.
 */
public interface AgentTool extends Component {

    @Override
    default String getComponentType() {
        return "tool";
    }

    /**
     * Returns the tool definition with JSON Schema for function calling.
     */
    ToolDefinition getDefinition();

    /**
     * Executes the tool.
     *
     * @param arguments
     *            arguments parsed from the model's tool call
     * @param context
     *            session ids, the run's cancellation token and a metadata sink;
     *            long-running tools should check the token between steps
     * @return a future with the tool output
     */
    CompletableFuture<ToolOutput> execute(Map<String, Object> arguments, ToolContext context);

    default String getToolName() {
        return getDefinition().getName();
    }
}
