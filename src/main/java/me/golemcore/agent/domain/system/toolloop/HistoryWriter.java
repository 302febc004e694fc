package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.model.AgentRunContext;
import me.golemcore.agent.domain.model.LlmResponse;
import me.golemcore.agent.domain.model.ToolExecutionResult;

/**
 * Appends messages produced during the tool loop to the run's sequence.
 */
public interface HistoryWriter {

    void appendAssistantToolCalls(AgentRunContext run, LlmResponse response);

    void appendToolResult(AgentRunContext run, ToolExecutionResult result);

    void appendFinalAssistantAnswer(AgentRunContext run, LlmResponse response, String finalText);
}
