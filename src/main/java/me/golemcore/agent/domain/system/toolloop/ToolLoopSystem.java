package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.model.AgentRunContext;

/**
 * Runs the model/tool loop for one prepared run until a final answer or a
 * terminal failure.
 */
public interface ToolLoopSystem {

    ToolLoopTurnResult processTurn(AgentRunContext run);
}
