package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.model.AgentErrorResponse;

/**
 * Outcome of {@link ToolLoopSystem#processTurn}. Exactly one of
 * {@code answer} and {@code error} is set.
 */
public record ToolLoopTurnResult(boolean finalAnswerReady, String answer, AgentErrorResponse error, int llmCalls,
        int toolExecutions) {

    public static ToolLoopTurnResult answered(String answer, int llmCalls, int toolExecutions) {
        return new ToolLoopTurnResult(true, answer, null, llmCalls, toolExecutions);
    }

    public static ToolLoopTurnResult failed(AgentErrorResponse error, int llmCalls, int toolExecutions) {
        return new ToolLoopTurnResult(false, null, error, llmCalls, toolExecutions);
    }
}
