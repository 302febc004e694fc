package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.model.AgentRunContext;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.SpanContext;
import me.golemcore.agent.domain.model.ToolExecutionResult;

/**
 * Executes one tool call requested by the model.
 *
 * <p>
 * Implementations never throw for tool failures: unknown tools, structured
 * failures, exceptions, timeouts and cancellation all become a
 * {@link ToolExecutionResult} whose content is fed back to the model.
 */
public interface ToolInvoker {

    ToolExecutionResult invoke(AgentRunContext run, Message.ToolCall call, SpanContext span);
}
