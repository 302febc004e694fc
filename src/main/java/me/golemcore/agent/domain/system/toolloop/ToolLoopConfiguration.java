package me.golemcore.agent.domain.system.toolloop;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agent.domain.system.RetryExecutor;
import me.golemcore.agent.domain.system.toolloop.view.DefaultMessageAssembler;
import me.golemcore.agent.domain.system.toolloop.view.MessageAssembler;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/** Spring wiring for the tool loop (orchestrator, invoker, history, retries). */
@Configuration
public class ToolLoopConfiguration {

    @Bean
    public RetryExecutor retryExecutor(AgentProperties properties) {
        return new RetryExecutor(properties.getRetry().toPolicy());
    }

    @Bean
    public ToolInvoker toolInvoker(ObjectMapper objectMapper, AgentProperties properties) {
        long timeoutMs = properties.getTools().getTimeoutMs();
        return new DefaultToolInvoker(objectMapper, timeoutMs > 0 ? Duration.ofMillis(timeoutMs) : null);
    }

    @Bean
    public HistoryWriter toolLoopHistoryWriter(Clock clock) {
        return new DefaultHistoryWriter(clock);
    }

    @Bean
    public MessageAssembler messageAssembler(AgentProperties properties) {
        return new DefaultMessageAssembler(properties.getSystemPrompt());
    }

    @Bean
    public ToolLoopSystem toolLoopSystem(ToolInvoker toolInvoker, HistoryWriter historyWriter,
            RetryExecutor retryExecutor, AgentProperties properties) {
        return new DefaultToolLoopSystem(toolInvoker, historyWriter, retryExecutor,
                properties.getLoop().getMaxIterations());
    }
}
