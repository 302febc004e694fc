package me.golemcore.agent.tools;

import me.golemcore.agent.domain.component.AgentTool;
import me.golemcore.agent.domain.model.ToolContext;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolOutput;
import me.golemcore.agent.domain.model.ToolResponse;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Greets someone by name. Returns a structured response with a
 * {@code greeting} field.
 */
@Component
public class HelloWorldTool implements AgentTool {

    private static final String DEFAULT_NAME = "World";

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("hello_world")
                .description("Say hello to someone. Returns greeting message.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "name", Map.of(
                                        "type", "string",
                                        "description", "Name to greet")),
                        "required", List.of()))
                .build();
    }

    @Override
    public CompletableFuture<ToolOutput> execute(Map<String, Object> arguments, ToolContext context) {
        Object value = arguments != null ? arguments.get("name") : null;
        String name = value != null && !value.toString().isBlank() ? value.toString() : DEFAULT_NAME;
        ToolResponse response = ToolResponse.success(Map.of("greeting", "Hello, " + name + "!"), "Greeted " + name);
        return CompletableFuture.completedFuture(ToolOutput.response(response));
    }
}
