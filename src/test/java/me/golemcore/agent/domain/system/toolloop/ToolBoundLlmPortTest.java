package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.model.LlmChunk;
import me.golemcore.agent.domain.model.LlmRequest;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.port.outbound.LlmPort;
import me.golemcore.agent.testing.ScriptedLlmPort;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ToolBoundLlmPortTest {

    private static final ToolDefinition ECHO = ToolDefinition.simple("echo", "Echo text");
    private static final ToolDefinition CLOCK = ToolDefinition.simple("clock", "Tell time");

    private static LlmRequest request() {
        return LlmRequest.builder().model("m").messages(List.of(Message.user("hi"))).build();
    }

    @Test
    void shouldAttachToolsToEveryChatRequest() {
        ScriptedLlmPort llm = new ScriptedLlmPort().always(ScriptedLlmPort.text("ok"));
        LlmPort bound = llm.bindTools(List.of(ECHO));

        bound.chat(request()).join();
        bound.chat(request()).join();

        assertEquals(List.of(ECHO), llm.getRequests().get(0).getTools());
        assertEquals(List.of(ECHO), llm.getRequests().get(1).getTools());
    }

    @Test
    void shouldStreamWithoutTools() {
        ScriptedLlmPort llm = new ScriptedLlmPort()
                .stream(request -> Flux.just(LlmChunk.builder().text("x").build()));
        LlmPort bound = llm.bindTools(List.of(ECHO));

        StepVerifier.create(bound.chatStream(request()))
                .expectNextCount(1)
                .verifyComplete();

        assertNull(llm.getRequests().get(0).getTools());
    }

    @Test
    void shouldRebindOnDelegate() {
        ScriptedLlmPort llm = new ScriptedLlmPort().always(ScriptedLlmPort.text("ok"));

        LlmPort rebound = llm.bindTools(List.of(ECHO)).bindTools(List.of(CLOCK));
        rebound.chat(request()).join();

        ToolBoundLlmPort port = assertInstanceOf(ToolBoundLlmPort.class, rebound);
        assertEquals(List.of(CLOCK), port.getTools());
        assertEquals(List.of(CLOCK), llm.getRequests().get(0).getTools());
    }

    @Test
    void shouldRefuseBindingWithoutCapability() {
        ScriptedLlmPort llm = new ScriptedLlmPort().withoutToolBinding();

        assertThrows(UnsupportedOperationException.class, () -> llm.bindTools(List.of(ECHO)));
    }
}
