package me.golemcore.agent.domain.system.toolloop;

import me.golemcore.agent.domain.model.AgentRunContext;
import me.golemcore.agent.domain.model.LlmResponse;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.ToolExecutionResult;
import me.golemcore.agent.domain.model.ToolResponse;
import me.golemcore.agent.testing.ScriptedLlmPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultHistoryWriterTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private DefaultHistoryWriter writer;
    private AgentRunContext run;

    @BeforeEach
    void setUp() {
        writer = new DefaultHistoryWriter(Clock.fixed(NOW, ZoneOffset.UTC));
        run = AgentRunContext.builder()
                .messages(List.of(Message.system("sys"), Message.user("hi")))
                .build();
    }

    @Test
    void shouldAppendAssistantToolCallMessage() {
        Message.ToolCall call = ScriptedLlmPort.call("call_1", "echo", Map.of("text", "hi"));

        writer.appendAssistantToolCalls(run, ScriptedLlmPort.toolCalls(call));

        Message appended = run.getMessages().get(2);
        assertTrue(appended.isAssistantMessage());
        assertEquals(List.of(call), appended.getToolCalls());
        assertNotNull(appended.getId());
        assertEquals(NOW, appended.getTimestamp());
    }

    @Test
    void shouldAppendToolResultWithCallIdVerbatim() {
        ToolExecutionResult result = new ToolExecutionResult("echo", "", "hi",
                ToolResponse.success("hi", ToolResponse.EXECUTED_SUCCESSFULLY));

        writer.appendToolResult(run, result);

        Message appended = run.getMessages().get(2);
        assertTrue(appended.isToolMessage());
        assertEquals("", appended.getToolCallId());
        assertEquals("echo", appended.getName());
        assertEquals("hi", appended.getContent());
    }

    @Test
    void shouldAppendFinalAnswer() {
        writer.appendFinalAssistantAnswer(run, LlmResponse.builder().content("raw").build(), "Final");

        Message appended = run.getMessages().get(2);
        assertEquals("Final", appended.getContent());
        assertTrue(appended.isAssistantMessage());
    }

    @Test
    void shouldReplaceListInsteadOfMutatingIt() {
        List<Message> before = run.getMessages();

        writer.appendFinalAssistantAnswer(run, null, "Final");

        assertNotSame(before, run.getMessages());
        assertEquals(2, before.size());
        assertEquals(3, run.getMessages().size());
        assertThrows(UnsupportedOperationException.class, () -> run.getMessages().add(Message.user("x")));
    }
}
