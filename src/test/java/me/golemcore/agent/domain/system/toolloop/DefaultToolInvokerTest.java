package me.golemcore.agent.domain.system.toolloop;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.agent.domain.loop.AgentCallbacks;
import me.golemcore.agent.domain.model.AgentRunContext;
import me.golemcore.agent.domain.model.CancellationToken;
import me.golemcore.agent.domain.model.Message;
import me.golemcore.agent.domain.model.SpanContext;
import me.golemcore.agent.domain.model.ToolErrorCode;
import me.golemcore.agent.domain.model.ToolExecutionException;
import me.golemcore.agent.domain.model.ToolExecutionResult;
import me.golemcore.agent.domain.model.ToolOutput;
import me.golemcore.agent.domain.model.ToolResponse;
import me.golemcore.agent.domain.model.ToolSet;
import me.golemcore.agent.testing.ScriptedLlmPort;
import me.golemcore.agent.testing.StubTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class DefaultToolInvokerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private AgentCallbacks callbacks;
    private CancellationToken token;
    private SpanContext span;

    @BeforeEach
    void setUp() {
        callbacks = mock(AgentCallbacks.class);
        token = CancellationToken.create();
        span = SpanContext.root().child();
    }

    private AgentRunContext run(StubTool... tools) {
        return AgentRunContext.builder()
                .sessionId("session-1")
                .messageId("msg-1")
                .rootSpan(SpanContext.root())
                .token(token)
                .callbacks(callbacks)
                .llm(new ScriptedLlmPort())
                .model("test-model")
                .tools(ToolSet.of(tools))
                .toolsEnabled(true)
                .build();
    }

    private static Message.ToolCall call(String name) {
        return ScriptedLlmPort.call("call_1", name, Map.of("text", "hi"));
    }

    // ==================== Output normalization ====================

    @Test
    void shouldPassPlainTextThroughAsContent() {
        DefaultToolInvoker invoker = new DefaultToolInvoker(objectMapper, null);

        ToolExecutionResult result = invoker.invoke(run(StubTool.echo()), call("echo"), span);

        assertEquals("hi", result.content());
        assertEquals("echo", result.name());
        assertEquals("call_1", result.id());
        assertTrue(result.isSuccess());
        assertEquals(ToolResponse.EXECUTED_SUCCESSFULLY, result.response().getMessage());
        verify(callbacks).onToolStart(span, "echo", Map.of("text", "hi"));
        verify(callbacks).onToolEnd(span, "echo", result.response());
    }

    @Test
    void shouldSerializeStructuredResponseAsJson() throws Exception {
        StubTool tool = new StubTool("greet", (args, ctx) -> CompletableFuture.completedFuture(
                ToolOutput.response(ToolResponse.success(Map.of("greeting", "Hello, Ann!"), "Greeted Ann"))));
        DefaultToolInvoker invoker = new DefaultToolInvoker(objectMapper, null);

        ToolExecutionResult result = invoker.invoke(run(tool), call("greet"), span);

        JsonNode json = objectMapper.readTree(result.content());
        assertTrue(json.get("success").asBoolean());
        assertEquals("Hello, Ann!", json.get("result").get("greeting").asText());
        assertEquals("Greeted Ann", json.get("message").asText());
        assertFalse(json.has("error"));
    }

    @Test
    void shouldReportNullOutputAsUnknownFailure() {
        StubTool tool = new StubTool("silent", (args, ctx) -> CompletableFuture.completedFuture(null));
        DefaultToolInvoker invoker = new DefaultToolInvoker(objectMapper, null);

        ToolExecutionResult result = invoker.invoke(run(tool), call("silent"), span);

        assertEquals(ToolErrorCode.UNKNOWN, result.response().getError());
    }

    // ==================== Missing tool ====================

    @Test
    void shouldReturnNotFoundWithoutToolCallbacks() throws Exception {
        DefaultToolInvoker invoker = new DefaultToolInvoker(objectMapper, null);

        ToolExecutionResult result = invoker.invoke(run(StubTool.echo()), call("missing"), span);

        JsonNode json = objectMapper.readTree(result.content());
        assertFalse(json.get("success").asBoolean());
        assertEquals("NOT_FOUND", json.get("error").asText());
        assertEquals("Tool 'missing' not found", json.get("message").asText());
        assertEquals("call_1", result.id());
        verify(callbacks, never()).onToolStart(any(), anyString(), anyMap());
        verify(callbacks, never()).onToolEnd(any(), anyString(), any());
        verify(callbacks).onDebug(eq("Tool 'missing' not found"), anyMap());
    }

    // ==================== Failures ====================

    @Test
    void shouldKeepCodeOfToolExecutionException() {
        StubTool tool = new StubTool("strict", (args, ctx) -> CompletableFuture.failedFuture(
                new ToolExecutionException(ToolErrorCode.VALIDATION_ERROR, "Missing argument: path")));
        DefaultToolInvoker invoker = new DefaultToolInvoker(objectMapper, null);

        ToolExecutionResult result = invoker.invoke(run(tool), call("strict"), span);

        assertEquals(ToolErrorCode.VALIDATION_ERROR, result.response().getError());
        assertEquals("Missing argument: path", result.response().getMessage());
        verify(callbacks).onToolEnd(span, "strict", result.response());
    }

    @Test
    void shouldMapUnexpectedExceptionToUnknown() {
        StubTool tool = new StubTool("broken", (args, ctx) -> {
            throw new IllegalStateException("disk on fire");
        });
        DefaultToolInvoker invoker = new DefaultToolInvoker(objectMapper, null);

        ToolExecutionResult result = invoker.invoke(run(tool), call("broken"), span);

        assertEquals(ToolErrorCode.UNKNOWN, result.response().getError());
        assertEquals("disk on fire", result.response().getMessage());
        assertFalse(result.isCancelled());
    }

    @Test
    void shouldTimeOutSlowTool() {
        CompletableFuture<ToolOutput> pending = new CompletableFuture<>();
        StubTool tool = new StubTool("slow", (args, ctx) -> pending);
        DefaultToolInvoker invoker = new DefaultToolInvoker(objectMapper, Duration.ofMillis(50));

        ToolExecutionResult result = invoker.invoke(run(tool), call("slow"), span);

        assertEquals(ToolErrorCode.TIMEOUT, result.response().getError());
        assertEquals("Tool 'slow' timed out after 50ms", result.response().getMessage());
        assertTrue(pending.isCancelled());
    }

    // ==================== Cancellation ====================

    @Test
    void shouldNotStartToolWhenAlreadyCancelled() {
        StubTool tool = StubTool.echo();
        token.cancel();
        DefaultToolInvoker invoker = new DefaultToolInvoker(objectMapper, null);

        ToolExecutionResult result = invoker.invoke(run(tool), call("echo"), span);

        assertTrue(result.isCancelled());
        assertTrue(tool.getCalls().isEmpty());
        verify(callbacks, never()).onToolStart(any(), anyString(), anyMap());
    }

    @Test
    void shouldUnblockRunningToolOnCancel() {
        StubTool tool = new StubTool("hang", (args, ctx) -> new CompletableFuture<>());
        DefaultToolInvoker invoker = new DefaultToolInvoker(objectMapper, null);
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        try {
            scheduler.schedule(token::cancel, 50, TimeUnit.MILLISECONDS);

            ToolExecutionResult result = invoker.invoke(run(tool), call("hang"), span);

            assertTrue(result.isCancelled());
            assertEquals(ToolErrorCode.ABORTED, result.response().getError());
            verify(callbacks).onToolEnd(span, "hang", result.response());
        } finally {
            scheduler.shutdownNow();
        }
    }

    // ==================== Context ====================

    @Test
    void shouldForwardMetadataAndIdsToTool() {
        StubTool tool = new StubTool("progress", (args, ctx) -> {
            ctx.emitMetadata("percent", 50);
            return CompletableFuture.completedFuture(
                    ToolOutput.text(ctx.getSessionId() + "/" + ctx.getMessageId() + "/" + ctx.getCallId()));
        });
        DefaultToolInvoker invoker = new DefaultToolInvoker(objectMapper, null);

        ToolExecutionResult result = invoker.invoke(run(tool), call("progress"), span);

        assertEquals("session-1/msg-1/call_1", result.content());
        verify(callbacks).onToolMetadata(span, "progress", "percent", 50);
    }
}
