package me.golemcore.agent.domain.loop;

import me.golemcore.agent.domain.model.AgentErrorCode;
import me.golemcore.agent.domain.model.AgentErrorResponse;
import me.golemcore.agent.domain.model.SpanContext;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class SafeAgentCallbacksTest {

    @Test
    void shouldSwallowDelegateFailures() {
        AgentCallbacks delegate = mock(AgentCallbacks.class);
        doThrow(new IllegalStateException("boom")).when(delegate).onAgentStart(any(), any());
        doThrow(new IllegalStateException("boom")).when(delegate).onError(any(), any());
        AgentCallbacks safe = SafeAgentCallbacks.wrap(delegate);
        SpanContext span = SpanContext.root();

        assertDoesNotThrow(() -> safe.onAgentStart(span, "query"));
        assertDoesNotThrow(() -> safe.onError(span, AgentErrorResponse.of(AgentErrorCode.UNKNOWN, "x")));
    }

    @Test
    void shouldForwardEveryEvent() {
        AgentCallbacks delegate = mock(AgentCallbacks.class);
        AgentCallbacks safe = SafeAgentCallbacks.wrap(delegate);
        SpanContext span = SpanContext.root();

        safe.onLlmStart(span, "model", List.of());
        safe.onLlmStream(span, "delta");
        safe.onToolMetadata(span, "tool", "key", 1);
        safe.onDebug("message", Map.of());

        verify(delegate).onLlmStart(span, "model", List.of());
        verify(delegate).onLlmStream(span, "delta");
        verify(delegate).onToolMetadata(span, "tool", "key", 1);
        verify(delegate).onDebug("message", Map.of());
    }

    @Test
    void shouldNotWrapTwice() {
        AgentCallbacks once = SafeAgentCallbacks.wrap(mock(AgentCallbacks.class));

        assertSame(once, SafeAgentCallbacks.wrap(once));
    }

    @Test
    void shouldUseNoOpCallbacksForNull() {
        assertSame(AgentCallbacks.NONE, SafeAgentCallbacks.wrap(null));
    }
}
