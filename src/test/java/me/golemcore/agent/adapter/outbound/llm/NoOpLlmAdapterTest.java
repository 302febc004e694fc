package me.golemcore.agent.adapter.outbound.llm;

import me.golemcore.agent.domain.model.AgentErrorCode;
import me.golemcore.agent.domain.model.LlmProviderException;
import me.golemcore.agent.domain.model.LlmRequest;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

class NoOpLlmAdapterTest {

    private final NoOpLlmAdapter adapter = new NoOpLlmAdapter();

    @Test
    void shouldFailChatWithProviderNotConfigured() {
        CompletionException thrown = assertThrows(CompletionException.class,
                () -> adapter.chat(LlmRequest.builder().build()).join());

        LlmProviderException cause = assertInstanceOf(LlmProviderException.class, thrown.getCause());
        assertEquals(AgentErrorCode.PROVIDER_NOT_CONFIGURED, cause.getCode());
    }

    @Test
    void shouldFailStreamWithProviderNotConfigured() {
        StepVerifier.create(adapter.chatStream(LlmRequest.builder().build()))
                .expectError(LlmProviderException.class)
                .verify();
    }

    @Test
    void shouldDescribeItselfAsUnavailable() {
        assertEquals("none", adapter.getProviderId());
        assertEquals("llm", adapter.getComponentType());
        assertFalse(adapter.isAvailable());
        assertFalse(adapter.supportsToolBinding());
    }
}
