package me.golemcore.agent.domain.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AgentErrorCodeTest {

    @Test
    void shouldRetryOnlyTransientKinds() {
        assertTrue(AgentErrorCode.RATE_LIMITED.isRetryable());
        assertTrue(AgentErrorCode.NETWORK_ERROR.isRetryable());
        assertTrue(AgentErrorCode.TIMEOUT.isRetryable());
        assertFalse(AgentErrorCode.AUTHENTICATION_ERROR.isRetryable());
        assertFalse(AgentErrorCode.CONTEXT_LENGTH_EXCEEDED.isRetryable());
        assertFalse(AgentErrorCode.ABORTED.isRetryable());
    }

    @ParameterizedTest
    @EnumSource(AgentErrorCode.class)
    void shouldDescribeEveryCode(AgentErrorCode code) {
        assertNotNull(code.userFriendlyMessage());
    }

    @Test
    void shouldUseProviderMetadataInMessages() {
        ProviderErrorMetadata metadata = ProviderErrorMetadata.builder()
                .provider("openai")
                .model("gpt-4o")
                .retryAfter(Duration.ofSeconds(30))
                .build();

        assertEquals("Rate limited by openai. Retry after 30 seconds.",
                AgentErrorCode.RATE_LIMITED.userFriendlyMessage(metadata));
        assertEquals("Model 'gpt-4o' not found on openai.",
                AgentErrorCode.MODEL_NOT_FOUND.userFriendlyMessage(metadata));
        assertEquals("Authentication failed with the provider. Please check your API key.",
                AgentErrorCode.AUTHENTICATION_ERROR.userFriendlyMessage());
    }

    @Test
    void shouldMapToolCodesToAgentCodes() {
        assertEquals(AgentErrorCode.NOT_FOUND, ToolErrorCode.NOT_FOUND.toAgentErrorCode());
        assertEquals(AgentErrorCode.TIMEOUT, ToolErrorCode.TIMEOUT.toAgentErrorCode());
        assertEquals(AgentErrorCode.ABORTED, ToolErrorCode.ABORTED.toAgentErrorCode());
    }
}
