package me.golemcore.agent.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryPolicyTest {

    @Test
    void shouldUseDocumentedDefaults() {
        RetryPolicy policy = RetryPolicy.defaults();

        assertTrue(policy.isEnabled());
        assertEquals(3, policy.getMaxRetries());
        assertEquals(1000, policy.getBaseDelayMs());
        assertEquals(10_000, policy.getMaxDelayMs());
        assertTrue(policy.isEnableJitter());
    }

    @Test
    void shouldDoubleDelayUpToMax() {
        RetryPolicy policy = RetryPolicy.builder().baseDelayMs(100).maxDelayMs(500).build();

        assertEquals(100, policy.delayForAttempt(1));
        assertEquals(200, policy.delayForAttempt(2));
        assertEquals(400, policy.delayForAttempt(3));
        assertEquals(500, policy.delayForAttempt(4));
        assertEquals(500, policy.delayForAttempt(40));
    }

    @Test
    void shouldDisableRetries() {
        assertFalse(RetryPolicy.disabled().isEnabled());
    }
}
