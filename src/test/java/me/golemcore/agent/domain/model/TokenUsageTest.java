package me.golemcore.agent.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

class TokenUsageTest {

    @Test
    void shouldSumUsageOfQueries() {
        TokenUsage total = TokenUsage.empty()
                .plus(TokenUsage.of(100, 20))
                .plus(TokenUsage.of(50, 5));

        assertEquals(150, total.getPromptTokens());
        assertEquals(25, total.getCompletionTokens());
        assertEquals(175, total.getTotalTokens());
        assertEquals(2, total.getQueryCount());
    }

    @Test
    void shouldIgnoreMissingUsage() {
        TokenUsage usage = TokenUsage.of(1, 1);

        assertSame(usage, usage.plus(null));
    }
}
