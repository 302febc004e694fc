package me.golemcore.agent.domain.service;

import me.golemcore.agent.domain.model.ToolSet;
import me.golemcore.agent.testing.StubTool;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

class ToolRegistryTest {

    @Test
    void shouldRegisterOnlyEnabledTools() {
        ToolRegistry registry = new ToolRegistry(List.of(
                StubTool.returningText("alpha", "a"),
                StubTool.returningText("beta", "b").disabled()));

        assertTrue(registry.getTool("alpha").isPresent());
        assertFalse(registry.getTool("beta").isPresent());
    }

    @Test
    void shouldKeepRegistrationOrderInSnapshot() {
        ToolRegistry registry = new ToolRegistry(List.of(
                StubTool.returningText("zeta", "z"),
                StubTool.returningText("alpha", "a")));

        assertEquals(List.of("zeta", "alpha"), registry.snapshot().names());
    }

    @Test
    void shouldNotChangeSnapshotAfterRegistration() {
        ToolRegistry registry = new ToolRegistry(List.of(StubTool.returningText("alpha", "a")));
        ToolSet snapshot = registry.snapshot();

        registry.register(StubTool.returningText("beta", "b"));

        assertEquals(1, snapshot.size());
        assertEquals(2, registry.snapshot().size());
    }

    @Test
    void shouldRejectInvalidToolName() {
        ToolRegistry registry = new ToolRegistry(List.of());

        assertThrows(IllegalArgumentException.class,
                () -> registry.register(StubTool.returningText("bad name!", "x")));
    }

    @Test
    void shouldReplaceAndDestroyToolWithSameName() {
        StubTool original = spy(StubTool.returningText("alpha", "old"));
        StubTool replacement = StubTool.returningText("alpha", "new");
        ToolRegistry registry = new ToolRegistry(List.of(original));

        registry.register(replacement);

        assertSame(replacement, registry.getTool("alpha").orElseThrow());
        verify(original).destroy();
    }

    @Test
    void shouldUnregisterTools() {
        StubTool alpha = spy(StubTool.returningText("alpha", "a"));
        ToolRegistry registry = new ToolRegistry(List.of(alpha, StubTool.returningText("beta", "b")));

        registry.unregister(List.of("alpha", "unknown"));

        assertEquals(List.of("beta"), registry.snapshot().names());
        verify(alpha).destroy();
    }
}
