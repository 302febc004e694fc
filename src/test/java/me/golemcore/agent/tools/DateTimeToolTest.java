package me.golemcore.agent.tools;

import me.golemcore.agent.domain.model.ToolErrorCode;
import me.golemcore.agent.domain.model.ToolExecutionException;
import me.golemcore.agent.domain.model.ToolOutput;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DateTimeToolTest {

    private final DateTimeTool tool = new DateTimeTool(
            Clock.fixed(Instant.parse("2026-03-01T10:15:30Z"), ZoneOffset.UTC));

    @Test
    void shouldReturnTimeInClockZoneByDefault() {
        ToolOutput output = tool.execute(Map.of(), null).join();

        assertTrue(output.isText());
        assertEquals("2026-03-01 10:15:30 Z (Sunday)", output.getText());
    }

    @Test
    void shouldReturnTimeInRequestedZone() {
        ToolOutput output = tool.execute(Map.of("timezone", "Asia/Tokyo"), null).join();

        assertTrue(output.getText().startsWith("2026-03-01 19:15:30 JST"));
    }

    @Test
    void shouldRejectInvalidZone() {
        CompletionException thrown = assertThrows(CompletionException.class,
                () -> tool.execute(Map.of("timezone", "Mars/Olympus"), null).join());

        ToolExecutionException cause = assertInstanceOf(ToolExecutionException.class, thrown.getCause());
        assertEquals(ToolErrorCode.VALIDATION_ERROR, cause.getCode());
        assertEquals("Invalid timezone: Mars/Olympus", cause.getMessage());
    }

    @Test
    void shouldExposeDefinition() {
        assertEquals("datetime", tool.getToolName());
        assertEquals("tool", tool.getComponentType());
    }
}
