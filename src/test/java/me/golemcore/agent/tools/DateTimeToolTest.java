package me.golemcore.agent.tools;

import me.golemcore.agent.domain.model.ToolDefinition;
import me.golemcore.agent.domain.model.ToolResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Map;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class DateTimeToolTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private DateTimeTool dateTimeTool;

    @BeforeEach
    void setUp() {
        dateTimeTool = new DateTimeTool(Clock.fixed(NOW, ZoneId.of("UTC")));
    }

    @Test
    void getDefinition_returnsCorrectDefinition() {
        ToolDefinition definition = dateTimeTool.getDefinition();

        assertEquals("datetime", definition.getName());
        assertNotNull(definition.getDescription());
    }

    @Test
    void execute_usesClockZoneByDefault() throws ExecutionException, InterruptedException {
        ToolResult result = dateTimeTool.execute(Map.of()).get();

        assertTrue(result.isSuccess());
        assertEquals("2026-03-01 12:00:00 UTC", result.getOutput());

        @SuppressWarnings("unchecked")
        Map<String, Object> data = (Map<String, Object>) result.getData();
        assertEquals("UTC", data.get("timezone"));
        assertEquals("SUNDAY", data.get("dayOfWeek"));
        assertEquals(NOW.toEpochMilli(), data.get("timestamp"));
    }

    @Test
    void execute_withTimezone() throws ExecutionException, InterruptedException {
        ToolResult result = dateTimeTool.execute(Map.of("timezone", "Asia/Tokyo")).get();

        assertTrue(result.isSuccess());
        assertTrue(result.getOutput().startsWith("2026-03-01 21:00:00"));
    }

    @Test
    void execute_withInvalidTimezone() throws ExecutionException, InterruptedException {
        ToolResult result = dateTimeTool.execute(Map.of("timezone", "Invalid/Timezone")).get();

        assertFalse(result.isSuccess());
        assertEquals("Invalid timezone: Invalid/Timezone", result.getOutput());
    }
}
