package me.golemcore.agents.tools;

import me.golemcore.agents.domain.model.ExecutionContext;
import me.golemcore.agents.domain.model.ToolResult;
import me.golemcore.agents.domain.tools.ToolExecutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DateTimeToolTest {

    private DateTimeTool dateTimeTool;
    private ExecutionContext context;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-02-14T10:30:00Z"), ZoneId.of("UTC"));
        dateTimeTool = new DateTimeTool(clock);
        context = ExecutionContext.builder().sessionId("sess-1").build();
    }

    @Test
    void getSchema_returnsCorrectDefinition() {
        assertEquals("datetime", dateTimeTool.getName());
        assertNotNull(dateTimeTool.getSchema().getDescription());
    }

    @Test
    @SuppressWarnings("unchecked")
    void execute_usesClockZoneByDefault() {
        ToolResult result = dateTimeTool.execute(context, Map.of());

        assertTrue(result.isSuccess());
        Map<String, Object> data = (Map<String, Object>) result.getData();
        assertEquals("2026-02-14 10:30:00 UTC", data.get("datetime"));
        assertEquals("SATURDAY", data.get("day_of_week"));
        assertEquals(2026, data.get("year"));
        assertEquals("FEBRUARY", data.get("month"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void execute_withTimezone() {
        ToolResult result = dateTimeTool.execute(context, Map.of("timezone", "Asia/Tokyo"));

        Map<String, Object> data = (Map<String, Object>) result.getData();
        assertEquals("Asia/Tokyo", data.get("timezone"));
        assertEquals(19, data.get("hour"));
    }

    @Test
    void execute_withInvalidTimezone() {
        ToolExecutionException e = assertThrows(ToolExecutionException.class,
                () -> dateTimeTool.execute(context, Map.of("timezone", "Invalid/Timezone")));

        assertEquals("INVALID_TIMEZONE", e.getCode());
        assertTrue(e.getDetail().contains("Invalid timezone"));
    }
}
