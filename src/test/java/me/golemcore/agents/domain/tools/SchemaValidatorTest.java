package me.golemcore.agents.domain.tools;

import me.golemcore.agents.domain.model.ToolParameter;
import me.golemcore.agents.domain.model.ToolSchema;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SchemaValidatorTest {

    private static final ToolSchema SCHEMA = ToolSchema.builder()
            .name("search")
            .description("Searches things")
            .parameter(ToolParameter.builder()
                    .name("query")
                    .type(ToolParameter.Type.STRING)
                    .required(true)
                    .pattern("^[a-z ]+$")
                    .build())
            .parameter(ToolParameter.builder()
                    .name("mode")
                    .type(ToolParameter.Type.STRING)
                    .enumValues(List.of("fast", "deep"))
                    .defaultValue("fast")
                    .build())
            .parameter(ToolParameter.builder()
                    .name("limit")
                    .type(ToolParameter.Type.NUMBER)
                    .minimum(1.0)
                    .maximum(50.0)
                    .build())
            .parameter(ToolParameter.builder()
                    .name("exact")
                    .type(ToolParameter.Type.BOOLEAN)
                    .build())
            .parameter(ToolParameter.builder()
                    .name("filters")
                    .type(ToolParameter.Type.OBJECT)
                    .build())
            .parameter(ToolParameter.builder()
                    .name("tags")
                    .type(ToolParameter.Type.ARRAY)
                    .build())
            .build();

    private static ValidationException rejected(Map<String, Object> input) {
        return assertThrows(ValidationException.class, () -> SchemaValidator.validate(SCHEMA, input));
    }

    // ==================== validate ====================

    @Test
    void shouldAcceptValidInput() {
        assertDoesNotThrow(() -> SchemaValidator.validate(SCHEMA, Map.of(
                "query", "hello world",
                "mode", "deep",
                "limit", "10",
                "exact", "TRUE",
                "filters", Map.of("lang", "en"),
                "tags", List.of("a"))));
    }

    @Test
    void shouldReportMissingRequiredBeforeUnknownKeys() {
        ValidationException e = rejected(Map.of("unexpected", 1));

        assertEquals("query", e.getParameter());
        assertEquals("required parameter missing", e.getReason());
    }

    @Test
    void shouldRejectUnknownParameter() {
        ValidationException e = rejected(Map.of("query", "hi", "extra", true));

        assertEquals("extra", e.getParameter());
        assertEquals("unknown parameter", e.getReason());
    }

    @Test
    void shouldRejectExplicitNullForRequiredParameter() {
        Map<String, Object> input = new HashMap<>();
        input.put("query", null);

        assertEquals("required parameter cannot be null", rejected(input).getReason());
    }

    @Test
    void shouldAllowExplicitNullForOptionalParameter() {
        Map<String, Object> input = new HashMap<>();
        input.put("query", "hi");
        input.put("limit", null);

        assertDoesNotThrow(() -> SchemaValidator.validate(SCHEMA, input));
    }

    @Test
    void shouldEnforceEnumPatternAndRange() {
        assertEquals("value must be one of: fast, deep", rejected(Map.of("query", "hi", "mode", "slow")).getReason());
        assertTrue(rejected(Map.of("query", "HI")).getReason().startsWith("value does not match pattern"));
        assertEquals("value must be >= 1", rejected(Map.of("query", "hi", "limit", 0)).getReason());
        assertEquals("value must be <= 50", rejected(Map.of("query", "hi", "limit", 51.5)).getReason());
    }

    @Test
    void shouldRejectWrongTypes() {
        assertEquals("expected string value", rejected(Map.of("query", 42)).getReason());
        assertEquals("expected number value", rejected(Map.of("query", "hi", "limit", "ten")).getReason());
        assertEquals("expected boolean value", rejected(Map.of("query", "hi", "exact", "yes")).getReason());
        assertEquals("expected object value", rejected(Map.of("query", "hi", "filters", "x")).getReason());
        assertEquals("expected array value", rejected(Map.of("query", "hi", "tags", "x")).getReason());
    }

    // ==================== sanitize ====================

    @Test
    void shouldSanitizeToCanonicalTypes() {
        Map<String, Object> sanitized = SchemaValidator.sanitize(SCHEMA, Map.of(
                "query", "hi",
                "limit", "5",
                "exact", "false",
                "tags", new Object[] { "a", "b" }));

        assertEquals("hi", sanitized.get("query"));
        assertEquals(5.0, sanitized.get("limit"));
        assertEquals(Boolean.FALSE, sanitized.get("exact"));
        assertEquals(List.of("a", "b"), sanitized.get("tags"));
        assertEquals("fast", sanitized.get("mode"));
        assertFalse(sanitized.containsKey("filters"));
    }

    @Test
    void shouldConvertIntegersToDouble() {
        Map<String, Object> sanitized = SchemaValidator.sanitize(SCHEMA, Map.of("query", "hi", "limit", 7));

        assertEquals(7.0, sanitized.get("limit"));
    }

    // ==================== toJsonSchema ====================

    @Test
    @SuppressWarnings("unchecked")
    void shouldRenderJsonSchema() {
        Map<String, Object> jsonSchema = SchemaValidator.toJsonSchema(SCHEMA);

        assertEquals("object", jsonSchema.get("type"));
        assertEquals(List.of("query"), jsonSchema.get("required"));
        Map<String, Object> properties = (Map<String, Object>) jsonSchema.get("properties");
        Map<String, Object> mode = (Map<String, Object>) properties.get("mode");
        assertEquals("string", mode.get("type"));
        assertEquals(List.of("fast", "deep"), mode.get("enum"));
        assertEquals("fast", mode.get("default"));
        Map<String, Object> limit = (Map<String, Object>) properties.get("limit");
        assertEquals(1.0, limit.get("minimum"));
        assertEquals(50.0, limit.get("maximum"));
    }
}
