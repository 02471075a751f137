package me.golemcore.agents.tools;

import me.golemcore.agents.domain.model.ExecutionContext;
import me.golemcore.agents.domain.model.ToolResult;
import me.golemcore.agents.domain.tools.ToolExecutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonProcessorToolTest {

    private static final String DOCUMENT = "{\"user\": {\"name\": \"John\", \"tags\": [\"a\", \"b\"]}, \"age\": 30}";

    private JsonProcessorTool tool;
    private ExecutionContext context;

    @BeforeEach
    void setUp() {
        tool = new JsonProcessorTool();
        context = ExecutionContext.builder().sessionId("sess-1").build();
    }

    @SuppressWarnings("unchecked")
    private Object run(Map<String, Object> input) {
        ToolResult result = tool.execute(context, input);
        assertTrue(result.isSuccess());
        return ((Map<String, Object>) result.getData()).get("result");
    }

    @Test
    void shouldValidateJson() {
        Object result = run(Map.of("json_data", DOCUMENT, "operation", "validate"));

        assertEquals(Map.of("valid", true, "message", "JSON is valid"), result);
    }

    @Test
    void shouldReportInvalidJson() {
        ToolExecutionException e = assertThrows(ToolExecutionException.class,
                () -> tool.execute(context, Map.of("json_data", "{broken", "operation", "validate")));

        assertEquals("INVALID_JSON", e.getCode());
        assertTrue(e.getDetail().startsWith("Invalid JSON: "));
    }

    @Test
    void shouldMinifyAndPrettyPrint() {
        assertEquals("{\"a\":1,\"b\":[1,2]}", run(Map.of("json_data", "{ \"a\" : 1, \"b\": [1, 2] }",
                "operation", "minify")));

        String pretty = (String) run(Map.of("json_data", "{\"a\":1}", "operation", "pretty_print"));
        assertEquals("{\n  \"a\": 1\n}", pretty);
    }

    @Test
    void shouldExtractTopLevelKeys() {
        assertEquals(List.of("user", "age"), run(Map.of("json_data", DOCUMENT, "operation", "extract_keys")));
        assertEquals(List.of(), run(Map.of("json_data", "[1, 2]", "operation", "extract_keys")));
    }

    @Test
    void shouldReadNestedValues() {
        assertEquals("John", run(Map.of("json_data", DOCUMENT, "operation", "get_value", "path", "user.name")));
        assertEquals("b", run(Map.of("json_data", DOCUMENT, "operation", "get_value", "path", "user.tags.1")));
        assertEquals(30, run(Map.of("json_data", DOCUMENT, "operation", "get_value", "path", "age")));
    }

    @Test
    void shouldRequirePathForGetValue() {
        ToolExecutionException e = assertThrows(ToolExecutionException.class,
                () -> tool.execute(context, Map.of("json_data", DOCUMENT, "operation", "get_value")));

        assertEquals("MISSING_PATH", e.getCode());
        assertEquals("path is required for get_value operation", e.getDetail());
    }

    @Test
    void shouldReportMissingKeyAndNonObjectAccess() {
        ToolExecutionException missing = assertThrows(ToolExecutionException.class,
                () -> tool.execute(context, Map.of("json_data", DOCUMENT, "operation", "get_value",
                        "path", "user.email")));
        assertEquals("key 'email' not found", missing.getDetail());

        ToolExecutionException nonObject = assertThrows(ToolExecutionException.class,
                () -> tool.execute(context, Map.of("json_data", DOCUMENT, "operation", "get_value",
                        "path", "age.value")));
        assertEquals("cannot access key 'value' on non-object", nonObject.getDetail());
    }
}
