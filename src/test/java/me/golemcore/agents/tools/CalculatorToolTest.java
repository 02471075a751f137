package me.golemcore.agents.tools;

import me.golemcore.agents.domain.model.ExecutionContext;
import me.golemcore.agents.domain.model.ToolResult;
import me.golemcore.agents.domain.tools.ToolExecutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CalculatorToolTest {

    private static final String EXPRESSION = "expression";

    private CalculatorTool tool;
    private ExecutionContext context;

    @BeforeEach
    void setUp() {
        tool = new CalculatorTool();
        context = ExecutionContext.builder().sessionId("sess-1").build();
    }

    @Test
    void shouldExposeCalculatorSchema() {
        assertEquals("calculator", tool.getName());
        assertEquals(1, tool.getSchema().getParameters().size());
        assertTrue(tool.getSchema().getParameters().get(0).isRequired());
    }

    @Test
    void shouldReturnIntegerResultForWholeNumbers() {
        ToolResult result = tool.execute(context, Map.of(EXPRESSION, "2 + 3"));

        assertTrue(result.isSuccess());
        @SuppressWarnings("unchecked")
        Map<String, Object> data = (Map<String, Object>) result.getData();
        assertEquals(5L, data.get("result"));
        assertEquals("2 + 3", data.get(EXPRESSION));
    }

    @Test
    void shouldKeepFractionalResults() {
        ToolResult result = tool.execute(context, Map.of(EXPRESSION, "7 / 2"));

        @SuppressWarnings("unchecked")
        Map<String, Object> data = (Map<String, Object>) result.getData();
        assertEquals(3.5, data.get("result"));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "2 + 3 * 4 | 14",
            "(2 + 3) * 4 | 20",
            "sqrt(16) | 4",
            "abs(-7.5) | 7.5",
            "2 ^ 3 ^ 2 | 512",
            "-2 ^ 2 | -4",
            "2 ^ -1 | 0.5",
            "10 % 4 | 2",
            "--3 | 3",
            "1.5 * 2 | 3",
            "sqrt(abs(-9)) + 1 | 4"
    })
    void shouldEvaluateExpressions(String expression, double expected) {
        assertEquals(expected, CalculatorTool.evaluate(expression), 1e-9);
    }

    @Test
    void shouldFailOnDivisionByZero() {
        ToolExecutionException e = assertThrows(ToolExecutionException.class,
                () -> tool.execute(context, Map.of(EXPRESSION, "1 / 0")));

        assertEquals("CALCULATION_ERROR", e.getCode());
        assertTrue(e.getDetail().startsWith("Failed to evaluate expression"));
        assertTrue(e.getDetail().contains("division by zero"));
    }

    @Test
    void shouldFailOnUnknownFunction() {
        ToolExecutionException e = assertThrows(ToolExecutionException.class,
                () -> tool.execute(context, Map.of(EXPRESSION, "log(10)")));

        assertTrue(e.getDetail().contains("unknown function: log"));
    }

    @Test
    void shouldFailOnUnbalancedParentheses() {
        assertThrows(ToolExecutionException.class, () -> tool.execute(context, Map.of(EXPRESSION, "(1 + 2")));
        assertThrows(ToolExecutionException.class, () -> tool.execute(context, Map.of(EXPRESSION, "1 + 2)")));
    }

    @Test
    void shouldFailOnSquareRootOfNegative() {
        assertThrows(ToolExecutionException.class, () -> tool.execute(context, Map.of(EXPRESSION, "sqrt(-1)")));
    }

    @Test
    void shouldFailOnEmptyExpression() {
        assertThrows(ToolExecutionException.class, () -> tool.execute(context, Map.of(EXPRESSION, "  ")));
    }
}
