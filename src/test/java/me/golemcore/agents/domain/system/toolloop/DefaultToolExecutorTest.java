package me.golemcore.agents.domain.system.toolloop;

import me.golemcore.agents.domain.model.CallInfo;
import me.golemcore.agents.domain.model.CancellationToken;
import me.golemcore.agents.domain.model.Message;
import me.golemcore.agents.domain.model.ToolErrorCode;
import me.golemcore.agents.domain.model.ToolResult;
import me.golemcore.agents.domain.tools.ToolExecutor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DefaultToolExecutorTest {

    @Mock
    private ToolExecutor toolExecutor;

    private DefaultToolExecutor executor;
    private ToolExecutorPort.TurnScope scope;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        executor = new DefaultToolExecutor(toolExecutor, new ObjectMapper());
        scope = new ToolExecutorPort.TurnScope("sess-1", "agent-1", CancellationToken.create());
    }

    private static Message.ToolCall call(String id, String name) {
        return Message.ToolCall.builder().id(id).name(name).arguments(Map.of("expression", "1+1")).build();
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldRunValidCallsAsOneBatchInOrder() {
        Map<String, ToolResult> results = new LinkedHashMap<>();
        results.put("tc-1", ToolResult.success(2L));
        results.put("tc-2", ToolResult.failure(ToolErrorCode.TOOL_NOT_FOUND, "tool not found"));
        when(toolExecutor.executeMultiple(eq("sess-1"), eq("agent-1"), anyList(), same(scope.cancellationToken())))
                .thenReturn(results);

        List<ToolExecutionOutcome> outcomes = executor.executeAll(scope, List.of(
                call("tc-1", "calculator"), call("tc-2", "missing")));

        ArgumentCaptor<List<CallInfo>> captor = ArgumentCaptor.forClass(List.class);
        verify(toolExecutor).executeMultiple(eq("sess-1"), eq("agent-1"), captor.capture(), any());
        assertEquals("calculator", captor.getValue().get(0).toolName());
        assertEquals("tc-2", captor.getValue().get(1).callId());

        assertEquals(2, outcomes.size());
        assertEquals("{\"success\":true,\"result\":2}", outcomes.get(0).messageContent());
        assertEquals("{\"success\":false,\"error\":\"tool not found\"}", outcomes.get(1).messageContent());
        assertSame(results.get("tc-2"), outcomes.get(1).toolResult());
    }

    @Test
    void shouldAnswerMalformedArgumentsWithoutExecuting() {
        Message.ToolCall broken = Message.ToolCall.builder()
                .id("tc-1")
                .name("calculator")
                .rawArguments("{oops")
                .argumentsError("Unexpected character")
                .build();

        List<ToolExecutionOutcome> outcomes = executor.executeAll(scope, List.of(broken));

        verify(toolExecutor, never()).executeMultiple(any(), any(), anyList(), any());
        ToolResult result = outcomes.get(0).toolResult();
        assertFalse(result.isSuccess());
        assertTrue(result.hasErrorCode(ToolErrorCode.INVALID_ARGUMENTS));
        assertEquals("Invalid tool arguments: Unexpected character", result.getError());
    }

    @Test
    void shouldReportMissingResult() {
        when(toolExecutor.executeMultiple(any(), any(), anyList(), any())).thenReturn(Map.of());

        List<ToolExecutionOutcome> outcomes = executor.executeAll(scope, List.of(call("tc-1", "calculator")));

        assertTrue(outcomes.get(0).toolResult().hasErrorCode(ToolErrorCode.EXECUTION_ERROR));
        assertEquals("tc-1", outcomes.get(0).toCallResult().getId());
    }
}
