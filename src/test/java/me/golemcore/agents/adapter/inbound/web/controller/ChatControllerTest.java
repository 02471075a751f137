package me.golemcore.agents.adapter.inbound.web.controller;

import me.golemcore.agents.adapter.inbound.web.dto.ChatRequest;
import me.golemcore.agents.adapter.inbound.web.dto.ToolCallHistoryResponse;
import me.golemcore.agents.adapter.inbound.web.dto.ToolTestRequest;
import me.golemcore.agents.domain.model.CancellationToken;
import me.golemcore.agents.domain.model.ChatSession;
import me.golemcore.agents.domain.model.LlmChunk;
import me.golemcore.agents.domain.model.LlmUsage;
import me.golemcore.agents.domain.model.Message;
import me.golemcore.agents.domain.model.ToolCallResult;
import me.golemcore.agents.domain.model.ToolDefinition;
import me.golemcore.agents.domain.model.ToolInfo;
import me.golemcore.agents.domain.model.ToolTestReport;
import me.golemcore.agents.domain.service.ChatService;
import me.golemcore.agents.domain.service.ToolCatalogService;
import me.golemcore.agents.domain.system.toolloop.ChatTurnResult;
import me.golemcore.agents.domain.system.toolloop.TurnAbortedException;
import me.golemcore.agents.domain.system.toolloop.TurnFailureCode;
import me.golemcore.agents.port.outbound.MessagePort;
import me.golemcore.agents.port.outbound.SessionPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ChatControllerTest {

    private static final String SESSION_ID = "session-1";

    private ChatService chatService;
    private ToolCatalogService toolCatalogService;
    private SessionPort sessionPort;
    private MessagePort messagePort;
    private ChatController controller;

    @BeforeEach
    void setUp() {
        chatService = mock(ChatService.class);
        toolCatalogService = mock(ToolCatalogService.class);
        sessionPort = mock(SessionPort.class);
        messagePort = mock(MessagePort.class);
        controller = new ChatController(chatService, toolCatalogService, sessionPort, messagePort);
        when(sessionPort.get(SESSION_ID)).thenReturn(Optional.of(ChatSession.builder().id(SESSION_ID).build()));
        when(sessionPort.get("missing")).thenReturn(Optional.empty());
    }

    private static ChatService.ChatOutcome outcome(List<ToolCallResult> toolCalls, List<String> suggested) {
        Message user = Message.builder().id("u-1").role(Message.ROLE_USER).content("2+3?").build();
        Message assistant = Message.builder()
                .id("a-1")
                .role(Message.ROLE_ASSISTANT)
                .content("5")
                .metadata(Map.of("model", "gpt-4o"))
                .build();
        ChatTurnResult turn = ChatTurnResult.builder()
                .assistantMessage(assistant)
                .toolCalls(toolCalls)
                .finishReason("stop")
                .iterations(2)
                .usage(LlmUsage.of(10, 2))
                .newMessages(List.of(assistant))
                .build();
        return new ChatService.ChatOutcome(user, turn, suggested);
    }

    // ==================== Chat ====================

    @Test
    void shouldAnswerPlainChat() {
        when(chatService.chat(eq(SESSION_ID), eq("2+3?"), isNull(), any(CancellationToken.class)))
                .thenReturn(outcome(List.of(), List.of()));

        StepVerifier.create(controller.chat(SESSION_ID, ChatRequest.builder().message("2+3?").build()))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals("a-1", response.getBody().getMessageId());
                    assertEquals("5", response.getBody().getResponse());
                    assertEquals("gpt-4o", response.getBody().getMetadata().get("model"));
                    assertEquals(2, response.getBody().getMetadata().get("iterations"));
                })
                .verifyComplete();
    }

    @Test
    void shouldPropagateAbortedTurn() {
        when(chatService.chat(eq(SESSION_ID), any(), any(), any(CancellationToken.class)))
                .thenThrow(new TurnAbortedException(TurnFailureCode.PROVIDER_UNAVAILABLE, "provider down", 0,
                        List.of()));

        StepVerifier.create(controller.chat(SESSION_ID, ChatRequest.builder().message("hi").build()))
                .expectErrorMatches(e -> e instanceof TurnAbortedException aborted
                        && aborted.getCode() == TurnFailureCode.PROVIDER_UNAVAILABLE)
                .verify();
    }

    @Test
    void shouldPassToolOptionsToService() {
        ToolCallResult call = ToolCallResult.builder()
                .id("call_1")
                .toolName("calculator")
                .success(true)
                .result(Map.of("result", 5))
                .build();
        when(chatService.chatWithTools(eq(SESSION_ID), any(ChatService.ToolChatCommand.class),
                any(CancellationToken.class))).thenReturn(outcome(List.of(call), List.of()));
        ChatRequest request = ChatRequest.builder()
                .message("2+3?")
                .tools(List.of("calculator"))
                .toolChoice("calculator")
                .temperature(0.1)
                .maxTokens(50)
                .build();

        StepVerifier.create(controller.chatWithTools(SESSION_ID, request))
                .assertNext(response -> {
                    assertEquals("u-1", response.getBody().getUserMessageId());
                    assertEquals("a-1", response.getBody().getAssistantMessageId());
                    assertEquals(1, response.getBody().getToolCalls().size());
                    assertEquals("stop", response.getBody().getFinishReason());
                    assertNull(response.getBody().getSuggestedTools());
                })
                .verifyComplete();

        ArgumentCaptor<ChatService.ToolChatCommand> captor = ArgumentCaptor.forClass(
                ChatService.ToolChatCommand.class);
        verify(chatService).chatWithTools(eq(SESSION_ID), captor.capture(), any(CancellationToken.class));
        assertEquals(List.of("calculator"), captor.getValue().getTools());
        assertEquals("calculator", captor.getValue().getToolChoice());
        assertEquals(0.1, captor.getValue().getTemperature());
        assertEquals(50, captor.getValue().getMaxTokens());
    }

    @Test
    void shouldReturnSuggestedToolsForAutoChat() {
        when(chatService.chatWithAutoTools(eq(SESSION_ID), eq("what time is it"), any(),
                any(CancellationToken.class))).thenReturn(outcome(List.of(), List.of("datetime")));

        StepVerifier.create(controller.chatWithAutoTools(SESSION_ID,
                ChatRequest.builder().message("what time is it").build()))
                .assertNext(response -> assertEquals(List.of("datetime"), response.getBody().getSuggestedTools()))
                .verifyComplete();
    }

    // ==================== Streaming ====================

    @Test
    void shouldStreamChunksAsEvents() {
        when(chatService.stream(eq(SESSION_ID), eq("hi"), any(), any())).thenReturn(Flux.just(
                LlmChunk.builder().text("Hel").build(),
                LlmChunk.builder().text("lo").done(true).finishReason("stop").usage(LlmUsage.of(3, 2)).build()));

        StepVerifier.create(controller.stream(SESSION_ID, ChatRequest.builder().message("hi").build()))
                .assertNext(event -> {
                    assertEquals("Hel", event.data().getDelta());
                    assertTrue(event.data().getMetadata().isEmpty());
                })
                .assertNext(event -> {
                    assertTrue(event.data().isDone());
                    assertEquals("stop", event.data().getMetadata().get("finish_reason"));
                    assertEquals(5, event.data().getMetadata().get("total_tokens"));
                })
                .verifyComplete();
    }

    @Test
    void shouldEndStreamWithErrorEvent() {
        when(chatService.stream(eq(SESSION_ID), eq("hi"), any(), any())).thenReturn(Flux.concat(
                Flux.just(LlmChunk.builder().text("par").build()),
                Flux.error(new TurnAbortedException(TurnFailureCode.PROVIDER_ERROR,
                        "LLM request failed: reset", 1, List.of()))));

        StepVerifier.create(controller.stream(SESSION_ID, ChatRequest.builder().message("hi").build()))
                .assertNext(event -> assertEquals("par", event.data().getDelta()))
                .assertNext(event -> {
                    assertEquals("error", event.event());
                    assertTrue(event.data().isDone());
                    assertEquals("PROVIDER_ERROR", event.data().getMetadata().get("error_code"));
                    assertEquals("LLM request failed: reset", event.data().getMetadata().get("error"));
                })
                .verifyComplete();
    }

    @Test
    void shouldCancelTurnTokenWhenStreamClientDisconnects() {
        ArgumentCaptor<CancellationToken> token = ArgumentCaptor.forClass(CancellationToken.class);
        when(chatService.stream(eq(SESSION_ID), eq("hi"), any(), token.capture())).thenReturn(Flux.concat(
                Flux.just(LlmChunk.builder().text("Hel").build()),
                Flux.never()));

        StepVerifier.create(controller.stream(SESSION_ID, ChatRequest.builder().message("hi").build()))
                .assertNext(event -> assertEquals("Hel", event.data().getDelta()))
                .thenCancel()
                .verify();

        assertTrue(token.getValue().isCancelled());
    }

    // ==================== Session tools ====================

    @Test
    void shouldListOnlyAvailableTools() {
        when(toolCatalogService.listTools()).thenReturn(List.of(
                ToolInfo.builder().name("calculator").available(true).build(),
                ToolInfo.builder().name("http_get").available(false).build()));

        StepVerifier.create(controller.listSessionTools(SESSION_ID))
                .assertNext(response -> {
                    assertEquals(1, response.getBody().getTotalCount());
                    assertEquals("calculator", response.getBody().getTools().get(0).getName());
                })
                .verifyComplete();
    }

    @Test
    void shouldRejectToolRoutesOfUnknownSession() {
        ResponseStatusException e = assertThrows(ResponseStatusException.class,
                () -> controller.listSessionTools("missing"));

        assertEquals(HttpStatus.NOT_FOUND, e.getStatusCode());
    }

    @Test
    void shouldReturnSchemaOrNotFound() {
        ToolDefinition definition = ToolDefinition.of("calculator", "Math", Map.of("type", "object"));
        when(toolCatalogService.getDefinitions(List.of("calculator"))).thenReturn(List.of(definition));
        when(toolCatalogService.getDefinitions(List.of("nope"))).thenReturn(List.of());

        StepVerifier.create(controller.getSessionToolSchema(SESSION_ID, "calculator"))
                .assertNext(response -> assertEquals("calculator", response.getBody().name()))
                .verifyComplete();
        assertThrows(ResponseStatusException.class, () -> controller.getSessionToolSchema(SESSION_ID, "nope"));
    }

    @Test
    void shouldTestToolForSession() {
        when(toolCatalogService.getTool("calculator"))
                .thenReturn(Optional.of(ToolInfo.builder().name("calculator").build()));
        when(toolCatalogService.testTool("calculator", Map.of("expression", "1+1"), 5))
                .thenReturn(ToolTestReport.builder().success(true).result(Map.of("result", 2)).build());

        StepVerifier.create(controller.testSessionTool(SESSION_ID, "calculator",
                ToolTestRequest.builder().arguments(Map.of("expression", "1+1")).timeoutSeconds(5).build()))
                .assertNext(response -> assertTrue(response.getBody().isSuccess()))
                .verifyComplete();
    }

    // ==================== Tool call history ====================

    @Test
    void shouldPairToolResultsWithRequests() {
        Instant at = Instant.parse("2026-01-01T00:00:00Z");
        List<Message> messages = List.of(
                Message.builder().role(Message.ROLE_USER).content("2+3?").build(),
                Message.builder().role(Message.ROLE_ASSISTANT).toolCalls(List.of(
                        Message.ToolCall.builder().id("call_1").name("calculator")
                                .arguments(Map.of("expression", "2+3")).build()))
                        .build(),
                Message.builder().role(Message.ROLE_TOOL).toolCallId("call_1").toolName("calculator")
                        .content("{\"result\":5}").createdAt(at).build(),
                Message.builder().role(Message.ROLE_TOOL).toolCallId("orphan").toolName("datetime")
                        .content("{}").build(),
                Message.builder().role(Message.ROLE_ASSISTANT).content("5").build());

        List<ToolCallHistoryResponse.Entry> entries = ChatController.collectToolCalls(messages);

        assertEquals(2, entries.size());
        assertEquals("call_1", entries.get(0).getToolCallId());
        assertEquals(Map.of("expression", "2+3"), entries.get(0).getArguments());
        assertEquals("{\"result\":5}", entries.get(0).getResult());
        assertEquals(at, entries.get(0).getCreatedAt());
        assertNull(entries.get(1).getArguments());
    }

    @Test
    void shouldPageToolCallHistory() {
        Message assistant = Message.builder().role(Message.ROLE_ASSISTANT).toolCalls(List.of(
                Message.ToolCall.builder().id("a").name("calculator").build(),
                Message.ToolCall.builder().id("b").name("calculator").build(),
                Message.ToolCall.builder().id("c").name("calculator").build())).build();
        List<Message> history = List.of(assistant,
                Message.builder().role(Message.ROLE_TOOL).toolCallId("a").content("1").build(),
                Message.builder().role(Message.ROLE_TOOL).toolCallId("b").content("2").build(),
                Message.builder().role(Message.ROLE_TOOL).toolCallId("c").content("3").build());
        when(messagePort.count(SESSION_ID)).thenReturn(4);
        when(messagePort.list(SESSION_ID, 4, 0)).thenReturn(history);

        StepVerifier.create(controller.getToolCallHistory(SESSION_ID, 2, 2))
                .assertNext(response -> {
                    ToolCallHistoryResponse body = response.getBody();
                    assertEquals(3, body.getTotalCount());
                    assertEquals(1, body.getToolCalls().size());
                    assertEquals("c", body.getToolCalls().get(0).getToolCallId());
                })
                .verifyComplete();
    }
}
