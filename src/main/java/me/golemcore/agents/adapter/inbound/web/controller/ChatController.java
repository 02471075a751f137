package me.golemcore.agents.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agents.adapter.inbound.web.dto.ChatRequest;
import me.golemcore.agents.adapter.inbound.web.dto.ChatResponse;
import me.golemcore.agents.adapter.inbound.web.dto.StreamChunk;
import me.golemcore.agents.adapter.inbound.web.dto.ToolCallHistoryResponse;
import me.golemcore.agents.adapter.inbound.web.dto.ToolChatResponse;
import me.golemcore.agents.adapter.inbound.web.dto.ToolListResponse;
import me.golemcore.agents.adapter.inbound.web.dto.ToolTestRequest;
import me.golemcore.agents.domain.model.CancellationToken;
import me.golemcore.agents.domain.model.LlmChunk;
import me.golemcore.agents.domain.model.Message;
import me.golemcore.agents.domain.model.ToolDefinition;
import me.golemcore.agents.domain.model.ToolInfo;
import me.golemcore.agents.domain.model.ToolTestReport;
import me.golemcore.agents.domain.service.ChatService;
import me.golemcore.agents.domain.service.ToolCatalogService;
import me.golemcore.agents.domain.system.toolloop.ChatTurnResult;
import me.golemcore.agents.domain.system.toolloop.TurnAbortedException;
import me.golemcore.agents.port.outbound.MessagePort;
import me.golemcore.agents.port.outbound.SessionPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Conversation endpoints of a session: plain, streamed and tool-enabled chat,
 * plus the session-scoped views of the tool catalogue.
 *
 * <p>
 * Turns block on the provider and on tools, so they run on the bounded elastic
 * scheduler. A client disconnect cancels the subscription, which cancels the
 * turn's token and with it every in-flight tool.
 */
@RestController
@RequestMapping("/api/v1/sessions")
@RequiredArgsConstructor
@Slf4j
public class ChatController {

    private static final int DEFAULT_HISTORY_PAGE_SIZE = 20;
    private static final int MAX_HISTORY_PAGE_SIZE = 100;

    private final ChatService chatService;
    private final ToolCatalogService toolCatalogService;
    private final SessionPort sessionPort;
    private final MessagePort messagePort;

    @PostMapping("/{id}/chat")
    public Mono<ResponseEntity<ChatResponse>> chat(@PathVariable String id, @RequestBody ChatRequest request) {
        return runTurn(token -> chatService.chat(id, request.getMessage(), request.getMetadata(), token))
                .map(outcome -> ResponseEntity.ok(ChatResponse.builder()
                        .messageId(outcome.assistantMessage().getId())
                        .response(outcome.assistantMessage().getContent())
                        .metadata(responseMetadata(outcome.turn()))
                        .build()));
    }

    @PostMapping(value = "/{id}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<StreamChunk>> stream(@PathVariable String id, @RequestBody ChatRequest request) {
        CancellationToken token = CancellationToken.create();
        return Mono.fromCallable(() -> chatService.stream(id, request.getMessage(), request.getMetadata(), token))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMapMany(chunks -> chunks
                        .map(ChatController::toEvent)
                        .onErrorResume(TurnAbortedException.class, e -> {
                            log.warn("[API] Stream of session {} aborted [{}]: {}", id, e.getCode(), e.getMessage());
                            return Flux.just(errorEvent(e));
                        }))
                .doOnCancel(() -> {
                    log.debug("[API] Stream of session {} cancelled by client", id);
                    token.cancel();
                });
    }

    @PostMapping("/{id}/chat/tools")
    public Mono<ResponseEntity<ToolChatResponse>> chatWithTools(@PathVariable String id,
            @RequestBody ChatRequest request) {
        ChatService.ToolChatCommand command = ChatService.ToolChatCommand.builder()
                .message(request.getMessage())
                .tools(request.getTools())
                .toolChoice(request.getToolChoice())
                .temperature(request.getTemperature())
                .maxTokens(request.getMaxTokens())
                .metadata(request.getMetadata())
                .build();
        return runTurn(token -> chatService.chatWithTools(id, command, token))
                .map(outcome -> ResponseEntity.ok(toToolChatResponse(outcome)));
    }

    @PostMapping("/{id}/chat/auto-tools")
    public Mono<ResponseEntity<ToolChatResponse>> chatWithAutoTools(@PathVariable String id,
            @RequestBody ChatRequest request) {
        return runTurn(token -> chatService.chatWithAutoTools(id, request.getMessage(), request.getMetadata(),
                token))
                .map(outcome -> ResponseEntity.ok(toToolChatResponse(outcome)));
    }

    @GetMapping("/{id}/tools")
    public Mono<ResponseEntity<ToolListResponse>> listSessionTools(@PathVariable String id) {
        requireSession(id);
        List<ToolInfo> tools = toolCatalogService.listTools().stream()
                .filter(ToolInfo::isAvailable)
                .toList();
        return Mono.just(ResponseEntity.ok(ToolListResponse.builder()
                .tools(tools)
                .totalCount(tools.size())
                .build()));
    }

    @GetMapping("/{id}/tools/{toolName}/schema")
    public Mono<ResponseEntity<ToolDefinition>> getSessionToolSchema(@PathVariable String id,
            @PathVariable String toolName) {
        requireSession(id);
        List<ToolDefinition> definitions = toolCatalogService.getDefinitions(List.of(toolName));
        if (definitions.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Tool not found or not available: " + toolName);
        }
        return Mono.just(ResponseEntity.ok(definitions.get(0)));
    }

    @PostMapping("/{id}/tools/{toolName}/test")
    public Mono<ResponseEntity<ToolTestReport>> testSessionTool(@PathVariable String id,
            @PathVariable String toolName, @RequestBody(required = false) ToolTestRequest request) {
        requireSession(id);
        if (toolCatalogService.getTool(toolName).isEmpty()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Tool not found");
        }
        Map<String, Object> arguments = request != null ? request.getArguments() : null;
        Integer timeoutSeconds = request != null ? request.getTimeoutSeconds() : null;
        log.info("[API] Testing tool {} for session {}", toolName, id);
        return Mono.fromCallable(() -> toolCatalogService.testTool(toolName, arguments, timeoutSeconds))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @GetMapping("/{id}/tool-calls")
    public Mono<ResponseEntity<ToolCallHistoryResponse>> getToolCallHistory(@PathVariable String id,
            @RequestParam(required = false) Integer page,
            @RequestParam(name = "page_size", required = false) Integer pageSize) {
        requireSession(id);
        Pagination pagination = Pagination.of(page, pageSize, DEFAULT_HISTORY_PAGE_SIZE, MAX_HISTORY_PAGE_SIZE);
        List<ToolCallHistoryResponse.Entry> entries = collectToolCalls(
                messagePort.list(id, messagePort.count(id), 0));
        int total = entries.size();
        int from = Math.min(pagination.offset(), total);
        int to = Math.min(from + pagination.pageSize(), total);
        return Mono.just(ResponseEntity.ok(ToolCallHistoryResponse.builder()
                .toolCalls(entries.subList(from, to))
                .totalCount(total)
                .page(pagination.page())
                .pageSize(pagination.pageSize())
                .hasMore(pagination.hasMore(total))
                .build()));
    }

    private <T> Mono<T> runTurn(Function<CancellationToken, T> turn) {
        CancellationToken token = CancellationToken.create();
        return Mono.fromCallable(() -> turn.apply(token))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnCancel(token::cancel);
    }

    private void requireSession(String id) {
        if (sessionPort.get(id).isEmpty()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Session not found");
        }
    }

    static List<ToolCallHistoryResponse.Entry> collectToolCalls(List<Message> messages) {
        Map<String, Message.ToolCall> requested = new HashMap<>();
        List<ToolCallHistoryResponse.Entry> entries = new ArrayList<>();
        for (Message message : messages) {
            if (message.hasToolCalls()) {
                for (Message.ToolCall call : message.getToolCalls()) {
                    requested.put(call.getId(), call);
                }
            } else if (message.isToolMessage()) {
                Message.ToolCall call = requested.get(message.getToolCallId());
                entries.add(ToolCallHistoryResponse.Entry.builder()
                        .toolCallId(message.getToolCallId())
                        .toolName(message.getToolName())
                        .arguments(call != null ? call.getArguments() : null)
                        .result(message.getContent())
                        .createdAt(message.getCreatedAt())
                        .build());
            }
        }
        return entries;
    }

    private static ToolChatResponse toToolChatResponse(ChatService.ChatOutcome outcome) {
        ChatTurnResult turn = outcome.turn();
        Message assistant = outcome.assistantMessage();
        return ToolChatResponse.builder()
                .userMessageId(outcome.userMessage().getId())
                .assistantMessageId(assistant.getId())
                .response(assistant.getContent())
                .toolCalls(turn.getToolCalls())
                .metadata(responseMetadata(turn))
                .finishReason(turn.getFinishReason())
                .suggestedTools(outcome.suggestedTools().isEmpty() ? null : outcome.suggestedTools())
                .build();
    }

    private static Map<String, Object> responseMetadata(ChatTurnResult turn) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        Message assistant = turn.getAssistantMessage();
        if (assistant != null && assistant.getMetadata() != null) {
            metadata.putAll(assistant.getMetadata());
        }
        metadata.put("iterations", turn.getIterations());
        return metadata;
    }

    private static ServerSentEvent<StreamChunk> toEvent(LlmChunk chunk) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (chunk.getFinishReason() != null) {
            metadata.put("finish_reason", chunk.getFinishReason());
        }
        if (chunk.getUsage() != null) {
            metadata.put("total_tokens", chunk.getUsage().getTotalTokens());
        }
        return ServerSentEvent.<StreamChunk>builder()
                .data(StreamChunk.builder()
                        .delta(chunk.getText() != null ? chunk.getText() : "")
                        .metadata(metadata)
                        .done(chunk.isDone())
                        .build())
                .build();
    }

    private static ServerSentEvent<StreamChunk> errorEvent(TurnAbortedException e) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("error", e.getMessage());
        metadata.put("error_code", e.getCode().name());
        return ServerSentEvent.<StreamChunk>builder()
                .event("error")
                .data(StreamChunk.builder()
                        .delta("")
                        .metadata(metadata)
                        .done(true)
                        .build())
                .build();
    }
}
