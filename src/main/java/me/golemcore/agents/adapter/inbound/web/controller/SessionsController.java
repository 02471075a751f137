package me.golemcore.agents.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agents.adapter.inbound.web.dto.MessageListResponse;
import me.golemcore.agents.adapter.inbound.web.dto.MessageRequest;
import me.golemcore.agents.adapter.inbound.web.dto.SessionRequest;
import me.golemcore.agents.domain.model.ChatSession;
import me.golemcore.agents.domain.model.Message;
import me.golemcore.agents.port.outbound.MessagePort;
import me.golemcore.agents.port.outbound.SessionPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

/**
 * Session management and raw message history endpoints.
 */
@RestController
@RequestMapping("/api/v1/sessions")
@RequiredArgsConstructor
@Slf4j
public class SessionsController {

    private static final int DEFAULT_PAGE_SIZE = 50;
    private static final int MAX_PAGE_SIZE = 200;
    private static final Set<String> WRITABLE_ROLES = Set.of(Message.ROLE_USER, Message.ROLE_ASSISTANT,
            Message.ROLE_SYSTEM);

    private final SessionPort sessionPort;
    private final MessagePort messagePort;

    @GetMapping("/{id}")
    public Mono<ResponseEntity<ChatSession>> getSession(@PathVariable String id) {
        return Mono.just(ResponseEntity.ok(requireSession(id)));
    }

    @PutMapping("/{id}")
    public Mono<ResponseEntity<ChatSession>> updateSession(@PathVariable String id,
            @RequestBody SessionRequest request) {
        ChatSession session = requireSession(id).toBuilder().build();
        if (request.getTitle() != null) {
            session.setTitle(request.getTitle());
        }
        if (request.getContextStrategy() != null && !request.getContextStrategy().isBlank()) {
            session.setContextStrategy(request.getContextStrategy());
        }
        if (request.getContextConfig() != null) {
            session.setContextConfig(new HashMap<>(request.getContextConfig()));
        }
        return Mono.just(ResponseEntity.ok(sessionPort.update(session)));
    }

    @DeleteMapping("/{id}")
    public Mono<ResponseEntity<Void>> deleteSession(@PathVariable String id) {
        if (!sessionPort.delete(id)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Session not found");
        }
        return Mono.just(ResponseEntity.noContent().build());
    }

    @PostMapping("/{id}/messages")
    public Mono<ResponseEntity<Message>> createMessage(@PathVariable String id,
            @RequestBody MessageRequest request) {
        requireSession(id);
        if (request.getRole() == null || !WRITABLE_ROLES.contains(request.getRole())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "role must be one of: user, assistant, system");
        }
        if (request.getContent() == null || request.getContent().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "content is required");
        }
        Message message = messagePort.append(Message.builder()
                .sessionId(id)
                .role(request.getRole())
                .content(request.getContent())
                .metadata(request.getMetadata() != null ? new LinkedHashMap<>(request.getMetadata()) : null)
                .build());
        log.debug("[API] Message {} ({}) added to session {}", message.getId(), message.getRole(), id);
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(message));
    }

    @GetMapping("/{id}/messages")
    public Mono<ResponseEntity<MessageListResponse>> listMessages(@PathVariable String id,
            @RequestParam(required = false) Integer page,
            @RequestParam(name = "page_size", required = false) Integer pageSize) {
        requireSession(id);
        Pagination pagination = Pagination.of(page, pageSize, DEFAULT_PAGE_SIZE, MAX_PAGE_SIZE);
        List<Message> messages = messagePort.list(id, pagination.pageSize(), pagination.offset());
        int total = messagePort.count(id);
        return Mono.just(ResponseEntity.ok(MessageListResponse.builder()
                .messages(messages)
                .totalCount(total)
                .page(pagination.page())
                .pageSize(pagination.pageSize())
                .hasMore(pagination.hasMore(total))
                .build()));
    }

    @DeleteMapping("/{id}/messages")
    public Mono<ResponseEntity<Void>> deleteMessages(@PathVariable String id) {
        requireSession(id);
        int removed = messagePort.deleteBySession(id);
        log.info("[API] Cleared {} message(s) of session {}", removed, id);
        return Mono.just(ResponseEntity.noContent().build());
    }

    private ChatSession requireSession(String id) {
        return sessionPort.get(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Session not found"));
    }
}
