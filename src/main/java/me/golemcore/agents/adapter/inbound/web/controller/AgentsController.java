package me.golemcore.agents.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agents.adapter.inbound.web.dto.AgentListResponse;
import me.golemcore.agents.adapter.inbound.web.dto.AgentRequest;
import me.golemcore.agents.adapter.inbound.web.dto.SessionListResponse;
import me.golemcore.agents.adapter.inbound.web.dto.SessionRequest;
import me.golemcore.agents.domain.model.Agent;
import me.golemcore.agents.domain.model.ChatSession;
import me.golemcore.agents.port.outbound.AgentPort;
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
import java.util.List;

/**
 * Agent management and the sessions that belong to an agent.
 */
@RestController
@RequestMapping("/api/v1/agents")
@RequiredArgsConstructor
@Slf4j
public class AgentsController {

    private static final int DEFAULT_PAGE_SIZE = 20;
    private static final int MAX_PAGE_SIZE = 100;
    private static final String AGENT_NOT_FOUND = "Agent not found";

    private final AgentPort agentPort;
    private final SessionPort sessionPort;

    @PostMapping
    public Mono<ResponseEntity<Agent>> createAgent(@RequestBody AgentRequest request) {
        Agent agent = Agent.builder()
                .name(request.getName())
                .description(request.getDescription())
                .provider(request.getProvider())
                .model(request.getModel())
                .systemPrompt(request.getSystemPrompt())
                .config(request.getConfig() != null ? new HashMap<>(request.getConfig()) : new HashMap<>())
                .build();
        if (request.getTemperature() != null) {
            agent.setTemperature(request.getTemperature());
        }
        if (request.getMaxTokens() != null) {
            agent.setMaxTokens(request.getMaxTokens());
        }
        Agent created = agentPort.create(agent);
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(created));
    }

    @GetMapping
    public Mono<ResponseEntity<AgentListResponse>> listAgents(
            @RequestParam(required = false) Integer page,
            @RequestParam(name = "page_size", required = false) Integer pageSize) {
        Pagination pagination = Pagination.of(page, pageSize, DEFAULT_PAGE_SIZE, MAX_PAGE_SIZE);
        List<Agent> agents = agentPort.list(pagination.pageSize(), pagination.offset());
        int total = agentPort.count();
        return Mono.just(ResponseEntity.ok(AgentListResponse.builder()
                .agents(agents)
                .totalCount(total)
                .page(pagination.page())
                .pageSize(pagination.pageSize())
                .totalPages(pagination.totalPages(total))
                .hasMore(pagination.hasMore(total))
                .build()));
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<Agent>> getAgent(@PathVariable String id) {
        return Mono.just(ResponseEntity.ok(requireAgent(id)));
    }

    @PutMapping("/{id}")
    public Mono<ResponseEntity<Agent>> updateAgent(@PathVariable String id, @RequestBody AgentRequest request) {
        Agent agent = requireAgent(id).toBuilder().build();
        if (request.getName() != null) {
            agent.setName(request.getName());
        }
        if (request.getDescription() != null) {
            agent.setDescription(request.getDescription());
        }
        if (request.getProvider() != null) {
            agent.setProvider(request.getProvider());
        }
        if (request.getModel() != null) {
            agent.setModel(request.getModel());
        }
        if (request.getSystemPrompt() != null) {
            agent.setSystemPrompt(request.getSystemPrompt());
        }
        if (request.getTemperature() != null) {
            agent.setTemperature(request.getTemperature());
        }
        if (request.getMaxTokens() != null) {
            agent.setMaxTokens(request.getMaxTokens());
        }
        if (request.getConfig() != null) {
            agent.setConfig(new HashMap<>(request.getConfig()));
        }
        return Mono.just(ResponseEntity.ok(agentPort.update(agent)));
    }

    @DeleteMapping("/{id}")
    public Mono<ResponseEntity<Void>> deleteAgent(@PathVariable String id) {
        if (!agentPort.delete(id)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, AGENT_NOT_FOUND);
        }
        return Mono.just(ResponseEntity.noContent().build());
    }

    @PostMapping("/{id}/sessions")
    public Mono<ResponseEntity<ChatSession>> createSession(@PathVariable String id,
            @RequestBody(required = false) SessionRequest request) {
        requireAgent(id);
        ChatSession.ChatSessionBuilder session = ChatSession.builder()
                .agentId(id)
                .contextStrategy(null);
        if (request != null) {
            session.title(request.getTitle());
            if (request.getContextStrategy() != null && !request.getContextStrategy().isBlank()) {
                session.contextStrategy(request.getContextStrategy());
            }
            if (request.getContextConfig() != null) {
                session.contextConfig(new HashMap<>(request.getContextConfig()));
            }
        }
        ChatSession created = sessionPort.create(session.build());
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(created));
    }

    @GetMapping("/{id}/sessions")
    public Mono<ResponseEntity<SessionListResponse>> listSessions(@PathVariable String id,
            @RequestParam(required = false) Integer page,
            @RequestParam(name = "page_size", required = false) Integer pageSize) {
        requireAgent(id);
        Pagination pagination = Pagination.of(page, pageSize, DEFAULT_PAGE_SIZE, MAX_PAGE_SIZE);
        List<ChatSession> sessions = sessionPort.listByAgent(id, pagination.pageSize(), pagination.offset());
        int total = sessionPort.countByAgent(id);
        return Mono.just(ResponseEntity.ok(SessionListResponse.builder()
                .sessions(sessions)
                .totalCount(total)
                .page(pagination.page())
                .pageSize(pagination.pageSize())
                .totalPages(pagination.totalPages(total))
                .hasMore(pagination.hasMore(total))
                .build()));
    }

    private Agent requireAgent(String id) {
        return agentPort.get(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, AGENT_NOT_FOUND));
    }
}
