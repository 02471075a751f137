package me.golemcore.agents.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agents.adapter.inbound.web.dto.ToolExecutionResponse;
import me.golemcore.agents.adapter.inbound.web.dto.ToolListResponse;
import me.golemcore.agents.adapter.inbound.web.dto.ToolTestRequest;
import me.golemcore.agents.domain.model.ToolDefinition;
import me.golemcore.agents.domain.model.ToolInfo;
import me.golemcore.agents.domain.model.ToolResult;
import me.golemcore.agents.domain.model.ToolTestReport;
import me.golemcore.agents.domain.model.ToolUsageStats;
import me.golemcore.agents.domain.service.ToolCatalogService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Tool catalogue: discovery, schemas, usage stats and direct execution.
 */
@RestController
@RequestMapping("/api/v1/tools")
@RequiredArgsConstructor
@Slf4j
public class ToolsController {

    private static final String TOOL_NOT_FOUND = "Tool not found";

    private final ToolCatalogService toolCatalogService;

    @GetMapping
    public Mono<ResponseEntity<ToolListResponse>> listTools() {
        List<ToolInfo> tools = toolCatalogService.listTools();
        return Mono.just(ResponseEntity.ok(ToolListResponse.builder()
                .tools(tools)
                .totalCount(tools.size())
                .build()));
    }

    @GetMapping("/schemas")
    public Mono<ResponseEntity<List<ToolDefinition>>> getSchemas(@RequestParam(required = false) String tools) {
        return Mono.just(ResponseEntity.ok(toolCatalogService.getDefinitions(splitNames(tools))));
    }

    @GetMapping("/stats")
    public Mono<ResponseEntity<List<ToolUsageStats>>> getStats(
            @RequestParam(name = "tool_name", required = false) String toolName) {
        return Mono.just(ResponseEntity.ok(toolCatalogService.stats(toolName)));
    }

    @GetMapping("/{toolName}")
    public Mono<ResponseEntity<ToolInfo>> getTool(@PathVariable String toolName) {
        ToolInfo tool = toolCatalogService.getTool(toolName)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, TOOL_NOT_FOUND));
        return Mono.just(ResponseEntity.ok(tool));
    }

    @PostMapping("/{toolName}/test")
    public Mono<ResponseEntity<ToolTestReport>> testTool(@PathVariable String toolName,
            @RequestBody(required = false) ToolTestRequest request) {
        requireTool(toolName);
        Map<String, Object> arguments = request != null ? request.getArguments() : null;
        Integer timeoutSeconds = request != null ? request.getTimeoutSeconds() : null;
        return Mono.fromCallable(() -> toolCatalogService.testTool(toolName, arguments, timeoutSeconds))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnNext(report -> log.info("[API] Tool test {}: success={}, {}ms", toolName, report.isSuccess(),
                        report.getDurationMs()))
                .map(ResponseEntity::ok);
    }

    /**
     * Runs the tool with the request body as its parameters. A failed run
     * answers 400 with the error code.
     */
    @PostMapping("/{toolName}/execute")
    public Mono<ResponseEntity<ToolExecutionResponse>> executeTool(@PathVariable String toolName,
            @RequestBody(required = false) Map<String, Object> parameters) {
        requireTool(toolName);
        return Mono.fromCallable(() -> toolCatalogService.execute(toolName, parameters))
                .subscribeOn(Schedulers.boundedElastic())
                .map(result -> {
                    ToolExecutionResponse body = toResponse(toolName, result);
                    HttpStatus status = result.isSuccess() ? HttpStatus.OK : HttpStatus.BAD_REQUEST;
                    return ResponseEntity.status(status).body(body);
                });
    }

    private void requireTool(String toolName) {
        if (toolCatalogService.getTool(toolName).isEmpty()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, TOOL_NOT_FOUND);
        }
    }

    private static ToolExecutionResponse toResponse(String toolName, ToolResult result) {
        return ToolExecutionResponse.builder()
                .success(result.isSuccess())
                .toolName(toolName)
                .durationMs(result.getDurationMs())
                .result(result.isSuccess() ? result.getData() : null)
                .error(result.getError())
                .errorCode(result.getErrorCode())
                .metadata(result.getMetadata())
                .build();
    }

    static List<String> splitNames(String tools) {
        if (tools == null || tools.isBlank()) {
            return List.of();
        }
        return Arrays.stream(tools.split(","))
                .map(String::trim)
                .filter(name -> !name.isEmpty())
                .toList();
    }
}
