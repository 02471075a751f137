package me.golemcore.agents.domain.tools;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.agents.domain.component.ToolComponent;
import me.golemcore.agents.domain.model.CallInfo;
import me.golemcore.agents.domain.model.CancellationToken;
import me.golemcore.agents.domain.model.ExecutionContext;
import me.golemcore.agents.domain.model.ToolErrorCode;
import me.golemcore.agents.domain.model.ToolResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs registered tools under a deadline with a structured failure boundary.
 *
 * <p>
 * Every call produces exactly one {@link ToolResult}: lookup, availability and
 * validation failures are reported before the tool body runs, and anything the
 * body throws is converted at the task boundary. Tool bodies never wait in a
 * queue behind other bodies; a call that outlives its deadline (or whose parent token is
 * cancelled) is abandoned, its context is cancelled and its worker
 * interrupted.
 */
@Slf4j
public class ToolExecutor {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    private final ToolRegistry registry;
    private final ExecutorService workers;
    private final Clock clock;
    private final Duration timeout;
    private final List<ToolExecutionListener> listeners;

    public ToolExecutor(ToolRegistry registry, ExecutorService workers, Clock clock, Duration timeout) {
        this(registry, workers, clock, timeout, List.of());
    }

    public ToolExecutor(ToolRegistry registry, ExecutorService workers, Clock clock, Duration timeout,
            List<ToolExecutionListener> listeners) {
        this.registry = registry;
        this.workers = workers;
        this.clock = clock;
        this.timeout = timeout != null && !timeout.isNegative() && !timeout.isZero() ? timeout : DEFAULT_TIMEOUT;
        this.listeners = listeners != null ? List.copyOf(listeners) : List.of();
    }

    /**
     * Returns an executor sharing this one's registry and worker pool but using
     * a different per-call timeout.
     */
    public ToolExecutor withTimeout(Duration newTimeout) {
        return new ToolExecutor(registry, workers, clock, newTimeout, listeners);
    }

    public Duration getTimeout() {
        return timeout;
    }

    public ToolResult execute(String toolName, String sessionId, Map<String, Object> input) {
        return execute(toolName, sessionId, null, input, null);
    }

    public ToolResult execute(String toolName, String sessionId, String agentId, Map<String, Object> input,
            CancellationToken parent) {
        Invocation invocation = start(toolName, sessionId, agentId, input, parent);
        return await(invocation);
    }

    public Map<String, ToolResult> executeMultiple(String sessionId, List<CallInfo> calls) {
        return executeMultiple(sessionId, null, calls, null);
    }

    /**
     * Executes all calls concurrently and returns one result per call, keyed by
     * call id in request order. Calls without an id, or repeating an id already
     * used by an earlier call, are keyed {@code call_<index>} (suffixed until it
     * is unused), so the map always holds one entry per call.
     */
    public Map<String, ToolResult> executeMultiple(String sessionId, String agentId, List<CallInfo> calls,
            CancellationToken parent) {
        if (calls == null || calls.isEmpty()) {
            return Map.of();
        }

        List<String> callIds = assignCallIds(calls);
        List<Invocation> invocations = new ArrayList<>(calls.size());
        for (CallInfo call : calls) {
            invocations.add(start(call.toolName(), sessionId, agentId, call.arguments(), parent));
        }

        Map<String, ToolResult> results = new LinkedHashMap<>();
        for (int i = 0; i < invocations.size(); i++) {
            results.put(callIds.get(i), await(invocations.get(i)));
        }
        return results;
    }

    static List<String> assignCallIds(List<CallInfo> calls) {
        Set<String> reserved = new HashSet<>();
        for (CallInfo call : calls) {
            if (hasId(call)) {
                reserved.add(call.callId());
            }
        }
        Set<String> assigned = new HashSet<>();
        List<String> ids = new ArrayList<>(calls.size());
        for (int i = 0; i < calls.size(); i++) {
            CallInfo call = calls.get(i);
            String id = hasId(call) ? call.callId() : null;
            if (id == null || !assigned.add(id)) {
                String base = "call_" + i;
                id = base;
                for (int suffix = 1; reserved.contains(id) || assigned.contains(id); suffix++) {
                    id = base + "_" + suffix;
                }
                assigned.add(id);
            }
            ids.add(id);
        }
        return ids;
    }

    private static boolean hasId(CallInfo call) {
        return call.callId() != null && !call.callId().isBlank();
    }

    private Invocation start(String toolName, String sessionId, String agentId, Map<String, Object> input,
            CancellationToken parent) {
        long startNanos = System.nanoTime();

        ToolComponent tool = registry.get(toolName).orElse(null);
        if (tool == null) {
            log.debug("[Tools] Tool not found: {}", toolName);
            return Invocation.completed(toolName, startNanos,
                    ToolResult.failure(ToolErrorCode.TOOL_NOT_FOUND, "tool not found"));
        }
        if (!tool.isAvailable()) {
            return Invocation.completed(toolName, startNanos,
                    ToolResult.failure(ToolErrorCode.TOOL_UNAVAILABLE, "tool not available"));
        }

        Map<String, Object> sanitized;
        try {
            tool.validate(input);
            sanitized = SchemaValidator.sanitize(tool.getSchema(), input);
        } catch (ValidationException e) {
            log.debug("[Tools] Validation failed for '{}': {}", toolName, e.getMessage());
            return Invocation.completed(toolName, startNanos,
                    ToolResult.failure(ToolErrorCode.VALIDATION_ERROR, e.getMessage()));
        }

        if (parent != null && parent.isCancelled()) {
            return Invocation.completed(toolName, startNanos,
                    ToolResult.failure(ToolErrorCode.CANCELLED, "tool execution cancelled"));
        }

        Instant now = clock.instant();
        CancellationToken token = parent != null ? parent.child() : CancellationToken.create();
        ExecutionContext context = ExecutionContext.builder()
                .sessionId(sessionId)
                .agentId(agentId)
                .requestId(UUID.randomUUID().toString())
                .timeout(timeout)
                .deadline(now.plus(timeout))
                .metadata(Map.of())
                .cancellationToken(token)
                .build();

        Future<ToolResult> future;
        try {
            future = workers.submit(() -> invokeBody(tool, context, sanitized));
        } catch (RejectedExecutionException e) {
            log.warn("[Tools] Worker pool rejected '{}': {}", toolName, e.getMessage());
            return Invocation.completed(toolName, startNanos,
                    ToolResult.failure(ToolErrorCode.EXECUTION_ERROR, "tool executor is not accepting work"));
        }
        token.onCancel(() -> future.cancel(true));
        return new Invocation(toolName, startNanos, context, future, null);
    }

    private ToolResult await(Invocation invocation) {
        if (invocation.immediate() != null) {
            return finish(invocation, invocation.immediate());
        }

        Future<ToolResult> future = invocation.future();
        ExecutionContext context = invocation.context();
        long deadlineNanos = invocation.startNanos() + timeout.toNanos();
        ToolResult result;
        try {
            long waitNanos = Math.max(0, deadlineNanos - System.nanoTime());
            result = future.get(waitNanos, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            log.warn("[Tools] Tool '{}' timed out after {} ms", invocation.toolName(), timeout.toMillis());
            context.getCancellationToken().cancel();
            future.cancel(true);
            result = ToolResult.failure(ToolErrorCode.TIMEOUT, "execution timeout");
        } catch (CancellationException e) {
            log.debug("[Tools] Tool '{}' cancelled", invocation.toolName());
            result = ToolResult.failure(ToolErrorCode.CANCELLED, "tool execution cancelled");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            context.getCancellationToken().cancel();
            result = ToolResult.failure(ToolErrorCode.CANCELLED, "tool execution cancelled");
        } catch (ExecutionException e) {
            // invokeBody contains everything, so this only happens if the pool itself fails
            result = panic(invocation.toolName(), e.getCause() != null ? e.getCause() : e);
        }
        return finish(invocation, result);
    }

    private ToolResult finish(Invocation invocation, ToolResult result) {
        ToolResult timed = result.withDurationMs(elapsedMs(invocation.startNanos()));
        for (ToolExecutionListener listener : listeners) {
            try {
                listener.onToolExecuted(invocation.toolName(), timed);
            } catch (RuntimeException e) {
                log.warn("[Tools] Execution listener failed: {}", e.getMessage());
            }
        }
        return timed;
    }

    private ToolResult invokeBody(ToolComponent tool, ExecutionContext context, Map<String, Object> input) {
        try {
            ToolResult result = tool.execute(context, input);
            if (result == null) {
                return ToolResult.failure(ToolErrorCode.NIL_RESULT, "tool returned nil result");
            }
            return result;
        } catch (ToolExecutionException e) {
            log.debug("[Tools] Tool '{}' failed [{}]: {}", tool.getName(), e.getCode(), e.getDetail());
            return ToolResult.failure(e.getCode(), e.getDetail() != null ? e.getDetail() : e.getMessage());
        } catch (Throwable t) { // NOSONAR - the task boundary contains every failure of a tool body
            return panic(tool.getName(), t);
        }
    }

    private ToolResult panic(String toolName, Throwable t) {
        log.error("[Tools] Tool '{}' panicked", toolName, t);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("exception_type", t.getClass().getName());
        metadata.put("exception_message", t.getMessage() != null ? t.getMessage() : "");
        return ToolResult.failure(ToolErrorCode.PANIC, "tool execution panicked", metadata);
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private record Invocation(String toolName, long startNanos, ExecutionContext context,
            Future<ToolResult> future, ToolResult immediate) {

        static Invocation completed(String toolName, long startNanos, ToolResult result) {
            return new Invocation(toolName, startNanos, null, null, result);
        }
    }
}
