package me.golemcore.agents.adapter.inbound.web;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.agents.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.agents.domain.system.toolloop.TurnAbortedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.NoSuchElementException;

/**
 * Centralized exception handler for API controllers.
 */
@ControllerAdvice(basePackages = "me.golemcore.agents.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    /** Non-standard status used by nginx for requests abandoned by the client. */
    static final int CLIENT_CLOSED_REQUEST = 499;

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .message(ex.getReason())
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }

    @ExceptionHandler(NoSuchElementException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleNotFound(NoSuchElementException ex) {
        log.warn("[API] Not found: {}", ex.getMessage());
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(HttpStatus.NOT_FOUND.value())
                .message(ex.getMessage())
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.NOT_FOUND).body(body));
    }

    @ExceptionHandler(TurnAbortedException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleTurnAborted(TurnAbortedException ex) {
        int status = statusOf(ex);
        if (status >= 500) {
            log.error("[API] Chat turn aborted [{}] after {} iteration(s): {}", ex.getCode(), ex.getIterations(),
                    ex.getMessage());
        } else {
            log.warn("[API] Chat turn aborted [{}]: {}", ex.getCode(), ex.getMessage());
        }
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status)
                .message(ex.getMessage())
                .code(ex.getCode().name())
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(HttpStatus.BAD_REQUEST.value())
                .message(ex.getMessage())
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body));
    }

    @ExceptionHandler(IllegalStateException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalState(IllegalStateException ex) {
        log.warn("[API] Conflict: {}", ex.getMessage());
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(HttpStatus.CONFLICT.value())
                .message(ex.getMessage())
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.CONFLICT).body(body));
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(HttpStatus.INTERNAL_SERVER_ERROR.value())
                .message("Internal server error")
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body));
    }

    static int statusOf(TurnAbortedException ex) {
        return switch (ex.getCode()) {
        case PROVIDER_ERROR -> HttpStatus.BAD_GATEWAY.value();
        case PROVIDER_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE.value();
        case CONTEXT_ERROR -> HttpStatus.BAD_REQUEST.value();
        case CANCELLED -> CLIENT_CLOSED_REQUEST;
        case MAX_ITERATIONS_EXCEEDED -> HttpStatus.INTERNAL_SERVER_ERROR.value();
        };
    }
}
