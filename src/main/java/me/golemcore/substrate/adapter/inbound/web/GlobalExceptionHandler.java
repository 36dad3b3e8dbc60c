package me.golemcore.substrate.adapter.inbound.web;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.substrate.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.substrate.domain.exception.ErrorKind;
import me.golemcore.substrate.domain.exception.KernelException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Maps kernel rejections to HTTP responses. Every body carries the reason and
 * the ledger entry that recorded the attempt, when there is one.
 */
@ControllerAdvice(basePackages = "me.golemcore.substrate.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(KernelException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleKernel(KernelException ex) {
        HttpStatus status = statusFor(ex.getKind());
        if (status.is5xxServerError()) {
            log.error("[API] {}: {}", ex.getKind(), ex.getMessage());
        } else {
            log.warn("[API] {}: {}", ex.getKind(), ex.getMessage());
        }
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .error(ex.getKind().name())
                .message(ex.getReason())
                .ledgerSequence(ex.getLedgerSequence())
                .retryable(ex.isRetryable())
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .error(status.name())
                .message(ex.getReason())
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(HttpStatus.BAD_REQUEST.value())
                .error(HttpStatus.BAD_REQUEST.name())
                .message(ex.getMessage())
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body));
    }

    @ExceptionHandler(IllegalStateException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalState(IllegalStateException ex) {
        log.warn("[API] Conflict: {}", ex.getMessage());
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(HttpStatus.CONFLICT.value())
                .error(HttpStatus.CONFLICT.name())
                .message(ex.getMessage())
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.CONFLICT).body(body));
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(HttpStatus.INTERNAL_SERVER_ERROR.value())
                .error(HttpStatus.INTERNAL_SERVER_ERROR.name())
                .message("Internal server error")
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body));
    }

    static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
        case CONCURRENT_APPEND_CONFLICT, INSUFFICIENT_BUDGET, INVALID_TRANSITION, ARBITRATION_DENIED ->
            HttpStatus.CONFLICT;
        case AGENT_QUARANTINED -> HttpStatus.LOCKED;
        case AGENT_TERMINATED -> HttpStatus.GONE;
        case PRIVILEGE_REQUIRED -> HttpStatus.FORBIDDEN;
        case UNKNOWN_AGENT, UNKNOWN_CHECKPOINT -> HttpStatus.NOT_FOUND;
        case UNKNOWN_ACTION_KIND -> HttpStatus.BAD_REQUEST;
        case CHAIN_VERIFICATION_FAILURE -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
