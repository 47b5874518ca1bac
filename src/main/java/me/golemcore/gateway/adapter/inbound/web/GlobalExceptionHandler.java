package me.golemcore.gateway.adapter.inbound.web;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.gateway.domain.exception.CacheUnavailableException;
import me.golemcore.gateway.domain.exception.LockAcquisitionException;
import me.golemcore.gateway.domain.exception.SessionNotFoundException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Centralized exception handler for gateway controllers. Maps domain failures
 * to status codes without leaking exception detail to the client.
 */
@ControllerAdvice(basePackages = "me.golemcore.gateway.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    static final String RETRY_AFTER_SECONDS = "1";

    @ExceptionHandler(SessionNotFoundException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleSessionNotFound(SessionNotFoundException ex) {
        log.debug("[API] Session not found: {}", ex.getSessionId());
        return Mono.just(error(HttpStatus.NOT_FOUND, SessionNotFoundException.MESSAGE));
    }

    @ExceptionHandler(LockAcquisitionException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleLockAcquisition(LockAcquisitionException ex) {
        log.warn("[API] Lock busy for {}: {}", ex.getResourceId(), ex.getMessage());
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(HttpStatus.SERVICE_UNAVAILABLE.value())
                .message("Session is busy, retry later")
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS)
                .body(body));
    }

    @ExceptionHandler(CacheUnavailableException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleCacheUnavailable(CacheUnavailableException ex) {
        log.error("[API] Shared cache unavailable: {}", ex.getMessage());
        return Mono.just(error(HttpStatus.SERVICE_UNAVAILABLE, "Service temporarily unavailable"));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        return Mono.just(error(status, ex.getReason()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return Mono.just(error(HttpStatus.BAD_REQUEST, ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return Mono.just(error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error"));
    }

    private static ResponseEntity<ApiErrorResponse> error(HttpStatus status, String message) {
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .message(message)
                .build();
        return ResponseEntity.status(status).body(body);
    }
}
