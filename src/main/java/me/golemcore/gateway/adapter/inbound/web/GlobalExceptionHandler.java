package me.golemcore.gateway.adapter.inbound.web;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.gateway.domain.model.ConfigurationException;
import me.golemcore.gateway.domain.model.MemoryCapacityException;
import me.golemcore.gateway.domain.model.TranslationException;
import me.golemcore.gateway.domain.model.UpstreamException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Centralized exception handler for the gateway controllers.
 */
@ControllerAdvice(basePackages = "me.golemcore.gateway.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(UpstreamException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleUpstream(UpstreamException ex) {
        log.warn("[API] Upstream failure from {}: {}", ex.getProviderId(), ex.getMessage());
        String message = ex.getBody() != null && !ex.getBody().isBlank() ? ex.getBody() : ex.getMessage();
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(HttpStatus.BAD_GATEWAY.value())
                .type("upstream_error")
                .message(message)
                .provider(ex.getProviderId())
                .upstreamStatus(ex.getStatus())
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body));
    }

    @ExceptionHandler(TranslationException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleTranslation(TranslationException ex) {
        log.warn("[API] Translation failure for {}: {}", ex.getProviderId(), ex.getMessage());
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(HttpStatus.BAD_GATEWAY.value())
                .type("translation_error")
                .message(ex.getMessage())
                .provider(ex.getProviderId())
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body));
    }

    @ExceptionHandler(ConfigurationException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleConfiguration(ConfigurationException ex) {
        log.error("[API] Configuration error: {}", ex.getMessage());
        return Mono.just(error(HttpStatus.INTERNAL_SERVER_ERROR, "configuration_error", ex.getMessage()));
    }

    @ExceptionHandler(MemoryCapacityException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleMemoryCapacity(MemoryCapacityException ex) {
        log.warn("[API] Memory capacity: {}", ex.getMessage());
        return Mono.just(error(HttpStatus.PAYLOAD_TOO_LARGE, "memory_capacity", ex.getMessage()));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        return Mono.just(error(status, null, ex.getReason()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return Mono.just(error(HttpStatus.BAD_REQUEST, "invalid_request_error", ex.getMessage()));
    }

    @ExceptionHandler(IllegalStateException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalState(IllegalStateException ex) {
        log.warn("[API] Conflict: {}", ex.getMessage());
        return Mono.just(error(HttpStatus.CONFLICT, "conflict", ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return Mono.just(error(HttpStatus.INTERNAL_SERVER_ERROR, null, "Internal server error"));
    }

    private static ResponseEntity<ApiErrorResponse> error(HttpStatus status, String type, String message) {
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .type(type)
                .message(message)
                .build();
        return ResponseEntity.status(status).body(body);
    }
}
