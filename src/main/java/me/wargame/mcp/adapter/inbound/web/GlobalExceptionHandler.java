package me.wargame.mcp.adapter.inbound.web;

import lombok.extern.slf4j.Slf4j;
import me.wargame.mcp.adapter.inbound.web.dto.ApiErrorResponse;
import me.wargame.mcp.domain.service.CorrelationSupport;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

/**
 * Centralized exception handler for the API controllers. Every error body
 * carries the correlation id so callers can find the matching log lines.
 */
@ControllerAdvice(basePackages = "me.wargame.mcp.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex,
            ServerWebExchange exchange) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        String correlationId = correlationId(exchange);
        log.warn("[API] {} [{}]: {}", status, correlationId, ex.getReason());
        return respond(status, ex.getReason(), correlationId);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalArgument(IllegalArgumentException ex,
            ServerWebExchange exchange) {
        String correlationId = correlationId(exchange);
        log.warn("[API] Bad request [{}]: {}", correlationId, ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage(), correlationId);
    }

    @ExceptionHandler(IllegalStateException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalState(IllegalStateException ex,
            ServerWebExchange exchange) {
        String correlationId = correlationId(exchange);
        log.warn("[API] Conflict [{}]: {}", correlationId, ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex.getMessage(), correlationId);
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex, ServerWebExchange exchange) {
        String correlationId = correlationId(exchange);
        log.error("[API] Internal server error [{}]", correlationId, ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", correlationId);
    }

    private static String correlationId(ServerWebExchange exchange) {
        String header = exchange != null
                ? exchange.getRequest().getHeaders().getFirst(CorrelationSupport.HEADER)
                : null;
        return CorrelationSupport.orNew(header);
    }

    private Mono<ResponseEntity<ApiErrorResponse>> respond(HttpStatus status, String message,
            String correlationId) {
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .message(message)
                .correlationId(correlationId)
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }
}
