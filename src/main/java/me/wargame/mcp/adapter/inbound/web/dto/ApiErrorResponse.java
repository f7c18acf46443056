package me.wargame.mcp.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Error body for API endpoints. {@code correlationId} echoes the request's
 * {@code X-Correlation-ID}, or a fresh one when the caller sent none.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApiErrorResponse {
    private int status;
    private String message;
    private String correlationId;
}
