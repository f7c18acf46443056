package me.wargame.mcp.adapter.inbound.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentSessionRequest {
    private String question;

    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("correlation_id")
    private String correlationId;
}
