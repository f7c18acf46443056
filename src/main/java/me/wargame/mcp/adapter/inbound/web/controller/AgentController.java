package me.wargame.mcp.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.wargame.mcp.adapter.inbound.web.dto.AgentSessionRequest;
import me.wargame.mcp.domain.model.OrchestrationResult;
import me.wargame.mcp.domain.system.toolloop.ToolOrchestrator;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Runs one analyst session through the tool loop and returns what it gathered.
 */
@RestController
@RequestMapping("/api/v1/agent")
@RequiredArgsConstructor
public class AgentController {

    private final ToolOrchestrator toolOrchestrator;

    @PostMapping("/sessions")
    public Mono<ResponseEntity<OrchestrationResult>> runSession(@RequestBody AgentSessionRequest request) {
        if (request == null || request.getQuestion() == null || request.getQuestion().isBlank()) {
            throw new IllegalArgumentException("question is required");
        }
        return Mono.fromCallable(() -> ResponseEntity.ok(toolOrchestrator.run(request.getQuestion(),
                request.getUserId(), request.getCorrelationId())))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
