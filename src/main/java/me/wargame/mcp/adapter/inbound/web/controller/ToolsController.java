package me.wargame.mcp.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.wargame.mcp.domain.model.ToolDefinition;
import me.wargame.mcp.domain.model.ToolFailureKind;
import me.wargame.mcp.domain.model.ToolResult;
import me.wargame.mcp.domain.service.ToolRegistry;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Tool surface: definitions and direct invocation.
 */
@RestController
@RequestMapping("/api/v1/tools")
@RequiredArgsConstructor
public class ToolsController {

    private final ToolRegistry toolRegistry;

    @GetMapping
    public Mono<ResponseEntity<List<ToolDefinition>>> listTools() {
        return Mono.just(ResponseEntity.ok(toolRegistry.getDefinitions()));
    }

    @PostMapping("/{name}")
    public Mono<ResponseEntity<ToolResult>> invoke(@PathVariable String name,
            @RequestBody(required = false) Map<String, Object> arguments) {
        Map<String, Object> params = arguments != null ? arguments : Map.of();
        return Mono.fromFuture(toolRegistry.execute(name, params))
                .map(result -> result.getFailureKind() == ToolFailureKind.UNKNOWN_TOOL
                        ? ResponseEntity.status(HttpStatus.NOT_FOUND).body(result)
                        : ResponseEntity.ok(result));
    }
}
