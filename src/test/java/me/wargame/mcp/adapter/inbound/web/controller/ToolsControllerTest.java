package me.wargame.mcp.adapter.inbound.web.controller;

import me.wargame.mcp.domain.model.ToolDefinition;
import me.wargame.mcp.domain.model.ToolFailureKind;
import me.wargame.mcp.domain.model.ToolResult;
import me.wargame.mcp.domain.model.ToolSource;
import me.wargame.mcp.domain.service.ToolRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ToolsControllerTest {

    private ToolRegistry toolRegistry;
    private ToolsController controller;

    @BeforeEach
    void setUp() {
        toolRegistry = mock(ToolRegistry.class);
        controller = new ToolsController(toolRegistry);
    }

    @Test
    void shouldListToolDefinitions() {
        ToolDefinition definition = ToolDefinition.builder()
                .name("health_check")
                .source(ToolSource.KNOWLEDGE)
                .inputSchema(Map.of())
                .build();
        when(toolRegistry.getDefinitions()).thenReturn(List.of(definition));

        StepVerifier.create(controller.listTools())
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals(1, response.getBody().size());
                    assertEquals("v1", response.getBody().get(0).getVersion());
                })
                .verifyComplete();
    }

    @Test
    void shouldInvokeToolAndReturnResult() {
        Map<String, Object> arguments = Map.of("query", "breach");
        when(toolRegistry.execute("search_wargame_docs", arguments))
                .thenReturn(CompletableFuture.completedFuture(ToolResult.success("Found 0 matching passages",
                        Map.of("results", List.of()))));

        StepVerifier.create(controller.invoke("search_wargame_docs", arguments))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertTrue(response.getBody().isSuccess());
                })
                .verifyComplete();
    }

    @Test
    void shouldReturnToolFailuresWithOkStatus() {
        when(toolRegistry.execute("memory_add", Map.of()))
                .thenReturn(CompletableFuture.completedFuture(ToolResult.failure(
                        ToolFailureKind.INVALID_ARGUMENTS, "Missing required parameter: user_id")));

        StepVerifier.create(controller.invoke("memory_add", null))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals(ToolFailureKind.INVALID_ARGUMENTS, response.getBody().getFailureKind());
                })
                .verifyComplete();
        verify(toolRegistry).execute("memory_add", Map.of());
    }

    @Test
    void shouldReturnNotFoundForUnknownTool() {
        when(toolRegistry.execute("nope", Map.of()))
                .thenReturn(CompletableFuture.completedFuture(
                        ToolResult.failure(ToolFailureKind.UNKNOWN_TOOL, "Unknown tool: nope")));

        StepVerifier.create(controller.invoke("nope", Map.of()))
                .assertNext(response -> assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode()))
                .verifyComplete();
    }
}
