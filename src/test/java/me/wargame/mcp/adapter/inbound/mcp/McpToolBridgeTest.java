package me.wargame.mcp.adapter.inbound.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.spec.McpSchema;
import me.wargame.mcp.domain.component.ToolComponent;
import me.wargame.mcp.domain.model.ToolDefinition;
import me.wargame.mcp.domain.model.ToolFailureKind;
import me.wargame.mcp.domain.model.ToolResult;
import me.wargame.mcp.domain.model.ToolSource;
import me.wargame.mcp.domain.service.ToolRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class McpToolBridgeTest {

    private static final Map<String, Object> SEARCH_SCHEMA = Map.of(
            "type", "object",
            "properties", Map.of(
                    "question", Map.of("type", "string"),
                    "top_k", Map.of("type", "integer")),
            "required", List.of("question"));

    private McpToolBridge bridge;

    @BeforeEach
    void setUp() {
        ToolRegistry registry = new ToolRegistry(List.of(
                new ScriptedTool("search_knowledge", SEARCH_SCHEMA, true,
                        params -> ToolResult.success("1 hit", Map.of("question", params.get("question")))),
                new ScriptedTool("health_check", Map.of("type", "object"), true,
                        params -> ToolResult.success("ok", null)),
                new ScriptedTool("memory_add", Map.of("type", "object"), true,
                        params -> ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS, "memory is required")),
                new ScriptedTool("list_collections", Map.of("type", "object"), false,
                        params -> ToolResult.success("hidden", null)),
                new ScriptedTool("explode", Map.of("type", "object"), true,
                        params -> {
                            throw new IllegalStateException("boom");
                        })));
        bridge = new McpToolBridge(registry, new ObjectMapper());
    }

    @Test
    void shouldRegisterEveryEnabledToolWithItsSchema() {
        List<McpServerFeatures.AsyncToolSpecification> specs = bridge.toolSpecifications();

        assertEquals(List.of("explode", "health_check", "memory_add", "search_knowledge"),
                specs.stream().map(spec -> spec.tool().name()).toList());
        McpSchema.Tool search = specs.get(3).tool();
        assertEquals("Search tool search_knowledge", search.description());
        assertEquals("object", search.inputSchema().type());
        assertEquals(List.of("question"), search.inputSchema().required());
        assertEquals(Map.of("type", "integer"), search.inputSchema().properties().get("top_k"));
    }

    @Test
    void shouldReturnStructuredDataAsJson() {
        StepVerifier.create(bridge.call(new McpSchema.CallToolRequest("search_knowledge",
                Map.of("question", "bridge status"))))
                .assertNext(result -> {
                    assertFalse(result.isError());
                    assertEquals("{\"question\":\"bridge status\"}", text(result));
                })
                .verifyComplete();
    }

    @Test
    void shouldReturnOutputWhenNoDataAndToleratesMissingArguments() {
        StepVerifier.create(bridge.call(new McpSchema.CallToolRequest("health_check", null)))
                .assertNext(result -> {
                    assertFalse(result.isError());
                    assertEquals("ok", text(result));
                })
                .verifyComplete();
    }

    @Test
    void shouldMapToolFailureToErrorResult() {
        StepVerifier.create(bridge.call(new McpSchema.CallToolRequest("memory_add", Map.of())))
                .assertNext(result -> {
                    assertTrue(result.isError());
                    assertEquals("memory is required", text(result));
                })
                .verifyComplete();
    }

    @Test
    void shouldMapUnknownAndDisabledToolsToErrorResult() {
        StepVerifier.create(bridge.call(new McpSchema.CallToolRequest("list_collections", Map.of())))
                .assertNext(result -> {
                    assertTrue(result.isError());
                    assertEquals("Unknown tool: list_collections", text(result));
                })
                .verifyComplete();
    }

    @Test
    void shouldMapThrownExceptionToErrorResult() {
        StepVerifier.create(bridge.call(new McpSchema.CallToolRequest("explode", Map.of())))
                .assertNext(result -> {
                    assertTrue(result.isError());
                    assertTrue(text(result).startsWith("explode failed"));
                })
                .verifyComplete();
    }

    @Test
    void shouldInvokeToolThroughRegisteredCallHandler() {
        McpServerFeatures.AsyncToolSpecification spec = bridge.toolSpecifications().get(1);

        StepVerifier.create(spec.callHandler().apply(null, new McpSchema.CallToolRequest("health_check", Map.of())))
                .assertNext(result -> assertEquals("ok", text(result)))
                .verifyComplete();
    }

    @Test
    void shouldDefaultMissingSchemaToEmptyObject() {
        McpSchema.JsonSchema schema = McpToolBridge.toJsonSchema(null);

        assertEquals("object", schema.type());
        assertTrue(schema.properties().isEmpty());
        assertTrue(schema.required().isEmpty());
        assertNull(schema.additionalProperties());
    }

    private static String text(McpSchema.CallToolResult result) {
        return ((McpSchema.TextContent) result.content().get(0)).text();
    }

    private static final class ScriptedTool implements ToolComponent {

        private final String name;
        private final Map<String, Object> schema;
        private final boolean enabled;
        private final Function<Map<String, Object>, ToolResult> behaviour;

        private ScriptedTool(String name, Map<String, Object> schema, boolean enabled,
                Function<Map<String, Object>, ToolResult> behaviour) {
            this.name = name;
            this.schema = schema;
            this.enabled = enabled;
            this.behaviour = behaviour;
        }

        @Override
        public ToolDefinition getDefinition() {
            return ToolDefinition.builder()
                    .name(name)
                    .description("Search tool " + name)
                    .source(ToolSource.KNOWLEDGE)
                    .inputSchema(schema)
                    .build();
        }

        @Override
        public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
            return CompletableFuture.completedFuture(behaviour.apply(parameters));
        }

        @Override
        public boolean isEnabled() {
            return enabled;
        }
    }
}
