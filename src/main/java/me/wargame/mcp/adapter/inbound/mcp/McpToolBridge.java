package me.wargame.mcp.adapter.inbound.mcp;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.spec.McpSchema;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.wargame.mcp.domain.model.ToolDefinition;
import me.wargame.mcp.domain.model.ToolResult;
import me.wargame.mcp.domain.service.ToolRegistry;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Exposes every enabled {@link ToolRegistry} entry as an MCP tool.
 *
 * <p>
 * The tool's JSON Schema is forwarded as the MCP input schema. A successful
 * {@link ToolResult} becomes a text result holding its structured data as
 * JSON (or its output when it carries no data); a failed one becomes an error
 * result with the failure message.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class McpToolBridge {

    private final ToolRegistry toolRegistry;
    private final ObjectMapper objectMapper;

    public List<McpServerFeatures.AsyncToolSpecification> toolSpecifications() {
        return toolRegistry.getDefinitions().stream()
                .map(this::toSpecification)
                .toList();
    }

    McpServerFeatures.AsyncToolSpecification toSpecification(ToolDefinition definition) {
        McpSchema.Tool tool = McpSchema.Tool.builder()
                .name(definition.getName())
                .description(definition.getDescription())
                .inputSchema(toJsonSchema(definition.getInputSchema()))
                .build();
        return McpServerFeatures.AsyncToolSpecification.builder()
                .tool(tool)
                .callHandler((exchange, request) -> call(request))
                .build();
    }

    Mono<McpSchema.CallToolResult> call(McpSchema.CallToolRequest request) {
        String name = request.name();
        Map<String, Object> arguments = request.arguments() != null ? request.arguments() : Map.of();
        log.debug("[MCP] Tool call: {}", name);
        return Mono.fromFuture(() -> toolRegistry.execute(name, arguments))
                .map(this::toCallResult)
                .onErrorResume(e -> {
                    log.warn("[MCP] Tool {} failed", name, e);
                    return Mono.just(new McpSchema.CallToolResult(name + " failed: " + e.getMessage(), true));
                });
    }

    McpSchema.CallToolResult toCallResult(ToolResult result) {
        if (!result.isSuccess()) {
            return new McpSchema.CallToolResult(result.getError(), true);
        }
        if (result.getData() == null) {
            return new McpSchema.CallToolResult(result.getOutput() != null ? result.getOutput() : "", false);
        }
        try {
            return new McpSchema.CallToolResult(objectMapper.writeValueAsString(result.getData()), false);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Tool result is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    @SuppressWarnings("unchecked")
    static McpSchema.JsonSchema toJsonSchema(Map<String, Object> schema) {
        Map<String, Object> source = schema != null ? schema : Map.of();
        String type = String.valueOf(source.getOrDefault("type", "object"));
        Map<String, Object> properties = source.get("properties") instanceof Map<?, ?> map
                ? (Map<String, Object>) map
                : Map.of();
        List<String> required = source.get("required") instanceof List<?> list
                ? list.stream().map(String::valueOf).toList()
                : List.of();
        Boolean additionalProperties = source.get("additionalProperties") instanceof Boolean flag ? flag : null;
        return new McpSchema.JsonSchema(type, properties, required, additionalProperties, null, null);
    }
}
