package me.wargame.mcp.tools;

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

import me.wargame.mcp.domain.model.MemoryAddResult;
import me.wargame.mcp.domain.model.ToolDefinition;
import me.wargame.mcp.domain.model.ToolResult;
import me.wargame.mcp.domain.model.ToolSource;
import me.wargame.mcp.domain.service.MemoryGateway;
import me.wargame.mcp.infrastructure.config.WargameProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Stores a memory. Duplicates and quota rejections are successful calls whose
 * status says what happened.
 */
@Component
public class MemoryAddTool extends AbstractWargameTool {

    public static final String TOOL_NAME = "memory_add";

    static final String PARAM_USER_ID = "user_id";
    static final String PARAM_MEMORY = "memory";
    static final String PARAM_SCOPE = "scope";
    static final String PARAM_TAGS = "tags";
    static final String PARAM_SOURCE = "source";

    private final MemoryGateway gateway;
    private final String defaultScope;

    public MemoryAddTool(MemoryGateway gateway, WargameProperties properties) {
        this.gateway = gateway;
        this.defaultScope = properties.getMemory().getDefaultScope();
    }

    @Override
    public ToolDefinition getDefinition() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put(PARAM_USER_ID, Map.of("type", "string", "description", "Owner of the memory"));
        properties.put(PARAM_MEMORY, Map.of("type", "string", "description", "The fact to remember"));
        properties.put(PARAM_SCOPE, Map.of(
                "type", "string",
                "enum", List.of("user", "scenario", "agent"),
                "default", defaultScope,
                "description", "Memory namespace"));
        properties.put(PARAM_TAGS, Map.of(
                "type", "array",
                "items", Map.of("type", "string"),
                "description", "Optional tags"));
        properties.put(PARAM_SOURCE, Map.of("type", "string", "description", "Where the fact came from"));

        return ToolDefinition.builder()
                .name(TOOL_NAME)
                .description("Remember a fact for this user. Near-duplicates return the existing memory id.")
                .source(ToolSource.MEMORY)
                .inputSchema(objectSchema(properties, List.of(PARAM_USER_ID, PARAM_MEMORY)))
                .build();
    }

    @Override
    protected ToolResult run(ToolArguments arguments) {
        String scope = arguments.optionalString(PARAM_SCOPE);
        MemoryAddResult result = gateway.add(
                arguments.requiredString(PARAM_USER_ID),
                scope != null ? scope : defaultScope,
                arguments.requiredString(PARAM_MEMORY),
                arguments.stringList(PARAM_TAGS),
                arguments.optionalString(PARAM_SOURCE),
                arguments.correlationId());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("memory_id", result.getMemoryId());
        data.put("status", result.getStatus().getValue());
        if (result.getReason() != null) {
            data.put("reason", result.getReason());
        }
        return ToolResult.success("Memory " + result.getStatus().getValue(), data);
    }
}
