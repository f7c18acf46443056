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

import me.wargame.mcp.domain.model.MemoryRecord;
import me.wargame.mcp.domain.model.ToolDefinition;
import me.wargame.mcp.domain.model.ToolResult;
import me.wargame.mcp.domain.model.ToolSource;
import me.wargame.mcp.domain.service.MemoryGateway;
import me.wargame.mcp.infrastructure.config.WargameProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class MemoryListTool extends AbstractWargameTool {

    public static final String TOOL_NAME = "memory_list";

    static final String PARAM_USER_ID = "user_id";
    static final String PARAM_LIMIT = "limit";
    static final String PARAM_SCOPE = "scope";
    static final String PARAM_TAGS = "tags";

    private final MemoryGateway gateway;
    private final int defaultLimit;

    public MemoryListTool(MemoryGateway gateway, WargameProperties properties) {
        this.gateway = gateway;
        this.defaultLimit = properties.getMemory().getDefaultLimit();
    }

    @Override
    public ToolDefinition getDefinition() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put(PARAM_USER_ID, Map.of("type", "string", "description", "Owner of the memories"));
        properties.put(PARAM_LIMIT, Map.of(
                "type", "integer",
                "minimum", 1,
                "default", defaultLimit,
                "description", "Maximum number of memories"));
        properties.put(PARAM_SCOPE, Map.of(
                "type", "string",
                "enum", List.of("user", "scenario", "agent"),
                "description", "Only this scope"));
        properties.put(PARAM_TAGS, Map.of(
                "type", "array",
                "items", Map.of("type", "string"),
                "description", "Only memories carrying any of these tags"));

        return ToolDefinition.builder()
                .name(TOOL_NAME)
                .description("List the user's most recent memories.")
                .source(ToolSource.MEMORY)
                .inputSchema(objectSchema(properties, List.of(PARAM_USER_ID)))
                .build();
    }

    @Override
    protected ToolResult run(ToolArguments arguments) {
        List<MemoryRecord> records = gateway.list(
                arguments.requiredString(PARAM_USER_ID),
                arguments.integer(PARAM_LIMIT, defaultLimit),
                arguments.optionalString(PARAM_SCOPE),
                arguments.stringList(PARAM_TAGS),
                arguments.correlationId());

        List<Map<String, Object>> items = records.stream().map(MemoryRecord::toMap).toList();
        return ToolResult.success(items.size() + " memories", Map.of("memories", items));
    }
}
