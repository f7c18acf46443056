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

import me.wargame.mcp.domain.model.MemoryDeleteStatus;
import me.wargame.mcp.domain.model.ToolDefinition;
import me.wargame.mcp.domain.model.ToolResult;
import me.wargame.mcp.domain.model.ToolSource;
import me.wargame.mcp.domain.service.MemoryGateway;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
public class MemoryDeleteTool extends AbstractWargameTool {

    public static final String TOOL_NAME = "memory_delete";

    static final String PARAM_MEMORY_ID = "memory_id";

    private final MemoryGateway gateway;

    public MemoryDeleteTool(MemoryGateway gateway) {
        this.gateway = gateway;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(TOOL_NAME)
                .description("Delete a memory by id.")
                .source(ToolSource.MEMORY)
                .inputSchema(objectSchema(
                        Map.of(PARAM_MEMORY_ID, Map.of("type", "string", "description", "Memory to delete")),
                        List.of(PARAM_MEMORY_ID)))
                .build();
    }

    @Override
    protected ToolResult run(ToolArguments arguments) {
        MemoryDeleteStatus status = gateway.delete(arguments.requiredString(PARAM_MEMORY_ID),
                arguments.correlationId());
        return ToolResult.success("Memory " + status.getValue(), Map.of("status", status.getValue()));
    }
}
