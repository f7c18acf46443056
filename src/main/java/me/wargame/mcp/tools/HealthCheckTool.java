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

import me.wargame.mcp.domain.model.HealthReport;
import me.wargame.mcp.domain.model.ToolDefinition;
import me.wargame.mcp.domain.model.ToolResult;
import me.wargame.mcp.domain.model.ToolSource;
import me.wargame.mcp.domain.service.KnowledgeRetriever;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks the knowledge index. An unhealthy index is still a successful call;
 * the status field carries the verdict.
 */
@Component
public class HealthCheckTool extends AbstractWargameTool {

    public static final String TOOL_NAME = "health_check";

    private final KnowledgeRetriever retriever;

    public HealthCheckTool(KnowledgeRetriever retriever) {
        this.retriever = retriever;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(TOOL_NAME)
                .description("Report whether the knowledge index is reachable and populated.")
                .source(ToolSource.KNOWLEDGE)
                .inputSchema(objectSchema(Map.of(), List.of()))
                .build();
    }

    @Override
    protected ToolResult run(ToolArguments arguments) {
        HealthReport report = retriever.healthCheck();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("status", report.getStatus().getValue());
        data.put("details", report.getDetails());
        return ToolResult.success("Index status: " + report.getStatus().getValue(), data);
    }
}
