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

import me.wargame.mcp.domain.model.CollectionSummary;
import me.wargame.mcp.domain.model.ToolDefinition;
import me.wargame.mcp.domain.model.ToolResult;
import me.wargame.mcp.domain.model.ToolSource;
import me.wargame.mcp.domain.service.KnowledgeRetriever;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class ListCollectionsTool extends AbstractWargameTool {

    public static final String TOOL_NAME = "list_collections";

    private final KnowledgeRetriever retriever;

    public ListCollectionsTool(KnowledgeRetriever retriever) {
        this.retriever = retriever;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(TOOL_NAME)
                .description("List the document collections in the index with their document counts.")
                .source(ToolSource.KNOWLEDGE)
                .inputSchema(objectSchema(Map.of(), List.of()))
                .build();
    }

    @Override
    protected ToolResult run(ToolArguments arguments) {
        List<Map<String, Object>> items = retriever.listCollections().stream()
                .map(ListCollectionsTool::toMap)
                .toList();
        return ToolResult.success(items.size() + " collections", Map.of("collections", items));
    }

    private static Map<String, Object> toMap(CollectionSummary summary) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", summary.name());
        map.put("document_count", summary.documentCount());
        map.put("description", summary.description());
        return map;
    }
}
