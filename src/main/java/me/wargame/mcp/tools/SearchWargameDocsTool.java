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

import me.wargame.mcp.domain.model.SearchResult;
import me.wargame.mcp.domain.model.ToolDefinition;
import me.wargame.mcp.domain.model.ToolResult;
import me.wargame.mcp.domain.model.ToolSource;
import me.wargame.mcp.domain.service.KnowledgeRetriever;
import me.wargame.mcp.infrastructure.config.WargameProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Semantic search over the wargame corpus.
 */
@Component
public class SearchWargameDocsTool extends AbstractWargameTool {

    public static final String TOOL_NAME = "search_wargame_docs";

    static final String PARAM_QUERY = "query";
    static final String PARAM_TOP_K = "top_k";
    static final String PARAM_MIN_SCORE = "min_score";
    static final String PARAM_COLLECTIONS = "collections";

    private final KnowledgeRetriever retriever;
    private final WargameProperties.RetrievalProperties defaults;

    public SearchWargameDocsTool(KnowledgeRetriever retriever, WargameProperties properties) {
        this.retriever = retriever;
        this.defaults = properties.getRetrieval();
    }

    @Override
    public ToolDefinition getDefinition() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put(PARAM_QUERY, Map.of("type", "string", "description", "Natural-language search query"));
        properties.put(PARAM_TOP_K, Map.of(
                "type", "integer",
                "minimum", 1,
                "default", defaults.getDefaultTopK(),
                "description", "Maximum number of results"));
        properties.put(PARAM_MIN_SCORE, Map.of(
                "type", "number",
                "minimum", 0,
                "maximum", 1,
                "default", defaults.getDefaultMinScore(),
                "description", "Drop results scoring below this value"));
        properties.put(PARAM_COLLECTIONS, Map.of(
                "type", "array",
                "items", Map.of("type", "string", "enum", List.of("doctrine", "aar", "scenario", "intel", "other")),
                "description", "Restrict the search to these collections"));

        return ToolDefinition.builder()
                .name(TOOL_NAME)
                .description("Search wargaming doctrine, after-action reports, scenarios and intel by meaning.")
                .source(ToolSource.KNOWLEDGE)
                .inputSchema(objectSchema(properties, List.of(PARAM_QUERY)))
                .build();
    }

    @Override
    protected ToolResult run(ToolArguments arguments) {
        List<SearchResult> results = retriever.search(
                arguments.requiredString(PARAM_QUERY),
                arguments.integer(PARAM_TOP_K, defaults.getDefaultTopK()),
                arguments.number(PARAM_MIN_SCORE, defaults.getDefaultMinScore()),
                arguments.stringList(PARAM_COLLECTIONS),
                arguments.correlationId());

        List<Map<String, Object>> items = results.stream().map(SearchWargameDocsTool::toMap).toList();
        return ToolResult.success("Found " + items.size() + " matching passages", Map.of("results", items));
    }

    private static Map<String, Object> toMap(SearchResult result) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("chunk_id", result.getChunkId());
        map.put("text", result.getText());
        map.put("score", result.getScore());
        map.put("metadata", result.getMetadata());
        return map;
    }
}
