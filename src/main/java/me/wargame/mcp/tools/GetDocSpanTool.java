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

import me.wargame.mcp.domain.model.DocumentChunk;
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
 * Returns the chunks surrounding a hit for extended context.
 */
@Component
public class GetDocSpanTool extends AbstractWargameTool {

    public static final String TOOL_NAME = "get_doc_span";

    static final String PARAM_DOCUMENT_ID = "document_id";
    static final String PARAM_CENTER = "center_chunk_index";
    static final String PARAM_SPAN = "span";

    private final KnowledgeRetriever retriever;
    private final int defaultSpan;

    public GetDocSpanTool(KnowledgeRetriever retriever, WargameProperties properties) {
        this.retriever = retriever;
        this.defaultSpan = properties.getRetrieval().getDefaultSpan();
    }

    @Override
    public ToolDefinition getDefinition() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put(PARAM_DOCUMENT_ID, Map.of("type", "string", "description", "Document id from a search hit"));
        properties.put(PARAM_CENTER, Map.of(
                "type", "integer",
                "minimum", 0,
                "description", "Chunk index to center the span on"));
        properties.put(PARAM_SPAN, Map.of(
                "type", "integer",
                "minimum", 0,
                "default", defaultSpan,
                "description", "Number of chunks to include on each side"));

        return ToolDefinition.builder()
                .name(TOOL_NAME)
                .description("Fetch neighbouring chunks of a document around a given chunk index.")
                .source(ToolSource.KNOWLEDGE)
                .inputSchema(objectSchema(properties, List.of(PARAM_DOCUMENT_ID, PARAM_CENTER)))
                .build();
    }

    @Override
    protected ToolResult run(ToolArguments arguments) {
        List<DocumentChunk> chunks = retriever.getSpan(
                arguments.requiredString(PARAM_DOCUMENT_ID),
                arguments.requiredInteger(PARAM_CENTER),
                arguments.integer(PARAM_SPAN, defaultSpan));

        List<Map<String, Object>> items = chunks.stream().map(GetDocSpanTool::toMap).toList();
        return ToolResult.success("Returned " + items.size() + " chunks", Map.of("chunks", items));
    }

    private static Map<String, Object> toMap(DocumentChunk chunk) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("chunk_index", chunk.getChunkIndex());
        map.put("text", chunk.getText());
        map.put("metadata", chunk.toMetadataMap());
        return map;
    }
}
