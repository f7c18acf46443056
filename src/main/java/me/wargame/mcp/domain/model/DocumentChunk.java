package me.wargame.mcp.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bounded, overlapping segment of a document's text; the unit of retrieval.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DocumentChunk {

    private String chunkId;
    private String documentId;
    private int chunkIndex;
    private int chunkCount;
    private String text;
    private boolean ocr;
    private int tokenCount;
    private DocumentMetadata metadata;

    public static String chunkId(String documentId, int chunkIndex) {
        return documentId + ":" + chunkIndex;
    }

    public Map<String, Object> toMetadataMap() {
        Map<String, Object> map = metadata != null ? metadata.toMap() : new LinkedHashMap<>();
        map.put("document_id", documentId);
        map.put("chunk_id", chunkId);
        map.put("chunk_index", chunkIndex);
        map.put("chunk_count", chunkCount);
        map.put("ocr", ocr);
        return map;
    }
}
