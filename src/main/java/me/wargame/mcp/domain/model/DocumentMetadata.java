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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-document metadata, denormalized onto every chunk of the document.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DocumentMetadata {

    public static final int MIN_YEAR = 1900;
    public static final int MAX_YEAR = 2100;

    private String documentId;
    private String sourcePath;

    @Builder.Default
    private DocumentCollection collection = DocumentCollection.OTHER;

    private String title;
    private Integer year;
    private Doctrine doctrine;

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    /**
     * Flat view used in tool responses (v1 field names).
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("document_id", documentId);
        map.put("source", sourcePath);
        map.put("collection", collection != null ? collection.getValue() : DocumentCollection.OTHER.getValue());
        map.put("title", title);
        map.put("year", year);
        map.put("doctrine", doctrine != null ? doctrine.getValue() : null);
        map.put("tags", tags != null ? List.copyOf(tags) : List.of());
        return map;
    }

    public static boolean isValidYear(Integer year) {
        return year != null && year >= MIN_YEAR && year <= MAX_YEAR;
    }
}
