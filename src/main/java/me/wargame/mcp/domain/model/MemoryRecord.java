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

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Long-term memory entry owned by one user.
 *
 * <p>
 * {@code importance} decays with age; {@code updatedAt} marks the last time the
 * consolidation job decayed or merged the record.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MemoryRecord {

    private String memoryId;
    private String userId;
    private MemoryScope scope;
    private String memory;

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    private String source;
    private double importance;
    private Instant createdAt;
    private Instant updatedAt;

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("memory_id", memoryId);
        map.put("user_id", userId);
        map.put("scope", scope != null ? scope.getValue() : null);
        map.put("memory", memory);
        map.put("tags", tags != null ? List.copyOf(tags) : List.of());
        map.put("source", source);
        map.put("importance", importance);
        map.put("created_at", createdAt != null ? createdAt.toString() : null);
        return map;
    }
}
