package me.wargame.mcp.adapter.outbound.memory;

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

import lombok.extern.slf4j.Slf4j;
import me.wargame.mcp.domain.model.MemoryHit;
import me.wargame.mcp.domain.model.MemoryRecord;
import me.wargame.mcp.domain.model.MemoryScope;
import me.wargame.mcp.domain.model.SimilarityMetric;
import me.wargame.mcp.domain.model.exception.MemoryBackendException;
import me.wargame.mcp.port.outbound.EmbeddingPort;
import me.wargame.mcp.port.outbound.MemoryBackendPort;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process memory store. Records are embedded on write and searched
 * exhaustively with the configured similarity metric.
 */
@Slf4j
public class LocalMemoryAdapter implements MemoryBackendPort {

    private final EmbeddingPort embeddingPort;
    private final SimilarityMetric metric;
    private final Map<String, StoredMemory> memories = new ConcurrentHashMap<>();

    public LocalMemoryAdapter(EmbeddingPort embeddingPort, SimilarityMetric metric) {
        this.embeddingPort = embeddingPort;
        this.metric = metric;
    }

    @Override
    public List<MemoryHit> search(String query, String userId, int limit, Set<MemoryScope> scopes,
            String correlationId) {
        float[] queryVector = embed(query);
        List<MemoryHit> hits = new ArrayList<>();
        for (StoredMemory stored : memories.values()) {
            MemoryRecord record = stored.record();
            if (!userId.equals(record.getUserId())) {
                continue;
            }
            if (scopes != null && !scopes.isEmpty() && !scopes.contains(record.getScope())) {
                continue;
            }
            hits.add(new MemoryHit(copy(record), metric.score(queryVector, stored.vector())));
        }
        hits.sort(Comparator.comparingDouble(MemoryHit::score).reversed()
                .thenComparing(hit -> hit.record().getMemoryId()));
        return hits.size() > limit ? new ArrayList<>(hits.subList(0, limit)) : hits;
    }

    @Override
    public MemoryRecord add(MemoryRecord record, String correlationId) {
        MemoryRecord stored = copy(record);
        stored.setMemoryId(UUID.randomUUID().toString());
        memories.put(stored.getMemoryId(), new StoredMemory(stored, embed(stored.getMemory())));
        log.debug("[Memory] Stored {} for user {}", stored.getMemoryId(), stored.getUserId());
        return copy(stored);
    }

    @Override
    public MemoryRecord update(MemoryRecord record, String correlationId) {
        MemoryRecord updated = copy(record);
        StoredMemory previous = memories.computeIfPresent(record.getMemoryId(), (id, existing) -> {
            float[] vector = existing.record().getMemory().equals(updated.getMemory())
                    ? existing.vector()
                    : embed(updated.getMemory());
            return new StoredMemory(updated, vector);
        });
        if (previous == null) {
            throw new MemoryBackendException("Unknown memory " + record.getMemoryId());
        }
        return copy(updated);
    }

    @Override
    public boolean delete(String memoryId, String correlationId) {
        return memories.remove(memoryId) != null;
    }

    @Override
    public List<MemoryRecord> list(String userId, int limit, MemoryScope scope, Set<String> tags,
            String correlationId) {
        return memories.values().stream()
                .map(StoredMemory::record)
                .filter(record -> userId.equals(record.getUserId()))
                .filter(record -> scope == null || scope == record.getScope())
                .filter(record -> tags == null || tags.isEmpty()
                        || record.getTags().stream().anyMatch(tags::contains))
                .sorted(Comparator.comparing(MemoryRecord::getCreatedAt,
                        Comparator.nullsLast(Comparator.reverseOrder()))
                        .thenComparing(MemoryRecord::getMemoryId))
                .limit(limit)
                .map(LocalMemoryAdapter::copy)
                .toList();
    }

    private float[] embed(String text) {
        try {
            return embeddingPort.embed(text).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new MemoryBackendException("Embedding failed: " + cause.getMessage(), cause);
        }
    }

    private static MemoryRecord copy(MemoryRecord record) {
        return MemoryRecord.builder()
                .memoryId(record.getMemoryId())
                .userId(record.getUserId())
                .scope(record.getScope())
                .memory(record.getMemory())
                .tags(new ArrayList<>(record.getTags() != null ? record.getTags() : List.of()))
                .source(record.getSource())
                .importance(record.getImportance())
                .createdAt(record.getCreatedAt())
                .updatedAt(record.getUpdatedAt())
                .build();
    }

    private record StoredMemory(MemoryRecord record, float[] vector) {
    }
}
