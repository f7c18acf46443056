package me.wargame.mcp.domain.service;

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
import me.wargame.mcp.domain.model.CollectionStats;
import me.wargame.mcp.domain.model.CollectionSummary;
import me.wargame.mcp.domain.model.DocumentChunk;
import me.wargame.mcp.domain.model.DocumentCollection;
import me.wargame.mcp.domain.model.HealthReport;
import me.wargame.mcp.domain.model.IndexFilter;
import me.wargame.mcp.domain.model.IndexedChunk;
import me.wargame.mcp.domain.model.ScoredChunk;
import me.wargame.mcp.domain.model.SearchResult;
import me.wargame.mcp.domain.model.exception.ToolInvocationException;
import me.wargame.mcp.infrastructure.config.WargameProperties;
import me.wargame.mcp.port.outbound.EmbeddingPort;
import me.wargame.mcp.port.outbound.VectorIndexPort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletionException;

/**
 * Read side of the knowledge index: filtered semantic search, span expansion
 * around a hit, collection inventory and health probing.
 */
@Service
@Slf4j
public class KnowledgeRetriever {

    static final Comparator<SearchResult> RESULT_ORDER = Comparator
            .comparingDouble(SearchResult::getScore).reversed()
            .thenComparingInt(SearchResult::getChunkIndex)
            .thenComparing(SearchResult::getDocumentId);

    private final EmbeddingPort embeddingPort;
    private final VectorIndexPort indexPort;
    private final Map<String, String> collectionDescriptions;

    public KnowledgeRetriever(EmbeddingPort embeddingPort, VectorIndexPort indexPort,
            WargameProperties properties) {
        this.embeddingPort = embeddingPort;
        this.indexPort = indexPort;
        this.collectionDescriptions = Map.copyOf(properties.getIndex().getCollectionDescriptions());
    }

    /**
     * @param collections
     *            collection names to search; {@code null} or empty means all
     * @throws IllegalArgumentException
     *             for a blank query, {@code topK < 1} or an unknown collection
     * @throws ToolInvocationException
     *             when embedding or the index query fails
     */
    public List<SearchResult> search(String query, int topK, double minScore, Collection<String> collections,
            String correlationId) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }
        if (topK < 1) {
            throw new IllegalArgumentException("top_k must be >= 1, got " + topK);
        }
        IndexFilter filter = new IndexFilter(parseCollections(collections));

        float[] vector;
        try {
            vector = embeddingPort.embed(query).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ToolInvocationException("Query embedding failed: " + cause.getMessage(), cause);
        }

        List<ScoredChunk> hits;
        try {
            hits = indexPort.query(vector, filter, topK, correlationId);
        } catch (RuntimeException e) {
            throw new ToolInvocationException("Index query failed: " + e.getMessage(), e);
        }

        List<SearchResult> results = hits.stream()
                .filter(hit -> hit.score() >= minScore)
                .map(KnowledgeRetriever::toResult)
                .sorted(RESULT_ORDER)
                .limit(topK)
                .toList();
        log.debug("[Retriever] '{}' -> {} hits, {} above {}", query, hits.size(), results.size(), minScore);
        return results;
    }

    /**
     * Chunks {@code [center - span, center + span]} of a document, clipped to the
     * document's bounds and ordered by index.
     *
     * @throws IllegalArgumentException
     *             when {@code span < 0}
     */
    public List<DocumentChunk> getSpan(String documentId, int centerChunkIndex, int span) {
        if (span < 0) {
            throw new IllegalArgumentException("span must be >= 0, got " + span);
        }
        if (documentId == null || documentId.isBlank()) {
            throw new IllegalArgumentException("document_id must not be blank");
        }
        List<IndexedChunk> chunks = indexPort.getDocumentChunks(documentId);
        if (chunks.isEmpty()) {
            return List.of();
        }
        int lastIndex = chunks.size() - 1;
        int from = Math.max(0, centerChunkIndex - span);
        int to = Math.min(lastIndex, centerChunkIndex + span);
        List<DocumentChunk> result = new ArrayList<>();
        for (IndexedChunk indexed : chunks) {
            int index = indexed.chunk().getChunkIndex();
            if (index >= from && index <= to) {
                result.add(indexed.chunk());
            }
        }
        result.sort(Comparator.comparingInt(DocumentChunk::getChunkIndex));
        return result;
    }

    public List<CollectionSummary> listCollections() {
        return indexPort.listCollections().stream()
                .map(stats -> new CollectionSummary(stats.name(), stats.documentCount(),
                        collectionDescriptions.getOrDefault(stats.name(), "")))
                .toList();
    }

    public HealthReport healthCheck() {
        try {
            indexPort.ping();
            List<CollectionStats> stats = indexPort.listCollections();
            long documents = stats.stream().mapToLong(CollectionStats::documentCount).sum();
            long chunks = stats.stream().mapToLong(CollectionStats::chunkCount).sum();
            if (documents == 0) {
                return HealthReport.builder()
                        .status(HealthReport.Status.DEGRADED)
                        .details("index reachable but empty")
                        .build();
            }
            if (chunks < documents) {
                return HealthReport.builder()
                        .status(HealthReport.Status.DEGRADED)
                        .details("inconsistent index: " + documents + " documents but " + chunks + " chunks")
                        .build();
            }
            return HealthReport.builder()
                    .status(HealthReport.Status.OK)
                    .details(chunks + " chunks indexed across " + documents + " documents in "
                            + stats.size() + " collections")
                    .build();
        } catch (RuntimeException e) {
            log.warn("[Retriever] Health check failed: {}", e.getMessage());
            return HealthReport.builder()
                    .status(HealthReport.Status.ERROR)
                    .details(e.getMessage())
                    .build();
        }
    }

    private static Set<DocumentCollection> parseCollections(Collection<String> names) {
        Set<DocumentCollection> parsed = EnumSet.noneOf(DocumentCollection.class);
        if (names == null) {
            return parsed;
        }
        for (String name : names) {
            parsed.add(DocumentCollection.fromValue(name)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown collection: " + name)));
        }
        return parsed;
    }

    private static SearchResult toResult(ScoredChunk hit) {
        DocumentChunk chunk = hit.chunk();
        return SearchResult.builder()
                .chunkId(chunk.getChunkId())
                .documentId(chunk.getDocumentId())
                .chunkIndex(chunk.getChunkIndex())
                .text(chunk.getText())
                .score(hit.score())
                .metadata(chunk.toMetadataMap())
                .build();
    }
}
