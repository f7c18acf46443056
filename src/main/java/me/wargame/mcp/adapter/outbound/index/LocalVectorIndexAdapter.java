package me.wargame.mcp.adapter.outbound.index;

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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import me.wargame.mcp.domain.model.CollectionStats;
import me.wargame.mcp.domain.model.DocumentChunk;
import me.wargame.mcp.domain.model.DocumentCollection;
import me.wargame.mcp.domain.model.IndexFilter;
import me.wargame.mcp.domain.model.IndexedChunk;
import me.wargame.mcp.domain.model.ScoredChunk;
import me.wargame.mcp.domain.model.SimilarityMetric;
import me.wargame.mcp.domain.model.exception.IndexUpsertException;
import me.wargame.mcp.infrastructure.config.WargameProperties;
import me.wargame.mcp.port.outbound.VectorIndexPort;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-process vector index with exhaustive scoring.
 *
 * <p>
 * Writes take the write lock for the whole delete-then-insert of a document,
 * so queries never observe a partially replaced document. When
 * {@code wargame.index.snapshot-path} is set the index is loaded from that JSON
 * file on startup and rewritten after every change; a change whose snapshot
 * cannot be written is undone. Replacing a document with no chunks removes it.
 */
@Component
@Slf4j
public class LocalVectorIndexAdapter implements VectorIndexPort {

    static final Comparator<ScoredChunk> RANKING = Comparator
            .comparingDouble(ScoredChunk::score).reversed()
            .thenComparingInt((ScoredChunk hit) -> hit.chunk().getChunkIndex())
            .thenComparing((ScoredChunk hit) -> hit.chunk().getDocumentId());

    private final SimilarityMetric metric;
    private final Path snapshotPath;
    private final ObjectMapper objectMapper;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final Map<String, List<IndexedChunk>> chunksByDocument = new LinkedHashMap<>();
    private final Map<String, String> documentBySource = new HashMap<>();

    @Autowired
    public LocalVectorIndexAdapter(WargameProperties properties, ObjectMapper objectMapper) {
        this(SimilarityMetric.fromName(properties.getRetrieval().getSimilarityMetric()),
                toPath(properties.getIndex().getSnapshotPath()), objectMapper);
    }

    public LocalVectorIndexAdapter(SimilarityMetric metric, Path snapshotPath, ObjectMapper objectMapper) {
        this.metric = metric;
        this.snapshotPath = snapshotPath;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void init() {
        if (snapshotPath == null || !Files.isRegularFile(snapshotPath)) {
            return;
        }
        try {
            List<IndexedChunk> stored = objectMapper.readValue(snapshotPath.toFile(),
                    new TypeReference<List<IndexedChunk>>() {
                    });
            lock.writeLock().lock();
            try {
                for (IndexedChunk indexed : stored) {
                    DocumentChunk chunk = indexed.chunk();
                    chunksByDocument.computeIfAbsent(chunk.getDocumentId(), id -> new ArrayList<>()).add(indexed);
                    if (chunk.getMetadata() != null && chunk.getMetadata().getSourcePath() != null) {
                        documentBySource.put(chunk.getMetadata().getSourcePath(), chunk.getDocumentId());
                    }
                }
                chunksByDocument.values()
                        .forEach(list -> list.sort(Comparator.comparingInt(c -> c.chunk().getChunkIndex())));
            } finally {
                lock.writeLock().unlock();
            }
            log.info("[Index] Loaded {} chunks of {} documents from {}", stored.size(), chunksByDocument.size(),
                    snapshotPath);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot load index snapshot " + snapshotPath, e);
        }
    }

    @Override
    public int replaceDocument(String sourcePath, String documentId, List<IndexedChunk> chunks) {
        for (IndexedChunk indexed : chunks) {
            if (!documentId.equals(indexed.chunk().getDocumentId())) {
                throw new IndexUpsertException("Chunk " + indexed.chunk().getChunkId()
                        + " does not belong to document " + documentId);
            }
        }
        lock.writeLock().lock();
        try {
            Map<String, List<IndexedChunk>> chunksBefore = new LinkedHashMap<>(chunksByDocument);
            Map<String, String> sourcesBefore = new HashMap<>(documentBySource);
            int removed = removeLocked(documentId);
            String previous = sourcePath != null ? documentBySource.get(sourcePath) : null;
            if (previous != null && !previous.equals(documentId)) {
                removed += removeLocked(previous);
            }
            List<IndexedChunk> sorted = new ArrayList<>(chunks);
            sorted.sort(Comparator.comparingInt(c -> c.chunk().getChunkIndex()));
            if (!sorted.isEmpty()) {
                chunksByDocument.put(documentId, sorted);
                if (sourcePath != null) {
                    documentBySource.put(sourcePath, documentId);
                }
            }
            persistOrRollbackLocked(chunksBefore, sourcesBefore);
            log.debug("[Index] Replaced {}: -{} +{} chunks", documentId, removed, sorted.size());
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int deleteDocument(String documentId) {
        lock.writeLock().lock();
        try {
            Map<String, List<IndexedChunk>> chunksBefore = new LinkedHashMap<>(chunksByDocument);
            Map<String, String> sourcesBefore = new HashMap<>(documentBySource);
            int removed = removeLocked(documentId);
            if (removed > 0) {
                persistOrRollbackLocked(chunksBefore, sourcesBefore);
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<ScoredChunk> query(float[] vector, IndexFilter filter, int topK, String correlationId) {
        IndexFilter effective = filter != null ? filter : IndexFilter.none();
        List<ScoredChunk> hits = new ArrayList<>();
        lock.readLock().lock();
        try {
            for (List<IndexedChunk> chunks : chunksByDocument.values()) {
                for (IndexedChunk indexed : chunks) {
                    if (effective.accepts(indexed.chunk())) {
                        hits.add(new ScoredChunk(indexed.chunk(), metric.score(vector, indexed.vector())));
                    }
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        hits.sort(RANKING);
        log.debug("[Index] Query scored {} chunks (correlation={})", hits.size(), correlationId);
        return hits.size() > topK ? new ArrayList<>(hits.subList(0, topK)) : hits;
    }

    @Override
    public List<IndexedChunk> getDocumentChunks(String documentId) {
        lock.readLock().lock();
        try {
            List<IndexedChunk> chunks = chunksByDocument.get(documentId);
            return chunks != null ? List.copyOf(chunks) : List.of();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<CollectionStats> listCollections() {
        Map<DocumentCollection, Set<String>> documents = new TreeMap<>();
        Map<DocumentCollection, Integer> chunkCounts = new TreeMap<>();
        lock.readLock().lock();
        try {
            for (Map.Entry<String, List<IndexedChunk>> entry : chunksByDocument.entrySet()) {
                for (IndexedChunk indexed : entry.getValue()) {
                    DocumentCollection collection = indexed.chunk().getMetadata() != null
                            ? indexed.chunk().getMetadata().getCollection()
                            : DocumentCollection.OTHER;
                    documents.computeIfAbsent(collection, c -> new HashSet<>()).add(entry.getKey());
                    chunkCounts.merge(collection, 1, Integer::sum);
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        List<CollectionStats> stats = new ArrayList<>();
        for (Map.Entry<DocumentCollection, Set<String>> entry : documents.entrySet()) {
            stats.add(new CollectionStats(entry.getKey().getValue(), entry.getValue().size(),
                    chunkCounts.getOrDefault(entry.getKey(), 0)));
        }
        return stats;
    }

    @Override
    public void ping() {
        if (snapshotPath != null && snapshotPath.getParent() != null && !Files.isDirectory(snapshotPath.getParent())) {
            throw new IllegalStateException("Snapshot directory missing: " + snapshotPath.getParent());
        }
    }

    private int removeLocked(String documentId) {
        List<IndexedChunk> removed = chunksByDocument.remove(documentId);
        if (removed == null) {
            return 0;
        }
        documentBySource.values().removeIf(documentId::equals);
        return removed.size();
    }

    /**
     * Writes the snapshot; if that fails the in-memory state is put back to
     * {@code chunksBefore}/{@code sourcesBefore} before the error propagates.
     */
    private void persistOrRollbackLocked(Map<String, List<IndexedChunk>> chunksBefore,
            Map<String, String> sourcesBefore) {
        try {
            persistLocked();
        } catch (IndexUpsertException e) {
            chunksByDocument.clear();
            chunksByDocument.putAll(chunksBefore);
            documentBySource.clear();
            documentBySource.putAll(sourcesBefore);
            log.warn("[Index] Snapshot write failed, change rolled back: {}", e.getMessage());
            throw e;
        }
    }

    private void persistLocked() {
        if (snapshotPath == null) {
            return;
        }
        List<IndexedChunk> all = new ArrayList<>();
        chunksByDocument.values().forEach(all::addAll);
        try {
            if (snapshotPath.getParent() != null) {
                Files.createDirectories(snapshotPath.getParent());
            }
            Path tmp = snapshotPath.resolveSibling(snapshotPath.getFileName() + ".tmp");
            objectMapper.writeValue(tmp.toFile(), all);
            Files.move(tmp, snapshotPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new IndexUpsertException("Cannot write index snapshot " + snapshotPath, e);
        }
    }

    private static Path toPath(String value) {
        return value == null || value.isBlank() ? null : Path.of(value);
    }
}
