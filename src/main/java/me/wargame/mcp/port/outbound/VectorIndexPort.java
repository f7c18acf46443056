package me.wargame.mcp.port.outbound;

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

import me.wargame.mcp.domain.model.CollectionStats;
import me.wargame.mcp.domain.model.IndexFilter;
import me.wargame.mcp.domain.model.IndexedChunk;
import me.wargame.mcp.domain.model.ScoredChunk;

import java.util.List;

/**
 * Port for the vector index storage engine.
 */
public interface VectorIndexPort {

    /**
     * Atomically replaces every chunk previously stored for {@code sourcePath} or
     * {@code documentId} with {@code chunks}. Concurrent readers see either the
     * old set or the new set, never a mix.
     *
     * @return number of superseded chunks removed
     */
    int replaceDocument(String sourcePath, String documentId, List<IndexedChunk> chunks);

    /**
     * @return number of chunks removed
     */
    int deleteDocument(String documentId);

    /**
     * Nearest-neighbour query. Hits are scored in [0, 1] and returned best first.
     */
    List<ScoredChunk> query(float[] vector, IndexFilter filter, int topK, String correlationId);

    /**
     * All chunks of one document ordered by chunk index; empty when unknown.
     */
    List<IndexedChunk> getDocumentChunks(String documentId);

    List<CollectionStats> listCollections();

    /**
     * @throws IllegalStateException
     *             when the index cannot be reached
     */
    void ping();
}
