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

import me.wargame.mcp.domain.model.MemoryHit;
import me.wargame.mcp.domain.model.MemoryRecord;
import me.wargame.mcp.domain.model.MemoryScope;

import java.util.List;
import java.util.Set;

/**
 * Port for the long-term memory storage engine.
 *
 * <p>
 * Implementations throw
 * {@link me.wargame.mcp.domain.model.exception.MemoryBackendException} on
 * transport or protocol failures.
 */
public interface MemoryBackendPort {

    /**
     * Similarity search restricted to one user and, when non-empty, to the given
     * scopes.
     */
    List<MemoryHit> search(String query, String userId, int limit, Set<MemoryScope> scopes, String correlationId);

    /**
     * Stores a new record and returns it with its assigned id.
     */
    MemoryRecord add(MemoryRecord record, String correlationId);

    /**
     * Overwrites memory text, tags, importance and touch time of an existing
     * record.
     */
    MemoryRecord update(MemoryRecord record, String correlationId);

    /**
     * @return true if the record existed
     */
    boolean delete(String memoryId, String correlationId);

    /**
     * Newest first.
     */
    List<MemoryRecord> list(String userId, int limit, MemoryScope scope, Set<String> tags, String correlationId);
}
