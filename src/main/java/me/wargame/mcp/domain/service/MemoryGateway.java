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
import me.wargame.mcp.domain.model.MemoryAddResult;
import me.wargame.mcp.domain.model.MemoryDeleteStatus;
import me.wargame.mcp.domain.model.MemoryHit;
import me.wargame.mcp.domain.model.MemoryRecord;
import me.wargame.mcp.domain.model.MemoryScope;
import me.wargame.mcp.infrastructure.config.WargameProperties;
import me.wargame.mcp.port.outbound.MemoryBackendPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Long-term memory facade in front of the memory backend.
 *
 * <p>
 * Writes go through a length check, a similarity-based duplicate check and the
 * per-user daily quota. Quota and length violations are returned as
 * {@link MemoryAddResult.Status#REJECTED_QUOTA}, not thrown. The duplicate
 * check and the insert run under the user's lock stripe so two concurrent adds
 * of the same text cannot both be created. The stripe count is fixed, so the
 * lock table does not grow with the number of users.
 */
@Service
@Slf4j
public class MemoryGateway {

    private static final Comparator<MemoryHit> HIT_ORDER = Comparator
            .comparingDouble(MemoryHit::score).reversed()
            .thenComparing(hit -> hit.record().getMemoryId(), Comparator.nullsLast(Comparator.naturalOrder()));

    static final int LOCK_STRIPES = 64;

    private final MemoryBackendPort backend;
    private final MemoryQuotaTracker quotaTracker;
    private final WargameProperties.MemoryProperties config;
    private final Clock clock;

    private final Object[] userLocks = new Object[LOCK_STRIPES];
    private final Set<String> knownUsers = ConcurrentHashMap.newKeySet();

    public MemoryGateway(MemoryBackendPort backend, MemoryQuotaTracker quotaTracker, WargameProperties properties,
            Clock clock) {
        this.backend = backend;
        this.quotaTracker = quotaTracker;
        this.config = properties.getMemory();
        this.clock = clock;
        for (int i = 0; i < userLocks.length; i++) {
            userLocks[i] = new Object();
        }
    }

    public MemoryAddResult add(String userId, String scope, String memory, Collection<String> tags, String source,
            String correlationId) {
        requireText(userId, "user_id");
        requireText(memory, "memory");
        MemoryScope resolvedScope = parseScope(scope != null ? scope : config.getDefaultScope());
        knownUsers.add(userId);

        String text = memory.trim();
        if (text.length() > config.getMaxLength()) {
            log.debug("[Memory] Rejected {} chars for user {} (max {})", text.length(), userId,
                    config.getMaxLength());
            return MemoryAddResult.rejected(MemoryAddResult.REASON_TOO_LONG);
        }

        synchronized (lockFor(userId)) {
            Set<MemoryScope> dedupScopes = config.isDedupWithinScope() ? EnumSet.of(resolvedScope) : Set.of();
            List<MemoryHit> similar = backend.search(text, userId, 1, dedupScopes, correlationId);
            if (!similar.isEmpty() && similar.get(0).score() >= config.getDedupThreshold()) {
                String existingId = similar.get(0).record().getMemoryId();
                log.debug("[Memory] Duplicate of {} (score {})", existingId, similar.get(0).score());
                return MemoryAddResult.deduplicated(existingId);
            }

            if (!quotaTracker.tryReserve(userId)) {
                return MemoryAddResult.rejected(MemoryAddResult.REASON_QUOTA);
            }

            Instant now = clock.instant();
            MemoryRecord record = MemoryRecord.builder()
                    .userId(userId)
                    .scope(resolvedScope)
                    .memory(text)
                    .tags(MetadataResolver.mergeTags(List.of(tags != null ? tags : List.of())))
                    .source(source)
                    .importance(config.getInitialImportance())
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            MemoryRecord stored = backend.add(record, correlationId);
            log.info("[Memory] Created {} for user {} in scope {}", stored.getMemoryId(), userId,
                    resolvedScope.getValue());
            return MemoryAddResult.created(stored.getMemoryId());
        }
    }

    public List<MemoryHit> search(String query, String userId, int limit, Collection<String> scopes,
            String correlationId) {
        requireText(query, "query");
        requireText(userId, "user_id");
        requireLimit(limit);
        knownUsers.add(userId);
        List<MemoryHit> hits = backend.search(query, userId, limit, parseScopes(scopes), correlationId);
        return hits.stream().sorted(HIT_ORDER).limit(limit).toList();
    }

    public MemoryDeleteStatus delete(String memoryId, String correlationId) {
        requireText(memoryId, "memory_id");
        boolean deleted = backend.delete(memoryId, correlationId);
        log.debug("[Memory] Delete {}: {}", memoryId, deleted ? "deleted" : "not found");
        return deleted ? MemoryDeleteStatus.DELETED : MemoryDeleteStatus.NOT_FOUND;
    }

    /**
     * Lists a user's memories, newest first. A record matches {@code tags} when
     * it carries any of them.
     */
    public List<MemoryRecord> list(String userId, int limit, String scope, Collection<String> tags,
            String correlationId) {
        requireText(userId, "user_id");
        requireLimit(limit);
        knownUsers.add(userId);
        MemoryScope resolvedScope = scope != null ? parseScope(scope) : null;
        Set<String> tagSet = tags != null ? new LinkedHashSet<>(MetadataResolver.mergeTags(List.of(tags)))
                : Set.of();
        return backend.list(userId, limit, resolvedScope, tagSet, correlationId);
    }

    public Set<String> getKnownUsers() {
        return Set.copyOf(knownUsers);
    }

    Object lockFor(String userId) {
        return userLocks[Math.floorMod(userId.hashCode(), userLocks.length)];
    }

    private static MemoryScope parseScope(String scope) {
        return MemoryScope.fromValue(scope)
                .orElseThrow(() -> new IllegalArgumentException("Unknown scope: " + scope));
    }

    private static Set<MemoryScope> parseScopes(Collection<String> scopes) {
        Set<MemoryScope> parsed = EnumSet.noneOf(MemoryScope.class);
        if (scopes != null) {
            scopes.forEach(scope -> parsed.add(parseScope(scope)));
        }
        return parsed;
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
    }

    private static void requireLimit(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1, got " + limit);
        }
    }
}
