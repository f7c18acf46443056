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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.wargame.mcp.domain.model.MemoryHit;
import me.wargame.mcp.domain.model.MemoryRecord;
import me.wargame.mcp.infrastructure.config.WargameProperties;
import me.wargame.mcp.port.outbound.MemoryBackendPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodic maintenance of long-term memory: importance decay, TTL eviction and
 * merging of near-duplicates.
 *
 * <p>
 * Importance halves every {@code half-life-days} since the record was last
 * touched. Records older than {@code ttl-days} are deleted. Records of the same
 * user and scope scoring at least {@code merge-threshold} against each other are
 * merged into the one with higher importance (older on ties), with tags
 * unioned.
 */
@Service
@Slf4j
public class MemoryConsolidationService {

    private static final Comparator<MemoryRecord> SURVIVOR_ORDER = Comparator
            .comparingDouble(MemoryRecord::getImportance).reversed()
            .thenComparing(MemoryRecord::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(MemoryRecord::getMemoryId, Comparator.nullsLast(Comparator.naturalOrder()));

    private static final int MERGE_CANDIDATES = 10;

    private final MemoryBackendPort backend;
    private final MemoryGateway gateway;
    private final WargameProperties.ConsolidationProperties config;
    private final Clock clock;

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> consolidationTask;

    public MemoryConsolidationService(MemoryBackendPort backend, MemoryGateway gateway,
            WargameProperties properties, Clock clock) {
        this.backend = backend;
        this.gateway = gateway;
        this.config = properties.getMemory().getConsolidation();
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        if (!config.isEnabled()) {
            log.info("[Consolidation] Disabled");
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "memory-consolidation");
            t.setDaemon(true);
            return t;
        });
        long interval = config.getIntervalMinutes();
        consolidationTask = scheduler.scheduleAtFixedRate(this::tick, interval, interval, TimeUnit.MINUTES);
        log.info("[Consolidation] Started with interval: {}m", interval);
    }

    @PreDestroy
    public void shutdown() {
        if (consolidationTask != null) {
            consolidationTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("[Consolidation] Shut down");
    }

    void tick() {
        try {
            ConsolidationReport report = consolidateAll();
            log.info("[Consolidation] Run done: {} decayed, {} evicted, {} merged", report.decayed(),
                    report.evicted(), report.merged());
        } catch (RuntimeException e) {
            log.error("[Consolidation] Run failed", e);
        }
    }

    public ConsolidationReport consolidateAll() {
        ConsolidationReport total = ConsolidationReport.EMPTY;
        for (String userId : gateway.getKnownUsers()) {
            try {
                total = total.plus(consolidateUser(userId));
            } catch (RuntimeException e) {
                log.warn("[Consolidation] Skipping user {}: {}", userId, e.toString());
            }
        }
        return total;
    }

    public ConsolidationReport consolidateUser(String userId) {
        Instant now = clock.instant();
        List<MemoryRecord> records = backend.list(userId, config.getScanLimit(), null, Set.of(), null);

        int evicted = 0;
        int decayed = 0;
        List<MemoryRecord> alive = new ArrayList<>();
        Duration ttl = Duration.ofDays(config.getTtlDays());
        for (MemoryRecord record : records) {
            if (record.getMemoryId() == null) {
                log.debug("[Consolidation] Ignoring memory without id for user {}", userId);
                continue;
            }
            if (record.getCreatedAt() != null && record.getCreatedAt().plus(ttl).isBefore(now)) {
                backend.delete(record.getMemoryId(), null);
                evicted++;
                continue;
            }
            Instant lastTouch = record.getUpdatedAt() != null ? record.getUpdatedAt() : record.getCreatedAt();
            if (lastTouch != null && lastTouch.isBefore(now)) {
                record.setImportance(decay(record.getImportance(), Duration.between(lastTouch, now)));
                record.setUpdatedAt(now);
                backend.update(record, null);
                decayed++;
            }
            alive.add(record);
        }

        int merged = 0;
        Set<String> removed = new HashSet<>();
        alive.sort(SURVIVOR_ORDER);
        for (MemoryRecord survivor : alive) {
            if (removed.contains(survivor.getMemoryId())) {
                continue;
            }
            List<MemoryHit> candidates = backend.search(survivor.getMemory(), userId, MERGE_CANDIDATES,
                    EnumSet.of(survivor.getScope()), null);
            boolean changed = false;
            for (MemoryHit hit : candidates) {
                MemoryRecord other = hit.record();
                if (other == null || other.getMemoryId() == null || hit.score() < config.getMergeThreshold()
                        || other.getMemoryId().equals(survivor.getMemoryId())
                        || removed.contains(other.getMemoryId())) {
                    continue;
                }
                Set<String> tags = new LinkedHashSet<>(survivor.getTags());
                tags.addAll(other.getTags());
                survivor.setTags(new ArrayList<>(tags));
                survivor.setImportance(Math.max(survivor.getImportance(), other.getImportance()));
                backend.delete(other.getMemoryId(), null);
                removed.add(other.getMemoryId());
                merged++;
                changed = true;
                log.debug("[Consolidation] Merged {} into {} (score {})", other.getMemoryId(),
                        survivor.getMemoryId(), hit.score());
            }
            if (changed) {
                survivor.setUpdatedAt(now);
                backend.update(survivor, null);
            }
        }
        return new ConsolidationReport(decayed, evicted, merged);
    }

    double decay(double importance, Duration elapsed) {
        double days = elapsed.toMillis() / (double) Duration.ofDays(1).toMillis();
        return importance * Math.pow(0.5, days / config.getHalfLifeDays());
    }

    public record ConsolidationReport(int decayed, int evicted, int merged) {

        static final ConsolidationReport EMPTY = new ConsolidationReport(0, 0, 0);

        ConsolidationReport plus(ConsolidationReport other) {
            return new ConsolidationReport(decayed + other.decayed, evicted + other.evicted,
                    merged + other.merged);
        }
    }
}
