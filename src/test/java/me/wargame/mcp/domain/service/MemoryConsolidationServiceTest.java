package me.wargame.mcp.domain.service;

import me.wargame.mcp.adapter.outbound.embedding.DeterministicEmbeddingAdapter;
import me.wargame.mcp.adapter.outbound.memory.LocalMemoryAdapter;
import me.wargame.mcp.domain.model.MemoryHit;
import me.wargame.mcp.domain.model.MemoryRecord;
import me.wargame.mcp.domain.model.MemoryScope;
import me.wargame.mcp.domain.model.SimilarityMetric;
import me.wargame.mcp.domain.model.exception.MemoryBackendException;
import me.wargame.mcp.infrastructure.config.WargameProperties;
import me.wargame.mcp.port.outbound.MemoryBackendPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MemoryConsolidationServiceTest {

    private static final String USER_ID = "analyst-1";
    private static final Instant NOW = Instant.parse("2026-06-01T00:00:00Z");

    private WargameProperties properties;
    private LocalMemoryAdapter backend;
    private MemoryGateway gateway;
    private MemoryConsolidationService service;

    @BeforeEach
    void setUp() {
        properties = new WargameProperties();
        properties.getMemory().getConsolidation().setEnabled(false);
        properties.getMemory().getConsolidation().setTtlDays(180);
        properties.getMemory().getConsolidation().setHalfLifeDays(30);
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        backend = new LocalMemoryAdapter(new DeterministicEmbeddingAdapter(256), SimilarityMetric.COSINE);
        gateway = new MemoryGateway(backend, new MemoryQuotaTracker(properties, clock), properties, clock);
        service = new MemoryConsolidationService(backend, gateway, properties, clock);
    }

    private MemoryRecord store(String memory, Instant createdAt, double importance, List<String> tags) {
        return backend.add(MemoryRecord.builder()
                .userId(USER_ID)
                .scope(MemoryScope.USER)
                .memory(memory)
                .tags(new ArrayList<>(tags))
                .importance(importance)
                .createdAt(createdAt)
                .updatedAt(createdAt)
                .build(), null);
    }

    private List<MemoryRecord> remaining() {
        return backend.list(USER_ID, 100, null, Set.of(), null);
    }

    @Test
    void shouldHalveImportanceAfterOneHalfLife() {
        store("supply lines are fragile", NOW.minus(Duration.ofDays(30)), 1.0, List.of());

        MemoryConsolidationService.ConsolidationReport report = service.consolidateUser(USER_ID);

        assertEquals(1, report.decayed());
        MemoryRecord record = remaining().get(0);
        assertEquals(0.5, record.getImportance(), 1e-9);
        assertEquals(NOW, record.getUpdatedAt());
    }

    @Test
    void shouldEvictRecordsPastTtl() {
        store("obsolete order of battle", NOW.minus(Duration.ofDays(181)), 1.0, List.of());
        store("current order of battle", NOW.minus(Duration.ofDays(10)), 1.0, List.of());

        MemoryConsolidationService.ConsolidationReport report = service.consolidateUser(USER_ID);

        assertEquals(1, report.evicted());
        assertEquals(List.of("current order of battle"),
                remaining().stream().map(MemoryRecord::getMemory).toList());
    }

    @Test
    void shouldMergeNearDuplicatesIntoMoreImportantRecord() {
        MemoryRecord keeper = store("enemy artillery displaces at dawn", NOW, 0.9, List.of("artillery"));
        store("Enemy artillery displaces at dawn", NOW, 0.4, List.of("dawn"));
        store("friendly air cover is limited", NOW, 1.0, List.of());

        MemoryConsolidationService.ConsolidationReport report = service.consolidateUser(USER_ID);

        assertEquals(1, report.merged());
        List<MemoryRecord> records = remaining();
        assertEquals(2, records.size());
        MemoryRecord merged = records.stream()
                .filter(r -> r.getMemoryId().equals(keeper.getMemoryId()))
                .findFirst()
                .orElseThrow();
        assertEquals(List.of("artillery", "dawn"), merged.getTags());
        assertEquals(0.9, merged.getImportance(), 1e-9);
    }

    @Test
    void shouldComputeExponentialDecay() {
        assertEquals(1.0, service.decay(1.0, Duration.ZERO), 1e-9);
        assertEquals(0.25, service.decay(1.0, Duration.ofDays(60)), 1e-9);
    }

    @Test
    void shouldConsolidateKnownUsersAndSkipFailingBackend() {
        gateway.add(USER_ID, null, "known user note", List.of(), null, null);
        MemoryBackendPort failing = mock(MemoryBackendPort.class);
        when(failing.list(eq(USER_ID), anyInt(), any(), any(), any()))
                .thenThrow(new MemoryBackendException("backend down"));
        MemoryConsolidationService failingService = new MemoryConsolidationService(failing, gateway, properties,
                Clock.fixed(NOW, ZoneOffset.UTC));

        MemoryConsolidationService.ConsolidationReport report = failingService.consolidateAll();

        assertEquals(new MemoryConsolidationService.ConsolidationReport(0, 0, 0), report);
        assertEquals(Set.of(USER_ID), gateway.getKnownUsers());
    }

    @Test
    void shouldIgnoreSearchHitsWithoutMemoryId() {
        MemoryRecord survivor = MemoryRecord.builder()
                .memoryId("m-1").userId(USER_ID).scope(MemoryScope.USER)
                .memory("bridge at grid 4411 is down").tags(new ArrayList<>(List.of("bridge")))
                .importance(0.8).createdAt(NOW).updatedAt(NOW)
                .build();
        MemoryRecord idless = MemoryRecord.builder()
                .userId(USER_ID).scope(MemoryScope.USER)
                .memory("bridge at grid 4411 is down").tags(new ArrayList<>(List.of("remote")))
                .importance(1.0)
                .build();
        MemoryRecord duplicate = MemoryRecord.builder()
                .memoryId("m-2").userId(USER_ID).scope(MemoryScope.USER)
                .memory("Bridge at grid 4411 is down").tags(new ArrayList<>(List.of("engineer")))
                .importance(0.3).createdAt(NOW).updatedAt(NOW)
                .build();
        MemoryBackendPort remote = mock(MemoryBackendPort.class);
        when(remote.list(eq(USER_ID), anyInt(), any(), any(), any()))
                .thenReturn(new ArrayList<>(List.of(survivor, idless)));
        when(remote.search(any(), eq(USER_ID), anyInt(), any(), any()))
                .thenReturn(List.of(new MemoryHit(idless, 0.99), new MemoryHit(duplicate, 0.98)));
        MemoryConsolidationService remoteService = new MemoryConsolidationService(remote, gateway, properties,
                Clock.fixed(NOW, ZoneOffset.UTC));

        MemoryConsolidationService.ConsolidationReport report = remoteService.consolidateUser(USER_ID);

        assertEquals(1, report.merged());
        assertEquals(0, report.evicted());
        assertEquals(List.of("bridge", "engineer"), survivor.getTags());
        verify(remote).delete(eq("m-2"), isNull());
        verify(remote, never()).delete(isNull(), any());
        verify(remote, never()).update(eq(idless), any());
    }

    @Test
    void shouldKeepConsolidatingOtherUsersAfterUnexpectedFailure() {
        gateway.add(USER_ID, null, "known user note", List.of(), null, null);
        gateway.add("analyst-2", null, "second user note", List.of(), null, null);
        MemoryRecord stale = MemoryRecord.builder()
                .memoryId("m-9").userId(USER_ID).scope(MemoryScope.USER)
                .memory("convoy schedule").tags(new ArrayList<>())
                .importance(1.0).createdAt(NOW.minus(Duration.ofDays(30))).updatedAt(NOW.minus(Duration.ofDays(30)))
                .build();
        MemoryBackendPort flaky = mock(MemoryBackendPort.class);
        when(flaky.list(eq("analyst-2"), anyInt(), any(), any(), any()))
                .thenThrow(new NullPointerException("memory_id"));
        when(flaky.list(eq(USER_ID), anyInt(), any(), any(), any()))
                .thenReturn(new ArrayList<>(List.of(stale)));
        when(flaky.search(any(), any(), anyInt(), any(), any())).thenReturn(List.of());
        MemoryConsolidationService flakyService = new MemoryConsolidationService(flaky, gateway, properties,
                Clock.fixed(NOW, ZoneOffset.UTC));

        MemoryConsolidationService.ConsolidationReport report = flakyService.consolidateAll();

        assertEquals(new MemoryConsolidationService.ConsolidationReport(1, 0, 0), report);
        assertEquals(0.5, stale.getImportance(), 1e-9);
    }
}
