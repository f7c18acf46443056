package me.wargame.mcp.domain.service;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MemoryQuotaTrackerTest {

    private static final Instant MORNING = Instant.parse("2026-03-01T08:00:00Z");
    private static final Instant NEXT_DAY = Instant.parse("2026-03-02T00:00:01Z");

    @Test
    void shouldAllowUpToQuotaPerUserPerDay() {
        MemoryQuotaTracker tracker = new MemoryQuotaTracker(2, Clock.fixed(MORNING, ZoneOffset.UTC));

        assertTrue(tracker.tryReserve("u1"));
        assertTrue(tracker.tryReserve("u1"));
        assertFalse(tracker.tryReserve("u1"));
        assertTrue(tracker.tryReserve("u2"));
        assertEquals(2, tracker.getUsedToday("u1"));
        assertEquals(1, tracker.getUsedToday("u2"));
    }

    @Test
    void shouldStartFreshOnNewUtcDay() {
        MemoryQuotaTracker today = new MemoryQuotaTracker(1, Clock.fixed(MORNING, ZoneOffset.UTC));
        assertTrue(today.tryReserve("u1"));
        assertFalse(today.tryReserve("u1"));

        MemoryQuotaTracker tomorrow = new MemoryQuotaTracker(1, Clock.fixed(NEXT_DAY, ZoneOffset.UTC));

        assertTrue(tomorrow.tryReserve("u1"));
        assertEquals(0, today.getUsedToday("u2"));
    }

    @Test
    void shouldNeverOverReserveUnderContention() throws Exception {
        MemoryQuotaTracker tracker = new MemoryQuotaTracker(50, Clock.fixed(MORNING, ZoneOffset.UTC));
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Boolean>> tasks = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                tasks.add(() -> tracker.tryReserve("u1"));
            }
            int reserved = 0;
            for (Future<Boolean> future : pool.invokeAll(tasks)) {
                if (future.get()) {
                    reserved++;
                }
            }
            assertEquals(50, reserved);
            assertEquals(50, tracker.getUsedToday("u1"));
        } finally {
            pool.shutdownNow();
        }
    }
}
