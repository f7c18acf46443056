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
import me.wargame.mcp.infrastructure.config.WargameProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-user daily counter of memory writes.
 *
 * <p>
 * Reservations are taken atomically per user with
 * {@link ConcurrentHashMap#compute}; the count only grows within a day and is
 * reset when the (clock's UTC) date changes. A reservation is never released,
 * even if the write that follows fails.
 */
@Component
@Slf4j
public class MemoryQuotaTracker {

    private final Map<String, DailyCount> counts = new ConcurrentHashMap<>();
    private final Clock clock;
    private final int dailyQuota;

    public MemoryQuotaTracker(WargameProperties properties, Clock clock) {
        this(properties.getMemory().getDailyQuota(), clock);
    }

    public MemoryQuotaTracker(int dailyQuota, Clock clock) {
        this.dailyQuota = dailyQuota;
        this.clock = clock;
    }

    /**
     * @return true if a slot was reserved, false if the user's quota for today
     *         is used up
     */
    public boolean tryReserve(String userId) {
        LocalDate today = LocalDate.now(clock);
        AtomicBoolean reserved = new AtomicBoolean(false);
        counts.compute(userId, (key, existing) -> {
            DailyCount current = existing == null || !existing.day().equals(today)
                    ? new DailyCount(today, 0)
                    : existing;
            if (current.count() >= dailyQuota) {
                return current;
            }
            reserved.set(true);
            return new DailyCount(today, current.count() + 1);
        });
        if (!reserved.get()) {
            log.debug("[Memory] Daily quota of {} reached for user {}", dailyQuota, userId);
        }
        return reserved.get();
    }

    public int getUsedToday(String userId) {
        DailyCount count = counts.get(userId);
        return count != null && count.day().equals(LocalDate.now(clock)) ? count.count() : 0;
    }

    public int getDailyQuota() {
        return dailyQuota;
    }

    private record DailyCount(LocalDate day, int count) {
    }
}
