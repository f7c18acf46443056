package me.wargame.mcp.domain.model;

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

import lombok.Builder;
import lombok.Data;

/**
 * Outcome of a memory add. Quota and length violations are reported here
 * rather than thrown.
 */
@Data
@Builder
public class MemoryAddResult {

    public static final String REASON_QUOTA = "daily_quota_exceeded";
    public static final String REASON_TOO_LONG = "memory_too_long";

    public enum Status {
        CREATED("created"), DEDUPLICATED("deduplicated"), REJECTED_QUOTA("rejected_quota");

        private final String value;

        Status(String value) {
            this.value = value;
        }

        public String getValue() {
            return value;
        }
    }

    private String memoryId;
    private Status status;
    private String reason;

    public static MemoryAddResult created(String memoryId) {
        return MemoryAddResult.builder().memoryId(memoryId).status(Status.CREATED).build();
    }

    public static MemoryAddResult deduplicated(String memoryId) {
        return MemoryAddResult.builder().memoryId(memoryId).status(Status.DEDUPLICATED).build();
    }

    public static MemoryAddResult rejected(String reason) {
        return MemoryAddResult.builder().status(Status.REJECTED_QUOTA).reason(reason).build();
    }
}
