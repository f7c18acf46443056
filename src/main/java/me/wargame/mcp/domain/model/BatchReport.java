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

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one ingestion batch. Always produced, even when every document
 * failed.
 */
@Data
@Builder
public class BatchReport {

    @Builder.Default
    private List<IngestedDocument> succeeded = new ArrayList<>();

    @Builder.Default
    private List<FailedDocument> failed = new ArrayList<>();

    @Builder.Default
    private List<DocumentWarning> warnings = new ArrayList<>();

    private Instant startedAt;
    private Instant finishedAt;

    public int getSucceededCount() {
        return succeeded.size();
    }

    public int getFailedCount() {
        return failed.size();
    }

    public int getChunkCount() {
        return succeeded.stream().mapToInt(IngestedDocument::chunkCount).sum();
    }

    public long getTokenCount() {
        return succeeded.stream().mapToLong(IngestedDocument::tokenCount).sum();
    }

    public static BatchReport merge(BatchReport first, BatchReport second) {
        BatchReport merged = BatchReport.builder()
                .startedAt(first.getStartedAt())
                .finishedAt(second.getFinishedAt())
                .build();
        merged.getSucceeded().addAll(first.getSucceeded());
        merged.getSucceeded().addAll(second.getSucceeded());
        merged.getFailed().addAll(first.getFailed());
        merged.getFailed().addAll(second.getFailed());
        merged.getWarnings().addAll(first.getWarnings());
        merged.getWarnings().addAll(second.getWarnings());
        return merged;
    }

    public record IngestedDocument(String path, String documentId, int chunkCount, long tokenCount) {
    }

    public record FailedDocument(String path, IngestionStage stage, String reason) {
    }

    public record DocumentWarning(String path, String field, String message) {
    }
}
