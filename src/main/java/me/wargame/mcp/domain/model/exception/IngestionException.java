package me.wargame.mcp.domain.model.exception;

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

import me.wargame.mcp.domain.model.IngestionStage;

/**
 * Base class for per-document ingestion failures. Always caught by the
 * ingestor and reported in the batch summary; never aborts a batch.
 */
public class IngestionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final IngestionStage stage;

    public IngestionException(IngestionStage stage, String message) {
        super(message);
        this.stage = stage;
    }

    public IngestionException(IngestionStage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public IngestionStage getStage() {
        return stage;
    }
}
