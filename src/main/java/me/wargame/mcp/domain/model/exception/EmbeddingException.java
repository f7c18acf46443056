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
 * Raised when the embedding provider fails or returns a mismatched vector count.
 */
public class EmbeddingException extends IngestionException {

    private static final long serialVersionUID = 1L;

    public EmbeddingException(String message) {
        super(IngestionStage.EMBED, message);
    }

    public EmbeddingException(String message, Throwable cause) {
        super(IngestionStage.EMBED, message, cause);
    }
}
