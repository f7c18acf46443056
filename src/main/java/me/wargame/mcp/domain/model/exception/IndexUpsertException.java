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
 * Raised when the vector index rejects a document replace.
 */
public class IndexUpsertException extends IngestionException {

    private static final long serialVersionUID = 1L;

    public IndexUpsertException(String message) {
        super(IngestionStage.INDEX, message);
    }

    public IndexUpsertException(String message, Throwable cause) {
        super(IngestionStage.INDEX, message, cause);
    }
}
