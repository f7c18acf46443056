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

import java.util.Locale;
import java.util.Optional;

/**
 * Named partition of the document corpus.
 */
public enum DocumentCollection {

    DOCTRINE("doctrine"), AAR("aar"), SCENARIO("scenario"), INTEL("intel"), OTHER("other");

    private final String value;

    DocumentCollection(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static Optional<DocumentCollection> fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (DocumentCollection collection : values()) {
            if (collection.value.equals(normalized)) {
                return Optional.of(collection);
            }
        }
        return Optional.empty();
    }
}
