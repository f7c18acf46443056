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
 * Doctrinal family a document belongs to.
 */
public enum Doctrine {

    NATO("nato"), US_JOINT("us-joint"), US_ARMY("us-army"), USMC("usmc"), UK("uk"), RUSSIAN("russian"),
    CHINESE("chinese"), OTHER("other");

    private final String value;

    Doctrine(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Accepts "us_army", "US Army" and "us-army" alike.
     */
    public static Optional<Doctrine> fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-').replace(' ', '-');
        for (Doctrine doctrine : values()) {
            if (doctrine.value.equals(normalized)) {
                return Optional.of(doctrine);
            }
        }
        return Optional.empty();
    }
}
