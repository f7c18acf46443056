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

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Binds a correlation id to the SLF4J MDC for the duration of a call.
 */
public final class CorrelationSupport {

    public static final String MDC_KEY = "correlationId";
    public static final String HEADER = "X-Correlation-ID";

    private CorrelationSupport() {
    }

    /**
     * @return a handle that removes the binding when closed
     */
    public static MDC.MDCCloseable bind(String correlationId) {
        return MDC.putCloseable(MDC_KEY, correlationId != null ? correlationId : "-");
    }

    public static String orNew(String correlationId) {
        return correlationId != null && !correlationId.isBlank() ? correlationId : UUID.randomUUID().toString();
    }
}
