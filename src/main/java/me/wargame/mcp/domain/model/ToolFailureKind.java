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

/**
 * Machine-readable classification of tool execution failures.
 *
 * <p>
 * This exists to avoid relying on string matching in tool error messages. Only
 * {@link #EXECUTION_FAILED} and {@link #TIMEOUT} are retried and counted by the
 * circuit breaker.
 */
public enum ToolFailureKind {

    /**
     * Arguments missing or malformed. Retrying cannot help.
     */
    INVALID_ARGUMENTS,

    /**
     * No tool is registered under the requested name.
     */
    UNKNOWN_TOOL,

    /**
     * Runtime failure talking to a backend (network error, HTTP error, bad
     * payload).
     */
    EXECUTION_FAILED,

    /**
     * The call did not complete within its time budget.
     */
    TIMEOUT,

    /**
     * The call was skipped because the tool's circuit is open.
     */
    CIRCUIT_OPEN;

    public boolean isRetryable() {
        return this == EXECUTION_FAILED || this == TIMEOUT;
    }
}
