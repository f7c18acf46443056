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

import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Per-invocation state of the tool loop. Confined to the thread running the
 * session.
 */
@Data
public class OrchestrationSession {

    private final String correlationId;
    private final String userId;
    private final String question;
    private final Instant startedAt;

    private int iterationCount;
    private OrchestrationState state = OrchestrationState.ITERATING;
    private SessionStatus status = SessionStatus.RUNNING;
    private String message;

    private final List<SessionToolResult> accumulatedResults = new ArrayList<>();
    private final List<ToolCallAttempt> attempts = new ArrayList<>();
    private final Set<String> resolvedTools = new LinkedHashSet<>();

    public OrchestrationSession(String correlationId, String userId, String question, Instant startedAt) {
        this.correlationId = correlationId;
        this.userId = userId;
        this.question = question;
        this.startedAt = startedAt;
    }

    public void addResult(SessionToolResult result) {
        accumulatedResults.add(result);
    }

    public void recordAttempt(ToolCallAttempt attempt) {
        attempts.add(attempt);
    }

    /**
     * Marks a requested tool as settled (succeeded, exhausted its retries, or ran
     * through a fallback) so the driver moves on.
     */
    public void markResolved(String toolName) {
        resolvedTools.add(toolName);
    }

    public boolean isResolved(String toolName) {
        return resolvedTools.contains(toolName);
    }

    public List<SessionToolResult> getAccumulatedResults() {
        return Collections.unmodifiableList(accumulatedResults);
    }

    public List<ToolCallAttempt> getAttempts() {
        return Collections.unmodifiableList(attempts);
    }
}
