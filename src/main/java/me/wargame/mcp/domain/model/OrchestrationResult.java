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

import java.util.List;

/**
 * What a session returns to its caller. Always carries an explicit status.
 */
@Data
@Builder
public class OrchestrationResult {

    private String correlationId;
    private String userId;
    private SessionStatus status;
    private OrchestrationState state;
    private int iterations;
    private String message;
    private List<SessionToolResult> results;
    private List<ToolCallAttempt> attempts;

    public static OrchestrationResult from(OrchestrationSession session) {
        return OrchestrationResult.builder()
                .correlationId(session.getCorrelationId())
                .userId(session.getUserId())
                .status(session.getStatus())
                .state(session.getState())
                .iterations(session.getIterationCount())
                .message(session.getMessage())
                .results(List.copyOf(session.getAccumulatedResults()))
                .attempts(List.copyOf(session.getAttempts()))
                .build();
    }
}
