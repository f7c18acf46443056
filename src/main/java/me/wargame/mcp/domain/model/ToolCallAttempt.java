package me.wargame.mcp.domain.model;

import java.time.Duration;

/**
 * One physical attempt at a tool call within a session.
 */
public record ToolCallAttempt(String toolName, int attemptNumber, Outcome outcome, Duration latency) {

    public enum Outcome {
        SUCCESS, ERROR, TIMEOUT, SKIPPED
    }
}
