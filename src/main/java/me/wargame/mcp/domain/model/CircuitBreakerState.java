package me.wargame.mcp.domain.model;

/**
 * Read-only view of one tool's breaker. {@code recentFailures} counts failed
 * call sequences in the breaker's sliding window.
 */
public record CircuitBreakerState(String toolName, Status status, int recentFailures) {

    public enum Status {
        CLOSED, OPEN, HALF_OPEN
    }

    public static CircuitBreakerState closed(String toolName) {
        return new CircuitBreakerState(toolName, Status.CLOSED, 0);
    }

    public boolean isOpen() {
        return status == Status.OPEN;
    }
}
