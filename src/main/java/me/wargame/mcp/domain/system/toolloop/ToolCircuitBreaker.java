package me.wargame.mcp.domain.system.toolloop;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import me.wargame.mcp.domain.model.CircuitBreakerState;
import me.wargame.mcp.domain.model.exception.ToolInvocationException;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Per-tool breaker shared by all sessions, one Resilience4j
 * {@link CircuitBreaker} per tool name.
 *
 * <p>
 * The count-based window holds the last {@code failureThreshold} outcomes and
 * trips only at a 100% failure rate, so the circuit opens after exactly that
 * many consecutive failures. After {@code cooldown} the next availability
 * check moves it to half-open and lets one call through: its failure re-opens
 * the circuit, its success closes it.
 */
@Slf4j
public class ToolCircuitBreaker {

    private final CircuitBreakerRegistry registry;

    public ToolCircuitBreaker(int failureThreshold, Duration cooldown) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("failureThreshold must be >= 1, got " + failureThreshold);
        }
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowType(SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(failureThreshold)
                .minimumNumberOfCalls(failureThreshold)
                .failureRateThreshold(100.0f)
                .waitDurationInOpenState(cooldown)
                .permittedNumberOfCallsInHalfOpenState(1)
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .build();
        this.registry = CircuitBreakerRegistry.of(config);
    }

    /**
     * Whether calls to the tool are currently refused. An open circuit whose
     * cooldown has elapsed moves to half-open here and reports closed.
     */
    public boolean isOpen(String toolName) {
        CircuitBreaker breaker = registry.circuitBreaker(toolName);
        if (breaker.getState() == CircuitBreaker.State.OPEN && breaker.tryAcquirePermission()) {
            log.info("[ToolLoop] Circuit for {} half-open, allowing one trial call", toolName);
        }
        return breaker.getState() == CircuitBreaker.State.OPEN;
    }

    public CircuitBreakerState getState(String toolName) {
        CircuitBreaker breaker = registry.circuitBreaker(toolName);
        return new CircuitBreakerState(toolName, toStatus(breaker.getState()),
                breaker.getMetrics().getNumberOfFailedCalls());
    }

    public void recordSuccess(String toolName) {
        CircuitBreaker breaker = registry.circuitBreaker(toolName);
        CircuitBreaker.State before = breaker.getState();
        breaker.onSuccess(0, TimeUnit.NANOSECONDS);
        if (before != CircuitBreaker.State.CLOSED && breaker.getState() == CircuitBreaker.State.CLOSED) {
            log.info("[ToolLoop] Circuit for {} closed", toolName);
        }
    }

    /**
     * Records one exhausted call sequence against the tool.
     */
    public CircuitBreakerState recordFailure(String toolName) {
        CircuitBreaker breaker = registry.circuitBreaker(toolName);
        CircuitBreaker.State before = breaker.getState();
        breaker.onError(0, TimeUnit.NANOSECONDS, new ToolInvocationException(toolName + " failed"));
        CircuitBreakerState state = getState(toolName);
        if (before != CircuitBreaker.State.OPEN && state.isOpen()) {
            log.warn("[ToolLoop] Circuit OPEN for {} after {} failures", toolName, state.recentFailures());
        }
        return state;
    }

    private static CircuitBreakerState.Status toStatus(CircuitBreaker.State state) {
        return switch (state) {
        case OPEN, FORCED_OPEN -> CircuitBreakerState.Status.OPEN;
        case HALF_OPEN -> CircuitBreakerState.Status.HALF_OPEN;
        default -> CircuitBreakerState.Status.CLOSED;
        };
    }
}
