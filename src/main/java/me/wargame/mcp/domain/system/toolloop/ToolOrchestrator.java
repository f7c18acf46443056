package me.wargame.mcp.domain.system.toolloop;

import lombok.extern.slf4j.Slf4j;
import me.wargame.mcp.domain.component.ToolComponent;
import me.wargame.mcp.domain.model.AgentDecision;
import me.wargame.mcp.domain.model.OrchestrationResult;
import me.wargame.mcp.domain.model.OrchestrationSession;
import me.wargame.mcp.domain.model.OrchestrationState;
import me.wargame.mcp.domain.model.SessionStatus;
import me.wargame.mcp.domain.model.SessionToolResult;
import me.wargame.mcp.domain.model.ToolCall;
import me.wargame.mcp.domain.model.ToolCallAttempt;
import me.wargame.mcp.domain.model.ToolFailureKind;
import me.wargame.mcp.domain.model.ToolResult;
import me.wargame.mcp.domain.model.ToolSource;
import me.wargame.mcp.domain.model.exception.OrchestrationTimeoutException;
import me.wargame.mcp.domain.service.CorrelationSupport;
import me.wargame.mcp.domain.service.ToolRegistry;
import me.wargame.mcp.infrastructure.config.WargameProperties;
import me.wargame.mcp.port.outbound.AgentDriver;
import me.wargame.mcp.tools.MemorySearchTool;
import me.wargame.mcp.tools.SearchWargameDocsTool;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Bounded agent tool loop.
 *
 * <p>
 * Each iteration asks the {@link AgentDriver} for the next tool call and runs
 * it under the retry policy, the per-tool circuit breaker and the session
 * deadline. A call to a tool whose circuit is open is skipped and the question
 * is sent to the other data source instead. The loop ends when the driver
 * finishes, the iteration cap is reached, the deadline passes or no data
 * source is left; results gathered so far are always returned.
 */
@Slf4j
public class ToolOrchestrator {

    static final String MESSAGE_NO_SOURCES = "no data sources available";
    static final String MESSAGE_ITERATION_CAP = "iteration limit reached";
    static final String MESSAGE_TIMEOUT = "session timed out";

    private final AgentDriver agentDriver;
    private final ToolExecutorPort toolExecutor;
    private final ToolRegistry toolRegistry;
    private final ToolCircuitBreaker circuitBreaker;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final Clock clock;
    private final int maxToolIterations;
    private final Duration sessionTimeout;
    private final Duration callTimeout;

    public ToolOrchestrator(AgentDriver agentDriver, ToolExecutorPort toolExecutor, ToolRegistry toolRegistry,
            ToolCircuitBreaker circuitBreaker, RetryPolicy retryPolicy, WargameProperties.OrchestratorProperties props,
            Clock clock) {
        this(agentDriver, toolExecutor, toolRegistry, circuitBreaker, retryPolicy, Sleeper.THREAD, clock,
                props.getMaxToolIterations(), Duration.ofMillis(props.getSessionTimeoutMs()),
                Duration.ofMillis(props.getCallTimeoutMs()));
    }

    // Visible for testing
    ToolOrchestrator(AgentDriver agentDriver, ToolExecutorPort toolExecutor, ToolRegistry toolRegistry,
            ToolCircuitBreaker circuitBreaker, RetryPolicy retryPolicy, Sleeper sleeper, Clock clock,
            int maxToolIterations, Duration sessionTimeout, Duration callTimeout) {
        this.agentDriver = agentDriver;
        this.toolExecutor = toolExecutor;
        this.toolRegistry = toolRegistry;
        this.circuitBreaker = circuitBreaker;
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
        this.clock = clock;
        this.maxToolIterations = maxToolIterations;
        this.sessionTimeout = sessionTimeout;
        this.callTimeout = callTimeout;
    }

    public OrchestrationResult run(String question, String userId, String correlationId) {
        if (question == null || question.isBlank()) {
            throw new IllegalArgumentException("question is required");
        }
        String cid = CorrelationSupport.orNew(correlationId);
        try (MDC.MDCCloseable ignored = CorrelationSupport.bind(cid)) {
            OrchestrationSession session = new OrchestrationSession(cid, userId, question, clock.instant());
            long deadlineNanos = System.nanoTime() + sessionTimeout.toNanos();
            log.info("[ToolLoop] Session started (user={}, maxIterations={})", userId, maxToolIterations);
            try {
                loop(session, deadlineNanos);
            } catch (OrchestrationTimeoutException e) {
                finish(session, OrchestrationState.FAILED, SessionStatus.PARTIAL, MESSAGE_TIMEOUT);
            }
            log.info("[ToolLoop] Session finished: state={}, status={}, iterations={}, results={}",
                    session.getState(), session.getStatus().getValue(), session.getIterationCount(),
                    session.getAccumulatedResults().size());
            return OrchestrationResult.from(session);
        }
    }

    private void loop(OrchestrationSession session, long deadlineNanos) {
        while (!session.getState().isTerminal()) {
            if (remainingNanos(deadlineNanos) <= 0) {
                throw new OrchestrationTimeoutException(MESSAGE_TIMEOUT);
            }
            if (circuitBreaker.isOpen(MemorySearchTool.TOOL_NAME)
                    && circuitBreaker.isOpen(SearchWargameDocsTool.TOOL_NAME)) {
                finish(session, OrchestrationState.FAILED, SessionStatus.FAILED, MESSAGE_NO_SOURCES);
                return;
            }
            if (session.getIterationCount() >= maxToolIterations) {
                log.warn("[ToolLoop] Iteration limit {} reached", maxToolIterations);
                finish(session, OrchestrationState.FAILED, SessionStatus.PARTIAL, MESSAGE_ITERATION_CAP);
                return;
            }

            AgentDecision decision = agentDriver.nextAction(session);
            if (decision.complete()) {
                finish(session, OrchestrationState.COMPLETED, SessionStatus.COMPLETED, null);
                return;
            }
            session.setIterationCount(session.getIterationCount() + 1);
            dispatch(session, decision.toolCall(), deadlineNanos);
        }
    }

    private void dispatch(OrchestrationSession session, ToolCall call, long deadlineNanos) {
        String requested = call.name();
        if (!circuitBreaker.isOpen(requested)) {
            session.setState(OrchestrationState.ITERATING);
            ToolResult result = invoke(session, requested, call.arguments(), deadlineNanos);
            if (result.isSuccess()) {
                session.addResult(new SessionToolResult(requested, requested, false, result.getOutput(),
                        result.getData()));
            }
            session.markResolved(requested);
            return;
        }

        session.recordAttempt(new ToolCallAttempt(requested, 0, ToolCallAttempt.Outcome.SKIPPED, Duration.ZERO));
        session.setState(OrchestrationState.CIRCUIT_OPEN);
        Optional<String> fallback = fallbackFor(requested);
        if (fallback.isEmpty() || circuitBreaker.isOpen(fallback.get())) {
            if (fallback.isPresent()) {
                finish(session, OrchestrationState.FAILED, SessionStatus.FAILED, MESSAGE_NO_SOURCES);
            } else {
                log.warn("[ToolLoop] Circuit open for {} and no fallback source", requested);
                session.markResolved(requested);
                session.setState(OrchestrationState.ITERATING);
            }
            return;
        }

        String fallbackTool = fallback.get();
        log.info("[ToolLoop] Circuit open for {}, falling back to {}", requested, fallbackTool);
        ToolResult result = invoke(session, fallbackTool, fallbackArguments(fallbackTool, session), deadlineNanos);
        if (result.isSuccess()) {
            session.addResult(new SessionToolResult(requested, fallbackTool, true, result.getOutput(),
                    result.getData()));
        }
        session.markResolved(requested);
        session.setState(OrchestrationState.ITERATING);
    }

    /**
     * Runs one call with retries. The breaker sees a single failure once the
     * retries are exhausted; invalid arguments and unknown tools never count.
     */
    private ToolResult invoke(OrchestrationSession session, String toolName, Map<String, Object> arguments,
            long deadlineNanos) {
        ToolResult last = null;
        for (int attempt = 1; attempt <= retryPolicy.maxAttempts(); attempt++) {
            if (attempt > 1) {
                backoff(attempt - 1, deadlineNanos);
            }
            Instant started = clock.instant();
            last = attemptOnce(session, toolName, arguments, attempt, deadlineNanos);
            Duration latency = Duration.between(started, clock.instant());

            if (last.isSuccess()) {
                session.recordAttempt(new ToolCallAttempt(toolName, attempt, ToolCallAttempt.Outcome.SUCCESS, latency));
                circuitBreaker.recordSuccess(toolName);
                return last;
            }
            ToolCallAttempt.Outcome outcome = last.getFailureKind() == ToolFailureKind.TIMEOUT
                    ? ToolCallAttempt.Outcome.TIMEOUT
                    : ToolCallAttempt.Outcome.ERROR;
            session.recordAttempt(new ToolCallAttempt(toolName, attempt, outcome, latency));
            log.warn("[ToolLoop] {} attempt {}/{} failed: {}", toolName, attempt, retryPolicy.maxAttempts(),
                    last.getError());
            if (!last.isRetryableFailure()) {
                return last;
            }
        }
        circuitBreaker.recordFailure(toolName);
        return last;
    }

    private ToolResult attemptOnce(OrchestrationSession session, String toolName, Map<String, Object> arguments,
            int attempt, long deadlineNanos) {
        long remaining = remainingNanos(deadlineNanos);
        if (remaining <= 0) {
            throw new OrchestrationTimeoutException(MESSAGE_TIMEOUT);
        }
        boolean boundedBySession = remaining <= callTimeout.toNanos();
        long waitNanos = boundedBySession ? remaining : callTimeout.toNanos();

        Future<ToolResult> future = toolExecutor.submit(new ToolCall(toolName, arguments));
        try {
            ToolResult result = future.get(waitNanos, TimeUnit.NANOSECONDS);
            return result != null ? result : ToolResult.failure("Tool returned no result");
        } catch (TimeoutException e) {
            future.cancel(true);
            if (boundedBySession) {
                session.recordAttempt(new ToolCallAttempt(toolName, attempt, ToolCallAttempt.Outcome.TIMEOUT,
                        Duration.ofNanos(waitNanos)));
                log.warn("[ToolLoop] Session deadline expired during {}", toolName);
                throw new OrchestrationTimeoutException(MESSAGE_TIMEOUT);
            }
            return ToolResult.failure(ToolFailureKind.TIMEOUT,
                    toolName + " timed out after " + callTimeout.toMillis() + " ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, cause.getMessage());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new OrchestrationTimeoutException("interrupted while waiting for " + toolName);
        }
    }

    private void backoff(int retry, long deadlineNanos) {
        Duration delay = retryPolicy.jitteredDelayBeforeRetry(retry);
        if (delay.toNanos() >= remainingNanos(deadlineNanos)) {
            throw new OrchestrationTimeoutException(MESSAGE_TIMEOUT);
        }
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OrchestrationTimeoutException("interrupted during retry backoff");
        }
    }

    private Optional<String> fallbackFor(String toolName) {
        Optional<ToolSource> source = toolRegistry.sourceOf(toolName);
        if (source.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(source.get() == ToolSource.MEMORY
                ? SearchWargameDocsTool.TOOL_NAME
                : MemorySearchTool.TOOL_NAME);
    }

    private Map<String, Object> fallbackArguments(String toolName, OrchestrationSession session) {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put("query", session.getQuestion());
        if (MemorySearchTool.TOOL_NAME.equals(toolName) && session.getUserId() != null) {
            args.put("user_id", session.getUserId());
        }
        args.put(ToolComponent.PARAM_CORRELATION_ID, session.getCorrelationId());
        return args;
    }

    private void finish(OrchestrationSession session, OrchestrationState state, SessionStatus status,
            String message) {
        session.setState(state);
        session.setStatus(status);
        session.setMessage(message);
    }

    private static long remainingNanos(long deadlineNanos) {
        return deadlineNanos - System.nanoTime();
    }
}
