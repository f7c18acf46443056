package me.wargame.mcp.domain.system.toolloop;

import me.wargame.mcp.infrastructure.config.WargameProperties;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff for failed tool calls.
 *
 * <p>
 * The n-th retry waits {@code baseDelay * 2^(n-1)}, capped at
 * {@code maxDelay}. With {@code jitter > 0} the delay is shortened by a random
 * fraction of up to {@code jitter}, so it never exceeds the un-jittered value.
 *
 * @param maxAttempts
 *            total attempts per call, first try included
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay, double jitter) {

    private static final int MAX_SHIFT = 30;

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (baseDelay.isNegative() || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("delays must satisfy 0 <= baseDelay <= maxDelay");
        }
        if (jitter < 0 || jitter > 1) {
            throw new IllegalArgumentException("jitter must be in [0, 1]");
        }
    }

    public static RetryPolicy from(WargameProperties.RetryProperties retry) {
        return new RetryPolicy(retry.getMaxRetries() + 1, Duration.ofMillis(retry.getBaseDelayMs()),
                Duration.ofMillis(retry.getMaxDelayMs()), retry.getJitter());
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO, 0.0);
    }

    /**
     * Delay before the given retry (1-based), without jitter.
     */
    public Duration delayBeforeRetry(int retry) {
        if (retry < 1) {
            throw new IllegalArgumentException("retry must be >= 1");
        }
        int shift = Math.min(retry - 1, MAX_SHIFT);
        long millis = baseDelay.toMillis() << shift;
        if (millis < 0 || millis > maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis(millis);
    }

    public Duration jitteredDelayBeforeRetry(int retry) {
        return jitteredDelayBeforeRetry(retry, () -> ThreadLocalRandom.current().nextDouble());
    }

    Duration jitteredDelayBeforeRetry(int retry, DoubleSupplier random) {
        Duration delay = delayBeforeRetry(retry);
        if (jitter == 0.0) {
            return delay;
        }
        double factor = 1.0 - jitter * random.getAsDouble();
        return Duration.ofMillis(Math.round(delay.toMillis() * factor));
    }
}
