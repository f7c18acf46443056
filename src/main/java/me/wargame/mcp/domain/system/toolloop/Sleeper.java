package me.wargame.mcp.domain.system.toolloop;

import java.time.Duration;

/**
 * Backoff wait between retries. Replaced in tests to observe delays without
 * sleeping.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
