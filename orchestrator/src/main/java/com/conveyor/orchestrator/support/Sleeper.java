package com.conveyor.orchestrator.support;

import java.time.Duration;

/**
 * Blocks the calling thread for a while.
 *
 * Retry backoff and health polling sleep through this interface instead of
 * calling {@link Thread#sleep} directly, so tests can replace real waiting with
 * a clock that simply moves forward.
 */
@FunctionalInterface
public interface Sleeper {

    /** @throws InterruptedException when the sleeping thread is interrupted (run cancelled) */
    void sleep(Duration duration) throws InterruptedException;

    static Sleeper system() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
