package com.conveyor.orchestrator.stage;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff between stage attempts: the base delay doubles for every
 * retry and never exceeds the cap.
 */
public record Backoff(Duration baseDelay, Duration maxDelay) {

    public Backoff {
        Objects.requireNonNull(baseDelay, "baseDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");
        if (baseDelay.isNegative() || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("Backoff needs 0 <= baseDelay <= maxDelay, got "
                    + baseDelay + " / " + maxDelay);
        }
    }

    /**
     * Delay before the given retry.
     *
     * @param retry 1 for the first retry (second attempt), 2 for the next, ...
     */
    public Duration delayBefore(int retry) {
        if (retry < 1) return Duration.ZERO;
        int doublings = retry - 1;
        // 2^30 times any practical base delay is past every cap.
        if (doublings >= 30) return maxDelay;
        Duration delay = baseDelay.multipliedBy(1L << doublings);
        return delay.compareTo(maxDelay) > 0 ? maxDelay : delay;
    }
}
