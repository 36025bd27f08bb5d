package com.conveyor.orchestrator.model;

import java.time.Duration;
import java.util.Objects;

/**
 * How the health gate decides that a deployment is ready.
 *
 * The gate polls {@code selector} every {@code interval} and succeeds after
 * {@code successThreshold} consecutive healthy polls. It gives up after
 * {@code maxAttempts} polls or once {@code deadline} (when set) has elapsed,
 * so the wait is always bounded by {@link #maxWait()}.
 *
 * @param selector         workload selector understood by the deployment platform
 * @param interval         pause between two polls
 * @param maxAttempts      upper bound on the number of polls
 * @param successThreshold consecutive healthy polls required
 * @param deadline         optional wall-clock bound; null means interval × maxAttempts
 */
public record HealthCheckPolicy(
        String   selector,
        Duration interval,
        int      maxAttempts,
        int      successThreshold,
        Duration deadline
) {

    public static final Duration DEFAULT_INTERVAL          = Duration.ofSeconds(10);
    public static final int      DEFAULT_MAX_ATTEMPTS      = 30;
    public static final int      DEFAULT_SUCCESS_THRESHOLD = 2;

    public HealthCheckPolicy {
        Objects.requireNonNull(interval, "interval");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Health check interval must be positive: " + interval);
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("Health check maxAttempts must be >= 1: " + maxAttempts);
        }
        if (successThreshold < 1 || successThreshold > maxAttempts) {
            throw new IllegalArgumentException("Health check successThreshold must be in [1, "
                    + maxAttempts + "]: " + successThreshold);
        }
        if (deadline != null && (deadline.isZero() || deadline.isNegative())) {
            throw new IllegalArgumentException("Health check deadline must be positive: " + deadline);
        }
    }

    public static HealthCheckPolicy defaults(String selector) {
        return new HealthCheckPolicy(selector, DEFAULT_INTERVAL, DEFAULT_MAX_ATTEMPTS,
                DEFAULT_SUCCESS_THRESHOLD, null);
    }

    /** Longest time the gate may spend polling. */
    public Duration maxWait() {
        Duration byAttempts = interval.multipliedBy(maxAttempts);
        if (deadline == null) return byAttempts;
        return deadline.compareTo(byAttempts) < 0 ? deadline : byAttempts;
    }
}
