package com.conveyor.orchestrator.health;

import com.conveyor.orchestrator.model.HealthCheckPolicy;
import com.conveyor.orchestrator.platform.DeploymentPlatform;
import com.conveyor.orchestrator.platform.WorkloadStatus;
import com.conveyor.orchestrator.support.Sleeper;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Decides whether a deployed workload is healthy enough to promote.
 *
 * Polls {@link DeploymentPlatform#status(String)} every policy interval and
 * counts consecutive converged polls. Reaching the success threshold returns
 * HEALTHY. The gate returns UNHEALTHY once {@code maxAttempts} polls were made
 * or the next poll would land past {@link HealthCheckPolicy#maxWait()}.
 *
 * A platform error is an unhealthy poll: it resets the counter and the loop
 * carries on. Only an interrupt (stage timeout or run cancellation) ends the
 * gate early.
 *
 * Metrics: conveyor.health.polls{healthy}
 */
@Component
public class HealthGate {

    private static final Logger log = LoggerFactory.getLogger(HealthGate.class);

    private final DeploymentPlatform platform;
    private final Clock              clock;
    private final Sleeper            sleeper;
    private final MeterRegistry      meterRegistry;

    public HealthGate(DeploymentPlatform platform, Clock clock, Sleeper sleeper, MeterRegistry meterRegistry) {
        this.platform      = platform;
        this.clock         = clock;
        this.sleeper       = sleeper;
        this.meterRegistry = meterRegistry;
    }

    public HealthOutcome verify(HealthCheckPolicy policy, String selector) throws InterruptedException {
        Instant start    = clock.instant();
        Instant deadline = start.plus(policy.maxWait());
        int polls       = 0;
        int consecutive = 0;
        String diagnostic = "no status polled";

        log.info("Health gate on '{}': threshold {} within {} polls, at most {}",
                selector, policy.successThreshold(), policy.maxAttempts(), policy.maxWait());

        while (polls < policy.maxAttempts()) {
            polls++;
            boolean healthy;
            try {
                WorkloadStatus status = platform.status(selector);
                healthy    = status.converged();
                diagnostic = status.describe();
            } catch (RuntimeException e) {
                healthy    = false;
                diagnostic = "platform unreachable: " + e.getMessage();
            }
            meterRegistry.counter("conveyor.health.polls", "healthy", String.valueOf(healthy)).increment();

            if (healthy) {
                consecutive++;
                log.debug("Poll {} of '{}' healthy ({}/{})", polls, selector, consecutive, policy.successThreshold());
                if (consecutive >= policy.successThreshold()) {
                    log.info("'{}' healthy after {} polls", selector, polls);
                    return new HealthOutcome(HealthOutcome.Status.HEALTHY, polls, consecutive, diagnostic,
                            Duration.between(start, clock.instant()));
                }
            } else {
                consecutive = 0;
                log.info("Poll {} of '{}' unhealthy: {}", polls, selector, diagnostic);
            }

            if (polls >= policy.maxAttempts()) break;
            if (clock.instant().plus(policy.interval()).isAfter(deadline)) {
                log.info("Health gate on '{}' would pass its deadline; stopping after {} polls", selector, polls);
                break;
            }
            sleeper.sleep(policy.interval());
        }

        log.warn("'{}' not healthy after {} polls: {}", selector, polls, diagnostic);
        return new HealthOutcome(HealthOutcome.Status.UNHEALTHY, polls, consecutive, diagnostic,
                Duration.between(start, clock.instant()));
    }
}
