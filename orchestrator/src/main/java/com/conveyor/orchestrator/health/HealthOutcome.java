package com.conveyor.orchestrator.health;

import java.time.Duration;

/**
 * Verdict of the health gate.
 *
 * @param polls              status polls made
 * @param consecutiveHealthy healthy polls in a row at the moment the gate stopped
 * @param diagnostic         status of the last poll, or the platform error it raised
 * @param elapsed            time spent polling
 */
public record HealthOutcome(
        Status   status,
        int      polls,
        int      consecutiveHealthy,
        String   diagnostic,
        Duration elapsed
) {

    public enum Status { HEALTHY, UNHEALTHY }

    public boolean healthy() {
        return status == Status.HEALTHY;
    }
}
