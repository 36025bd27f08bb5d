package com.conveyor.orchestrator.config;

import com.conveyor.orchestrator.model.HealthCheckPolicy;

import java.time.Duration;

/** A pipeline's health-check block; unset fields fall back to conveyor.health.*. */
public record HealthCheckProperties(
        String   selector,
        Duration interval,
        Integer  maxAttempts,
        Integer  successThreshold,
        Duration deadline
) {

    HealthCheckPolicy toPolicy(ConveyorProperties.Health defaults) {
        return new HealthCheckPolicy(selector,
                interval         != null ? interval         : defaults.interval(),
                maxAttempts      != null ? maxAttempts      : defaults.maxAttempts(),
                successThreshold != null ? successThreshold : defaults.successThreshold(),
                deadline         != null ? deadline         : defaults.deadline());
    }
}
