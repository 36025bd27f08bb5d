package com.conveyor.orchestrator.model;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Declaration of one stage in a pipeline. Immutable once a Run starts.
 *
 * @param name           unique within the pipeline; dependencies refer to it
 * @param classification what the stage does (build, test, publish ...)
 * @param action         the action to run and its arguments
 * @param dependsOn      names of the stages that must succeed first, in declaration order
 * @param timeout        wall-clock limit for a single attempt
 * @param retryCount     extra attempts after a FAILED/TIMED_OUT attempt (0 = no retry)
 */
public record StageSpec(
        String              name,
        StageClassification classification,
        ActionDescriptor    action,
        List<String>        dependsOn,
        Duration            timeout,
        int                 retryCount
) {

    public StageSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Stage name must not be blank");
        }
        Objects.requireNonNull(classification, "classification of stage " + name);
        Objects.requireNonNull(action, "action of stage " + name);
        Objects.requireNonNull(timeout, "timeout of stage " + name);
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("Stage " + name + " timeout must be positive: " + timeout);
        }
        if (retryCount < 0) {
            throw new IllegalArgumentException("Stage " + name + " retry count must be >= 0: " + retryCount);
        }
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
    }
}
