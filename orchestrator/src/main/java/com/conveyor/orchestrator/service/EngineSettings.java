package com.conveyor.orchestrator.service;

import com.conveyor.orchestrator.stage.Backoff;

import java.time.Duration;

/**
 * Immutable engine tuning, passed to the coordinator at construction.
 *
 * @param workerCount    stages that may execute at the same time, across all runs
 * @param retryBaseDelay backoff before the first retry of a stage
 * @param retryMaxDelay  backoff cap
 */
public record EngineSettings(int workerCount, Duration retryBaseDelay, Duration retryMaxDelay) {

    public EngineSettings {
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be >= 1: " + workerCount);
        }
    }

    public Backoff backoff() {
        return new Backoff(retryBaseDelay, retryMaxDelay);
    }
}
