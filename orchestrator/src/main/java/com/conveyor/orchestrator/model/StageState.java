package com.conveyor.orchestrator.model;

/**
 * Execution state of a single Stage within a Run.
 *
 * Transitions:
 *   PENDING → RUNNING   (all dependencies SUCCEEDED, dispatched to a worker)
 *   RUNNING → SUCCEEDED | FAILED | TIMED_OUT
 *   PENDING → SKIPPED   (an upstream stage did not succeed, or the run was cancelled)
 *   RUNNING → SKIPPED   (run cancelled while the stage was in flight)
 */
public enum StageState {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    TIMED_OUT,
    SKIPPED;

    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }

    /** FAILED, TIMED_OUT and SKIPPED all block every dependent stage. */
    public boolean blocksDependents() {
        return this == FAILED || this == TIMED_OUT || this == SKIPPED;
    }
}
