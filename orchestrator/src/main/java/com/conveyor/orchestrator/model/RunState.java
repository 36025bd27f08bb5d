package com.conveyor.orchestrator.model;

/**
 * States of a pipeline Run.
 *
 * Transitions (happy path):
 *   PENDING → RUNNING → SUCCEEDED
 *
 * RUNNING → FAILED once a stage failed or timed out and nothing else can run.
 * PENDING | RUNNING → CANCELLED on an explicit cancel request.
 */
public enum RunState {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }
}
