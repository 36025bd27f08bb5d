package com.conveyor.orchestrator.service;

import com.conveyor.orchestrator.model.RunOutcome;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Caller's reference to a started run. Pass it to
 * {@link RunCoordinator#await} or {@link RunCoordinator#cancel}.
 */
public final class RunHandle {

    private final UUID                          runId;
    private final String                        pipeline;
    private final CompletableFuture<RunOutcome> outcome = new CompletableFuture<>();

    RunHandle(UUID runId, String pipeline) {
        this.runId    = runId;
        this.pipeline = pipeline;
    }

    public UUID   runId()    { return runId; }
    public String pipeline() { return pipeline; }

    public boolean isDone() {
        return outcome.isDone();
    }

    CompletableFuture<RunOutcome> outcome() {
        return outcome;
    }

    @Override
    public String toString() {
        return "RunHandle[" + pipeline + "/" + runId + "]";
    }
}
