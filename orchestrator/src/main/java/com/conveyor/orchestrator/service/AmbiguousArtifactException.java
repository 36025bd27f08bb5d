package com.conveyor.orchestrator.service;

import java.util.UUID;

/**
 * A successful CI run does not name exactly one published artifact, so there
 * is nothing unambiguous to deliver.
 */
public class AmbiguousArtifactException extends RuntimeException {

    private final UUID runId;
    private final int  candidates;

    public AmbiguousArtifactException(UUID runId, int candidates) {
        super("Run " + runId + " published " + candidates + " artifacts; exactly one is needed to trigger delivery");
        this.runId      = runId;
        this.candidates = candidates;
    }

    public UUID getRunId()      { return runId; }
    public int  getCandidates() { return candidates; }
}
