package com.conveyor.orchestrator.ledger;

import com.conveyor.orchestrator.model.RunState;

import java.util.UUID;

/** A run was recorded again with an outcome different from the one on file. */
public class LedgerConflictException extends RuntimeException {

    private final UUID     runId;
    private final RunState recorded;
    private final RunState attempted;

    public LedgerConflictException(UUID runId, RunState recorded, RunState attempted) {
        super("Run " + runId + " is already recorded as " + recorded + "; refusing to record it as " + attempted);
        this.runId     = runId;
        this.recorded  = recorded;
        this.attempted = attempted;
    }

    public UUID     getRunId()     { return runId; }
    public RunState getRecorded()  { return recorded; }
    public RunState getAttempted() { return attempted; }
}
