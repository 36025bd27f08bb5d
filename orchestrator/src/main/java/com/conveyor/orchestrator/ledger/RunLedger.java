package com.conveyor.orchestrator.ledger;

import com.conveyor.orchestrator.model.Run;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only store of completed runs.
 */
public interface RunLedger {

    /**
     * Record a terminal run.
     *
     * @return true if a new entry was written, false if the run was already
     *         recorded with the same outcome
     * @throws IllegalArgumentException if the run is not terminal
     * @throws LedgerConflictException  if the run was recorded with another outcome
     */
    boolean record(Run run);

    /** Matching entries ordered by completion time, then run id. */
    List<LedgerEntry> query(LedgerQuery query);

    Optional<LedgerEntry> find(UUID runId);
}
