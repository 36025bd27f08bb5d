package com.conveyor.orchestrator.service;

import com.conveyor.orchestrator.ledger.LedgerEntry;
import com.conveyor.orchestrator.ledger.LedgerQuery;
import com.conveyor.orchestrator.ledger.RunLedger;
import com.conveyor.orchestrator.model.PipelineDefinition;
import com.conveyor.orchestrator.model.RunContext;
import com.conveyor.orchestrator.model.RunOutcome;
import com.conveyor.orchestrator.pipeline.PipelineCatalog;
import com.conveyor.orchestrator.pipeline.UnknownPipelineException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * What the REST layer can do with runs. Live runs are answered by the
 * coordinator, finished ones by the ledger.
 */
@Service
public class RunService {

    /** Outcome of a cancel request made by id. */
    public enum CancelResult { REQUESTED, ALREADY_FINISHED, NOT_FOUND }

    private final RunCoordinator  coordinator;
    private final PipelineCatalog catalog;
    private final RunLedger       ledger;

    public RunService(RunCoordinator coordinator, PipelineCatalog catalog, RunLedger ledger) {
        this.coordinator = coordinator;
        this.catalog     = catalog;
        this.ledger      = ledger;
    }

    /**
     * Start a run of a configured pipeline.
     *
     * @return the run as it stands right after start
     * @throws UnknownPipelineException if no pipeline has that name
     */
    public RunOutcome startRun(String pipeline, RunContext context) {
        PipelineDefinition definition = catalog.get(pipeline);
        RunHandle handle = coordinator.start(definition, context);
        return getRun(handle.runId()).orElseThrow(() ->
                new IllegalStateException("Run " + handle.runId() + " vanished right after start"));
    }

    public CancelResult cancel(UUID runId) {
        if (coordinator.cancel(runId)) {
            return CancelResult.REQUESTED;
        }
        return getRun(runId).isPresent() ? CancelResult.ALREADY_FINISHED : CancelResult.NOT_FOUND;
    }

    public Optional<RunOutcome> getRun(UUID runId) {
        Optional<RunOutcome> live = coordinator.find(runId);
        if (live.isPresent()) {
            return live;
        }
        return ledger.find(runId).map(LedgerEntry::toOutcome);
    }

    public List<LedgerEntry> listRuns(LedgerQuery query) {
        return ledger.query(query);
    }

    public List<RunOutcome> activeRuns() {
        return coordinator.activeRuns();
    }

    public List<PipelineDefinition> pipelines() {
        return catalog.all();
    }
}
