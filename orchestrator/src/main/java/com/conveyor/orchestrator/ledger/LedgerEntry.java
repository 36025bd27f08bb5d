package com.conveyor.orchestrator.ledger;

import com.conveyor.orchestrator.model.ArtifactReference;
import com.conveyor.orchestrator.model.PipelineKind;
import com.conveyor.orchestrator.model.Run;
import com.conveyor.orchestrator.model.RunOutcome;
import com.conveyor.orchestrator.model.RunState;
import com.conveyor.orchestrator.model.StageSnapshot;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Immutable record of a completed run, one {@link StageSnapshot} per stage.
 * Entries are ordered by completion time, ties broken by run id compared as
 * unsigned bytes, the order PostgreSQL gives its uuid type.
 */
public record LedgerEntry(
        UUID                runId,
        String              pipeline,
        String              pipelineVersion,
        PipelineKind        kind,
        String              sourceVersion,
        ArtifactReference   artifact,
        UUID                triggeredBy,
        RunState            outcome,
        Instant             startedAt,
        Instant             completedAt,
        List<StageSnapshot> stages
) {

    public static final Comparator<LedgerEntry> ORDER =
            Comparator.comparing(LedgerEntry::completedAt).thenComparing(LedgerEntry::runIdKey);

    public LedgerEntry {
        stages = stages == null ? List.of() : List.copyOf(stages);
    }

    public static LedgerEntry from(Run run) {
        RunOutcome o = run.toOutcome();
        return new LedgerEntry(o.runId(), o.pipeline(), o.pipelineVersion(), o.kind(), o.sourceVersion(),
                o.artifact(), o.triggeredBy(), o.state(), o.startedAt(), o.completedAt(), o.stages());
    }

    /** Canonical lowercase hex; sorts like the id's bytes read unsigned. */
    String runIdKey() {
        return runId.toString();
    }

    public RunOutcome toOutcome() {
        return new RunOutcome(runId, pipeline, pipelineVersion, kind, outcome, sourceVersion, artifact,
                triggeredBy, startedAt, completedAt, stages);
    }
}
