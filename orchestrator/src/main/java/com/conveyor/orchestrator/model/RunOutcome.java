package com.conveyor.orchestrator.model;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Immutable view of a Run: its state plus the per-stage breakdown.
 *
 * Returned by {@code RunCoordinator.await} once the run is terminal, and used
 * for status queries while it is still in flight (state PENDING/RUNNING,
 * {@code completedAt} null).
 */
public record RunOutcome(
        UUID                runId,
        String              pipeline,
        String              pipelineVersion,
        PipelineKind        kind,
        RunState            state,
        String              sourceVersion,
        ArtifactReference   artifact,
        UUID                triggeredBy,
        Instant             startedAt,
        Instant             completedAt,
        List<StageSnapshot> stages
) {

    public RunOutcome {
        stages = stages == null ? List.of() : List.copyOf(stages);
    }

    public Optional<StageSnapshot> stage(String name) {
        return stages.stream().filter(s -> s.name().equals(name)).findFirst();
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }
}
