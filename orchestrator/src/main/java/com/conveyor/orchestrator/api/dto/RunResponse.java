package com.conveyor.orchestrator.api.dto;

import com.conveyor.orchestrator.model.RunOutcome;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/** API view of a run, live or recorded. */
public record RunResponse(
        UUID                id,
        String              pipeline,
        String              pipelineVersion,
        String              kind,
        String              state,
        String              sourceVersion,
        String              artifact,
        UUID                triggeredBy,
        Instant             startedAt,
        Instant             completedAt,
        List<StageResponse> stages
) {
    public static RunResponse from(RunOutcome run) {
        return new RunResponse(
                run.runId(),
                run.pipeline(),
                run.pipelineVersion(),
                run.kind().name(),
                run.state().name(),
                run.sourceVersion(),
                run.artifact() == null ? null : run.artifact().coordinates(),
                run.triggeredBy(),
                run.startedAt(),
                run.completedAt(),
                run.stages().stream().map(StageResponse::from).toList()
        );
    }
}
