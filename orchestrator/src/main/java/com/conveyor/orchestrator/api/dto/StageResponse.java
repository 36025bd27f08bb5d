package com.conveyor.orchestrator.api.dto;

import com.conveyor.orchestrator.model.StageSnapshot;

import java.time.Instant;

/** Stage breakdown entry of a run. */
public record StageResponse(
        String  name,
        String  classification,
        String  state,
        Instant startedAt,
        Instant finishedAt,
        int     attempts,
        Integer exitCode,
        String  output,
        String  artifact,
        String  outputRef
) {
    public static StageResponse from(StageSnapshot s) {
        return new StageResponse(
                s.name(),
                s.classification().name(),
                s.state().name(),
                s.startedAt(),
                s.finishedAt(),
                s.attempts(),
                s.exitCode(),
                s.output(),
                s.artifact() == null ? null : s.artifact().coordinates(),
                s.outputRef()
        );
    }
}
