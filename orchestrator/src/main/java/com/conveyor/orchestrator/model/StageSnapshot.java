package com.conveyor.orchestrator.model;

import java.time.Instant;

/**
 * Read-only copy of a {@link Stage}, safe to hand to other threads, the ledger
 * and the REST layer.
 */
public record StageSnapshot(
        String              name,
        StageClassification classification,
        StageState          state,
        Instant             startedAt,
        Instant             finishedAt,
        int                 attempts,
        Integer             exitCode,
        String              output,
        ArtifactReference   artifact,
        String              outputRef
) {}
