package com.conveyor.orchestrator.model;

import java.time.Instant;

/**
 * What a stage executor hands back to the run coordinator.
 *
 * Executors never touch the Run; the coordinator applies the result to the
 * owning {@link Stage}.
 *
 * @param state      terminal state: SUCCEEDED, FAILED, TIMED_OUT, or SKIPPED when cancelled
 * @param attempts   number of attempts made, including the final one
 * @param exitCode   process exit code for command stages, null otherwise
 * @param output     captured diagnostic output of the final attempt
 * @param artifact   artifact produced by a publish stage
 * @param outputRef  other declared output (e.g. the selector of a deployed workload)
 * @param finishedAt when the final attempt ended
 */
public record StageResult(
        StageState        state,
        int               attempts,
        Integer           exitCode,
        String            output,
        ArtifactReference artifact,
        String            outputRef,
        Instant           finishedAt
) {

    public StageResult {
        if (state == null || !state.isTerminal()) {
            throw new IllegalArgumentException("StageResult needs a terminal state, got " + state);
        }
    }

    public boolean succeeded() {
        return state == StageState.SUCCEEDED;
    }

    public static StageResult failed(int attempts, String output, Instant finishedAt) {
        return new StageResult(StageState.FAILED, attempts, null, output, null, null, finishedAt);
    }

    public static StageResult cancelled(int attempts, Instant finishedAt) {
        return new StageResult(StageState.SKIPPED, attempts, null, "Cancelled while running", null, null, finishedAt);
    }
}
