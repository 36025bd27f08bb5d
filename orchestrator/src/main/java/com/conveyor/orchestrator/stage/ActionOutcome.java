package com.conveyor.orchestrator.stage;

import com.conveyor.orchestrator.model.ArtifactReference;

/**
 * Result of one attempt of a {@link StageAction}.
 *
 * @param succeeded true when the attempt met its success contract
 * @param exitCode  process exit code, null for non-process actions
 * @param output    diagnostic output shown to operators
 * @param artifact  set by publish actions
 * @param outputRef any other declared output (e.g. a deployed workload selector)
 */
public record ActionOutcome(
        boolean           succeeded,
        Integer           exitCode,
        String            output,
        ArtifactReference artifact,
        String            outputRef
) {

    public static ActionOutcome succeeded(String output) {
        return new ActionOutcome(true, null, output, null, null);
    }

    public static ActionOutcome failed(String output) {
        return new ActionOutcome(false, null, output, null, null);
    }

    /** Exit code 0 is success, anything else a failure. */
    public static ActionOutcome exited(int exitCode, String output) {
        return new ActionOutcome(exitCode == 0, exitCode, output, null, null);
    }

    public static ActionOutcome published(ArtifactReference artifact, String output) {
        return new ActionOutcome(true, null, output, artifact, null);
    }

    public static ActionOutcome produced(String outputRef, String output) {
        return new ActionOutcome(true, null, output, null, outputRef);
    }
}
