package com.conveyor.orchestrator.stage;

import com.conveyor.orchestrator.model.ArtifactReference;
import com.conveyor.orchestrator.model.HealthCheckPolicy;
import com.conveyor.orchestrator.model.RunContext;

import java.util.List;
import java.util.UUID;

/**
 * Everything an action may know about the run it belongs to. Immutable; built
 * by the run driver when the stage is dispatched.
 *
 * @param upstreamArtifacts artifacts produced by stages this stage (transitively) depends on
 * @param healthCheck       the pipeline's health check policy, null if it has none
 */
public record StageContext(
        UUID                    runId,
        String                  pipeline,
        RunContext              run,
        List<ArtifactReference> upstreamArtifacts,
        HealthCheckPolicy       healthCheck
) {

    public StageContext {
        upstreamArtifacts = upstreamArtifacts == null ? List.of() : List.copyOf(upstreamArtifacts);
    }

    /**
     * Artifact to act on: the one produced earlier in this run if any, otherwise
     * the one the run was started with.
     */
    public ArtifactReference artifact() {
        if (!upstreamArtifacts.isEmpty()) {
            return upstreamArtifacts.get(upstreamArtifacts.size() - 1);
        }
        return run.artifact();
    }
}
