package com.conveyor.orchestrator.model;

import java.util.Map;
import java.util.UUID;

/**
 * Input of a Run.
 *
 * @param sourceVersion commit or version identifier that triggered the run
 * @param artifact      artifact to deploy; set for runs started by the trigger bridge
 * @param triggeredBy   id of the upstream run, null for runs started directly
 * @param parameters    free-form values exported to command stages
 */
public record RunContext(
        String                sourceVersion,
        ArtifactReference     artifact,
        UUID                  triggeredBy,
        Map<String, String>   parameters
) {

    public RunContext {
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
    }

    public static RunContext of(String sourceVersion) {
        return new RunContext(sourceVersion, null, null, Map.of());
    }

    public RunContext withArtifact(ArtifactReference newArtifact, UUID upstreamRunId) {
        return new RunContext(sourceVersion, newArtifact, upstreamRunId, parameters);
    }
}
