package com.conveyor.orchestrator.model;

import java.util.List;
import java.util.Objects;

/**
 * A named, versioned set of stages and the dependencies between them.
 *
 * Structural validity (acyclic, no dangling dependency names) is not checked
 * here but when the definition is compiled into a
 * {@link com.conveyor.orchestrator.pipeline.PipelineGraph} at run start.
 *
 * @param healthCheck applied by "verify" stages; null when the pipeline deploys nothing
 */
public record PipelineDefinition(
        String            name,
        String            version,
        PipelineKind      kind,
        List<StageSpec>   stages,
        HealthCheckPolicy healthCheck
) {

    public PipelineDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind of pipeline " + name);
        version = version == null ? "1" : version;
        stages  = stages  == null ? List.of() : List.copyOf(stages);
    }
}
