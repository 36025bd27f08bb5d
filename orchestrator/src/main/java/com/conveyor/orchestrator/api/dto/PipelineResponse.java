package com.conveyor.orchestrator.api.dto;

import com.conveyor.orchestrator.model.PipelineDefinition;
import com.conveyor.orchestrator.model.StageSpec;

import java.util.List;

/** API view of a configured pipeline definition. */
public record PipelineResponse(
        String      name,
        String      version,
        String      kind,
        List<Stage> stages,
        String      healthCheckSelector
) {

    public record Stage(String name, String classification, String action, List<String> dependsOn,
                        String timeout, int retries) {
        static Stage from(StageSpec spec) {
            return new Stage(spec.name(), spec.classification().name(), spec.action().type(),
                    spec.dependsOn(), spec.timeout().toString(), spec.retryCount());
        }
    }

    public static PipelineResponse from(PipelineDefinition def) {
        return new PipelineResponse(
                def.name(),
                def.version(),
                def.kind().name(),
                def.stages().stream().map(Stage::from).toList(),
                def.healthCheck() == null ? null : def.healthCheck().selector()
        );
    }
}
