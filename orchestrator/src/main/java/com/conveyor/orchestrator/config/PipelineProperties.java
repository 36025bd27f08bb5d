package com.conveyor.orchestrator.config;

import com.conveyor.orchestrator.model.HealthCheckPolicy;
import com.conveyor.orchestrator.model.PipelineDefinition;
import com.conveyor.orchestrator.model.PipelineKind;
import com.conveyor.orchestrator.model.StageSpec;

import java.time.Duration;
import java.util.List;

/**
 * One entry of {@code conveyor.pipelines}.
 *
 * <pre>
 * ci:
 *   version: "3"
 *   kind: ci
 *   downstream: cd
 *   stages:
 *     - name: build
 *       classification: build
 *       args: [make, build]
 *     - name: publish
 *       classification: publish
 *       action: publish
 *       depends-on: [build]
 *       params: {artifact: web-api, payload: build/web-api.tar}
 * </pre>
 *
 * @param kind       ci or cd; ci when left out
 * @param downstream CD pipeline to start after a successful run of this one
 */
public record PipelineProperties(
        String                      version,
        PipelineKind                kind,
        String                      downstream,
        HealthCheckProperties       healthCheck,
        List<StageProperties>       stages
) {

    PipelineDefinition toDefinition(String name, Duration defaultTimeout, ConveyorProperties.Health defaults) {
        List<StageSpec> specs = stages == null ? List.of()
                : stages.stream().map(s -> s.toSpec(defaultTimeout)).toList();
        HealthCheckPolicy policy = healthCheck == null ? null : healthCheck.toPolicy(defaults);
        return new PipelineDefinition(name, version, kind == null ? PipelineKind.CI : kind, specs, policy);
    }
}
