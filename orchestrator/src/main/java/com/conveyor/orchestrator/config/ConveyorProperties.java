package com.conveyor.orchestrator.config;

import com.conveyor.orchestrator.model.PipelineDefinition;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The engine settings and pipelines under {@code conveyor.*} in application.yml.
 * The HTTP clients read their own {@code conveyor.registry}, {@code conveyor.platform}
 * and {@code conveyor.http} keys.
 *
 * <pre>
 * conveyor:
 *   engine:
 *     worker-count: 4
 *     retry-base-delay: 1s
 *     retry-max-delay: 30s
 *     default-stage-timeout: 10m
 *   health: {interval: 10s, max-attempts: 30, success-threshold: 2}
 *   ledger.store: jpa            # jpa | memory
 *   pipelines:
 *     ci: ...                    # see PipelineProperties
 * </pre>
 */
@ConfigurationProperties(prefix = "conveyor")
public record ConveyorProperties(
        @DefaultValue Engine                       engine,
        @DefaultValue Health                       health,
        @DefaultValue Ledger                       ledger,
        Map<String, PipelineProperties>            pipelines
) {

    public ConveyorProperties {
        pipelines = pipelines == null ? Map.of() : new LinkedHashMap<>(pipelines);
    }

    public record Engine(
            @DefaultValue("4")   int      workerCount,
            @DefaultValue("1s")  Duration retryBaseDelay,
            @DefaultValue("30s") Duration retryMaxDelay,
            @DefaultValue("10m") Duration defaultStageTimeout
    ) {}

    /** Applied to every field a pipeline's health-check block leaves out. */
    public record Health(
            @DefaultValue("10s") Duration interval,
            @DefaultValue("30")  int      maxAttempts,
            @DefaultValue("2")   int      successThreshold,
            Duration                      deadline
    ) {}

    public record Ledger(@DefaultValue("jpa") String store) {}

    // ------------------------------------------------------------------
    // Conversion
    // ------------------------------------------------------------------

    /** Configured pipelines, in declaration order. */
    public List<PipelineDefinition> pipelineDefinitions() {
        List<PipelineDefinition> definitions = new ArrayList<>();
        pipelines.forEach((name, pipeline) ->
                definitions.add(pipeline.toDefinition(name, engine.defaultStageTimeout(), health)));
        return definitions;
    }

    /** upstream pipeline → downstream pipeline, for every pipeline that names one. */
    public Map<String, String> downstreams() {
        Map<String, String> downstreams = new LinkedHashMap<>();
        pipelines.forEach((name, pipeline) -> {
            if (pipeline.downstream() != null) {
                downstreams.put(name, pipeline.downstream());
            }
        });
        return downstreams;
    }
}
