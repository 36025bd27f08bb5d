package com.conveyor.orchestrator.testutil;

import com.conveyor.orchestrator.model.ActionDescriptor;
import com.conveyor.orchestrator.model.PipelineDefinition;
import com.conveyor.orchestrator.model.PipelineKind;
import com.conveyor.orchestrator.model.StageClassification;
import com.conveyor.orchestrator.model.StageSpec;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/** Small builders for definitions used across tests. */
public final class TestPipelines {

    private TestPipelines() {}

    public static StageSpec scripted(String name, String... dependsOn) {
        return scripted(name, StageClassification.BUILD, dependsOn);
    }

    public static StageSpec scripted(String name, StageClassification classification, String... dependsOn) {
        return new StageSpec(name, classification, ActionDescriptor.of(ScriptedAction.TYPE, Map.of()),
                List.of(dependsOn), Duration.ofSeconds(30), 0);
    }

    public static StageSpec withTimeout(StageSpec spec, Duration timeout, int retries) {
        return new StageSpec(spec.name(), spec.classification(), spec.action(), spec.dependsOn(), timeout, retries);
    }

    public static PipelineDefinition pipeline(String name, StageSpec... stages) {
        return new PipelineDefinition(name, "1", PipelineKind.CI, List.of(stages), null);
    }
}
