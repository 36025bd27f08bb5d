package com.conveyor.orchestrator.stage.action;

import com.conveyor.orchestrator.model.ActionDescriptor;
import com.conveyor.orchestrator.model.ArtifactReference;
import com.conveyor.orchestrator.model.PipelineDefinition;
import com.conveyor.orchestrator.model.PipelineKind;
import com.conveyor.orchestrator.model.RunContext;
import com.conveyor.orchestrator.model.StageClassification;
import com.conveyor.orchestrator.model.StageSpec;
import com.conveyor.orchestrator.platform.ArtifactRegistry;
import com.conveyor.orchestrator.platform.Receipt;
import com.conveyor.orchestrator.stage.ActionOutcome;
import com.conveyor.orchestrator.stage.StageContext;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PublishActionTest {

    @Mock ArtifactRegistry registry;
    @InjectMocks PublishAction action;

    final StageContext ctx = new StageContext(UUID.randomUUID(), "ci", RunContext.of("9f1c2e7"), List.of(), null);

    @Test
    void accepted_producesArtifactReference() {
        when(registry.publish("web-api", "9f1c2e7", "build/web-api.tar")).thenReturn(Receipt.ok());

        ActionOutcome outcome = action.perform(stage(Map.of("artifact", "web-api", "payload", "build/web-api.tar")), ctx);

        assertThat(outcome.succeeded()).isTrue();
        assertThat(outcome.artifact()).isEqualTo(new ArtifactReference("web-api", "9f1c2e7"));
    }

    @Test
    void explicitVersion_overridesSourceVersion() {
        when(registry.publish("web-api", "1.4.0", null)).thenReturn(Receipt.ok());

        ActionOutcome outcome = action.perform(stage(Map.of("artifact", "web-api", "version", "1.4.0")), ctx);

        assertThat(outcome.artifact().version()).isEqualTo("1.4.0");
    }

    @Test
    void rejected_failsWithReason() {
        when(registry.publish(any(), any(), any())).thenReturn(Receipt.rejected("version already exists"));

        ActionOutcome outcome = action.perform(stage(Map.of("artifact", "web-api")), ctx);

        assertThat(outcome.succeeded()).isFalse();
        assertThat(outcome.artifact()).isNull();
        assertThat(outcome.output()).contains("version already exists");
    }

    @Test
    void problems_missingArtifactName() {
        StageSpec spec = stage(Map.of());
        PipelineDefinition def = new PipelineDefinition("ci", "1", PipelineKind.CI, List.of(spec), null);

        assertThat(action.problems(spec, def)).hasSize(1);
        verifyNoInteractions(registry);
    }

    private static StageSpec stage(Map<String, String> params) {
        return new StageSpec("publish", StageClassification.PUBLISH, ActionDescriptor.of("publish", params),
                List.of(), Duration.ofSeconds(30), 0);
    }
}
