package com.conveyor.orchestrator.stage.action;

import com.conveyor.orchestrator.model.ArtifactReference;
import com.conveyor.orchestrator.model.PipelineDefinition;
import com.conveyor.orchestrator.model.StageSpec;
import com.conveyor.orchestrator.platform.ArtifactRegistry;
import com.conveyor.orchestrator.platform.Receipt;
import com.conveyor.orchestrator.stage.ActionOutcome;
import com.conveyor.orchestrator.stage.StageAction;
import com.conveyor.orchestrator.stage.StageContext;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Publishes a build output to the artifact registry.
 *
 * Parameters: {@code artifact} (required), {@code payload} (reference to the
 * built files), {@code version} (defaults to the run's source version).
 */
@Component
public class PublishAction implements StageAction {

    private final ArtifactRegistry registry;

    public PublishAction(ArtifactRegistry registry) {
        this.registry = registry;
    }

    @Override
    public String type() {
        return "publish";
    }

    @Override
    public List<String> problems(StageSpec spec, PipelineDefinition pipeline) {
        if (spec.action().param("artifact") == null) {
            return List.of("publish stage '" + spec.name() + "' needs an 'artifact' parameter");
        }
        return List.of();
    }

    @Override
    public ActionOutcome perform(StageSpec spec, StageContext ctx) {
        String name    = spec.action().param("artifact");
        String version = spec.action().param("version", ctx.run().sourceVersion());
        String payload = spec.action().param("payload");
        if (version == null) {
            return ActionOutcome.failed("No version to publish " + name + " under: the run has no source version");
        }

        Receipt receipt = registry.publish(name, version, payload);
        if (!receipt.accepted()) {
            return ActionOutcome.failed("Registry rejected " + name + ":" + version + ": " + receipt.reason());
        }
        ArtifactReference artifact = new ArtifactReference(name, version);
        return ActionOutcome.published(artifact, "Published " + artifact.coordinates());
    }
}
