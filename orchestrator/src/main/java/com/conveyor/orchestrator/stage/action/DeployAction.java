package com.conveyor.orchestrator.stage.action;

import com.conveyor.orchestrator.model.ArtifactReference;
import com.conveyor.orchestrator.model.PipelineDefinition;
import com.conveyor.orchestrator.model.StageSpec;
import com.conveyor.orchestrator.platform.DeploymentPlatform;
import com.conveyor.orchestrator.platform.Receipt;
import com.conveyor.orchestrator.platform.WorkloadSpec;
import com.conveyor.orchestrator.stage.ActionOutcome;
import com.conveyor.orchestrator.stage.StageAction;
import com.conveyor.orchestrator.stage.StageContext;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Applies a workload running the run's artifact to the deployment platform.
 *
 * Parameters:
 *   workload  workload name (required)
 *   replicas  desired replica count, default 1
 *   selector  label selector, default "app=&lt;workload&gt;"
 *   image     image to run, default the artifact's "id:version"
 *
 * The selector is the stage's output reference, so a later verify stage can
 * pick it up.
 */
@Component
public class DeployAction implements StageAction {

    private final DeploymentPlatform platform;

    public DeployAction(DeploymentPlatform platform) {
        this.platform = platform;
    }

    @Override
    public String type() {
        return "deploy";
    }

    @Override
    public List<String> problems(StageSpec spec, PipelineDefinition pipeline) {
        List<String> problems = new ArrayList<>();
        if (spec.action().param("workload") == null) {
            problems.add("deploy stage '" + spec.name() + "' needs a 'workload' parameter");
        }
        String replicas = spec.action().param("replicas");
        if (replicas != null) {
            try {
                if (Integer.parseInt(replicas) < 1) {
                    problems.add("deploy stage '" + spec.name() + "' needs at least one replica");
                }
            } catch (NumberFormatException e) {
                problems.add("deploy stage '" + spec.name() + "' has a non-numeric replica count '" + replicas + "'");
            }
        }
        return problems;
    }

    @Override
    public ActionOutcome perform(StageSpec spec, StageContext ctx) {
        String workload = spec.action().param("workload");
        int    replicas = Integer.parseInt(spec.action().param("replicas", "1"));
        String selector = selectorOf(spec);

        String image = spec.action().param("image");
        ArtifactReference artifact = ctx.artifact();
        if (image == null) {
            if (artifact == null) {
                return ActionOutcome.failed("Nothing to deploy: run " + ctx.runId() + " carries no artifact");
            }
            image = artifact.coordinates();
        }

        Map<String, String> labels = artifact == null
                ? Map.of("conveyor/run", ctx.runId().toString())
                : Map.of("conveyor/run", ctx.runId().toString(), "conveyor/version", artifact.version());
        Receipt receipt = platform.apply(new WorkloadSpec(workload, image, replicas, selector, labels));
        if (!receipt.accepted()) {
            return ActionOutcome.failed("Platform rejected workload " + workload + ": " + receipt.reason());
        }
        return ActionOutcome.produced(selector,
                "Applied " + workload + " (" + image + ", " + replicas + " replicas, selector " + selector + ")");
    }

    static String selectorOf(StageSpec spec) {
        return spec.action().param("selector", "app=" + spec.action().param("workload"));
    }
}
