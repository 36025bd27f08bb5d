package com.conveyor.orchestrator.stage.action;

import com.conveyor.orchestrator.health.HealthGate;
import com.conveyor.orchestrator.health.HealthOutcome;
import com.conveyor.orchestrator.model.HealthCheckPolicy;
import com.conveyor.orchestrator.model.PipelineDefinition;
import com.conveyor.orchestrator.model.StageSpec;
import com.conveyor.orchestrator.stage.ActionOutcome;
import com.conveyor.orchestrator.stage.StageAction;
import com.conveyor.orchestrator.stage.StageContext;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Gates the run on the health of a deployed workload.
 *
 * Uses the pipeline's health check policy; a {@code selector} parameter
 * overrides the policy's selector. The stage timeout must cover the policy's
 * maximum wait.
 */
@Component
public class VerifyAction implements StageAction {

    private final HealthGate healthGate;

    public VerifyAction(HealthGate healthGate) {
        this.healthGate = healthGate;
    }

    @Override
    public String type() {
        return "verify";
    }

    @Override
    public List<String> problems(StageSpec spec, PipelineDefinition pipeline) {
        if (pipeline.healthCheck() == null) {
            return List.of("verify stage '" + spec.name() + "' needs a health-check policy on pipeline '"
                    + pipeline.name() + "'");
        }
        HealthCheckPolicy policy = pipeline.healthCheck();
        List<String> problems = new ArrayList<>();
        if (policy.selector() == null && spec.action().param("selector") == null) {
            problems.add("verify stage '" + spec.name() + "' has no selector to check");
        }
        if (spec.timeout().compareTo(policy.maxWait()) < 0) {
            problems.add("verify stage '" + spec.name() + "' times out after " + spec.timeout()
                    + ", before the health check's maximum wait of " + policy.maxWait());
        }
        return problems;
    }

    @Override
    public ActionOutcome perform(StageSpec spec, StageContext ctx) throws InterruptedException {
        HealthCheckPolicy policy = ctx.healthCheck();
        if (policy == null) {
            return ActionOutcome.failed("Pipeline " + ctx.pipeline() + " has no health check policy");
        }
        String selector = spec.action().param("selector", policy.selector());

        HealthOutcome outcome = healthGate.verify(policy, selector);
        String summary = selector + " " + outcome.status().name().toLowerCase() + " after "
                + outcome.polls() + " polls (" + outcome.diagnostic() + ")";
        return outcome.healthy() ? ActionOutcome.succeeded(summary) : ActionOutcome.failed(summary);
    }
}
