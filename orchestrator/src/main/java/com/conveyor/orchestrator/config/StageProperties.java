package com.conveyor.orchestrator.config;

import com.conveyor.orchestrator.model.ActionDescriptor;
import com.conveyor.orchestrator.model.StageClassification;
import com.conveyor.orchestrator.model.StageSpec;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * One stage of a configured pipeline.
 *
 * Parameter names containing dots need bracket notation in YAML, e.g.
 * {@code params: {"[env.GOFLAGS]": -mod=vendor}}.
 *
 * @param action  action type; "command" when left out
 * @param timeout per-attempt timeout; conveyor.engine.default-stage-timeout when left out
 * @param retries extra attempts after a failure; 0 when left out
 */
public record StageProperties(
        String              name,
        StageClassification classification,
        String              action,
        List<String>        args,
        Map<String, String> params,
        List<String>        dependsOn,
        Duration            timeout,
        Integer             retries
) {

    StageSpec toSpec(Duration defaultTimeout) {
        ActionDescriptor descriptor = new ActionDescriptor(action == null ? "command" : action, args, params);
        return new StageSpec(name, classification, descriptor, dependsOn,
                timeout == null ? defaultTimeout : timeout,
                retries == null ? 0 : retries);
    }
}
