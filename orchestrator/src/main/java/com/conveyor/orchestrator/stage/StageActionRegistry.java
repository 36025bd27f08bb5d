package com.conveyor.orchestrator.stage;

import com.conveyor.orchestrator.model.PipelineDefinition;
import com.conveyor.orchestrator.model.StageSpec;
import com.conveyor.orchestrator.pipeline.DefinitionInvalidException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process registry of {@link StageAction}s, keyed by action type.
 *
 * Every {@code StageAction} bean is collected at startup; adding a new kind of
 * stage only requires declaring another action bean.
 */
@Component
public class StageActionRegistry {

    private static final Logger log = LoggerFactory.getLogger(StageActionRegistry.class);

    private final Map<String, StageAction> actions = new ConcurrentHashMap<>();

    public StageActionRegistry(List<StageAction> allActions) {
        for (StageAction action : allActions) {
            StageAction previous = actions.putIfAbsent(action.type(), action);
            if (previous != null) {
                throw new IllegalStateException("Two stage actions registered for type '" + action.type()
                        + "': " + previous.getClass().getSimpleName() + " and " + action.getClass().getSimpleName());
            }
            log.info("Registered stage action '{}' ({})", action.type(), action.getClass().getSimpleName());
        }
    }

    public StageAction get(String type) {
        StageAction action = actions.get(type);
        if (action == null) {
            throw new StageActionNotFoundException(type);
        }
        return action;
    }

    public boolean contains(String type) {
        return actions.containsKey(type);
    }

    /** Registered action types (sorted). */
    public List<String> types() {
        return actions.keySet().stream().sorted().toList();
    }

    /**
     * Check that every stage names a registered action and that the action accepts it.
     *
     * @throws DefinitionInvalidException listing every problem found
     */
    public void checkDefinition(PipelineDefinition definition) {
        List<String> problems = new ArrayList<>();
        for (StageSpec spec : definition.stages()) {
            StageAction action = actions.get(spec.action().type());
            if (action == null) {
                problems.add("stage '" + spec.name() + "' uses unknown action '" + spec.action().type() + "'");
            } else {
                problems.addAll(action.problems(spec, definition));
            }
        }
        if (!problems.isEmpty()) {
            throw new DefinitionInvalidException(definition.name(), problems);
        }
    }
}
