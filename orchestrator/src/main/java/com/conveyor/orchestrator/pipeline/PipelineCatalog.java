package com.conveyor.orchestrator.pipeline;

import com.conveyor.orchestrator.config.ConveyorProperties;
import com.conveyor.orchestrator.model.PipelineDefinition;
import com.conveyor.orchestrator.stage.StageActionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The pipeline definitions this service knows by name.
 *
 * Every definition is compiled and checked against the registered actions when
 * the catalog is built, so a broken configuration fails start-up rather than
 * the first run.
 */
@Component
public class PipelineCatalog {

    private static final Logger log = LoggerFactory.getLogger(PipelineCatalog.class);

    private final Map<String, PipelineDefinition> definitions = new LinkedHashMap<>();

    @Autowired
    public PipelineCatalog(ConveyorProperties properties, StageActionRegistry actions) {
        this(properties.pipelineDefinitions(), actions);
    }

    public PipelineCatalog(Collection<PipelineDefinition> all, StageActionRegistry actions) {
        for (PipelineDefinition definition : all) {
            PipelineGraph graph = PipelineGraph.compile(definition);
            actions.checkDefinition(definition);
            if (definitions.putIfAbsent(definition.name(), definition) != null) {
                throw new IllegalArgumentException("Pipeline '" + definition.name() + "' is defined twice");
            }
            log.info("Registered pipeline '{}' v{} [{}]: {}",
                    definition.name(), definition.version(), definition.kind(), graph.topologicalOrder());
        }
    }

    public PipelineDefinition get(String name) {
        PipelineDefinition definition = definitions.get(name);
        if (definition == null) {
            throw new UnknownPipelineException(name);
        }
        return definition;
    }

    public Optional<PipelineDefinition> find(String name) {
        return Optional.ofNullable(definitions.get(name));
    }

    public List<PipelineDefinition> all() {
        return List.copyOf(definitions.values());
    }

    public List<String> names() {
        return List.copyOf(definitions.keySet());
    }
}
