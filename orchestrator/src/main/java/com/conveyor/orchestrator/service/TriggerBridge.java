package com.conveyor.orchestrator.service;

import com.conveyor.orchestrator.model.ArtifactReference;
import com.conveyor.orchestrator.model.PipelineDefinition;
import com.conveyor.orchestrator.model.PipelineKind;
import com.conveyor.orchestrator.model.Run;
import com.conveyor.orchestrator.model.RunContext;
import com.conveyor.orchestrator.model.RunState;
import com.conveyor.orchestrator.model.Stage;
import com.conveyor.orchestrator.model.StageClassification;
import com.conveyor.orchestrator.model.StageState;
import com.conveyor.orchestrator.pipeline.DefinitionInvalidException;
import com.conveyor.orchestrator.pipeline.PipelineCatalog;
import com.conveyor.orchestrator.pipeline.UnknownPipelineException;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Starts the delivery run that follows a successful CI run.
 *
 * Fires when a run SUCCEEDED, its pipeline is of kind CI and a downstream
 * pipeline is configured for it. The downstream run is started with the
 * upstream's source version and its single published artifact; the bridge
 * does not wait for it, and never changes the upstream outcome.
 *
 * Metrics: conveyor.trigger.events{result}
 */
@Component
public class TriggerBridge {

    private static final Logger log = LoggerFactory.getLogger(TriggerBridge.class);

    private final RunCoordinator  coordinator;
    private final PipelineCatalog catalog;
    private final TriggerSettings settings;
    private final MeterRegistry   meterRegistry;

    public TriggerBridge(RunCoordinator coordinator,
                         PipelineCatalog catalog,
                         TriggerSettings settings,
                         MeterRegistry meterRegistry) {
        this.coordinator   = coordinator;
        this.catalog       = catalog;
        this.settings      = settings;
        this.meterRegistry = meterRegistry;

        settings.downstreamByUpstream().forEach((upstream, downstream) -> {
            catalog.get(upstream);
            catalog.get(downstream);
        });
    }

    @EventListener
    public void handle(RunCompletedEvent event) {
        try {
            onRunCompleted(event.run());
        } catch (AmbiguousArtifactException e) {
            count("ambiguous_artifact");
            log.error("Not triggering delivery: {}", e.getMessage());
        } catch (DefinitionInvalidException | UnknownPipelineException e) {
            count("invalid_downstream");
            log.error("Could not start delivery after run {}: {}", event.run().getId(), e.getMessage());
        }
    }

    /**
     * React to a completed run.
     *
     * @return handle of the downstream run, empty if none was due
     * @throws AmbiguousArtifactException if the run published no artifact or several
     */
    public Optional<RunHandle> onRunCompleted(Run run) {
        PipelineDefinition upstream = run.getDefinition();
        if (run.getState() != RunState.SUCCEEDED || upstream.kind() != PipelineKind.CI) {
            return Optional.empty();
        }
        Optional<String> downstreamName = settings.downstreamOf(upstream.name());
        if (downstreamName.isEmpty()) {
            count("no_downstream");
            log.debug("No downstream pipeline configured for '{}'", upstream.name());
            return Optional.empty();
        }

        ArtifactReference artifact = publishedArtifact(run);
        PipelineDefinition downstream = catalog.get(downstreamName.get());
        RunContext context = new RunContext(run.getContext().sourceVersion(), artifact, run.getId(),
                run.getContext().parameters());

        RunHandle handle = coordinator.start(downstream, context);
        count("triggered");
        log.info("Run {} of '{}' triggered '{}' run {} with {}", run.getId(), upstream.name(),
                downstream.name(), handle.runId(), artifact.coordinates());
        return Optional.of(handle);
    }

    private static ArtifactReference publishedArtifact(Run run) {
        List<ArtifactReference> published = run.getStages().stream()
                .filter(s -> s.getSpec().classification() == StageClassification.PUBLISH)
                .filter(s -> s.getState() == StageState.SUCCEEDED)
                .map(Stage::getArtifact)
                .filter(Objects::nonNull)
                .toList();
        if (published.size() != 1) {
            throw new AmbiguousArtifactException(run.getId(), published.size());
        }
        return published.get(0);
    }

    private void count(String result) {
        meterRegistry.counter("conveyor.trigger.events", "result", result).increment();
    }
}
