package com.conveyor.orchestrator.service;

import com.conveyor.orchestrator.ledger.RunLedger;
import com.conveyor.orchestrator.model.PipelineDefinition;
import com.conveyor.orchestrator.model.Run;
import com.conveyor.orchestrator.model.RunContext;
import com.conveyor.orchestrator.model.RunOutcome;
import com.conveyor.orchestrator.pipeline.DefinitionInvalidException;
import com.conveyor.orchestrator.pipeline.PipelineGraph;
import com.conveyor.orchestrator.platform.MetricsSink;
import com.conveyor.orchestrator.stage.StageActionRegistry;
import com.conveyor.orchestrator.stage.StageExecutor;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Starts, tracks and cancels runs.
 *
 * Every run gets its own driver thread ({@link RunDriver}), which alone
 * mutates the Run. Stages of all runs share one bounded worker pool of
 * {@link EngineSettings#workerCount()} threads, so independent stages run in
 * parallel while the total load stays capped.
 *
 * Once a run is terminal it is recorded in the {@link RunLedger}, a
 * {@link RunCompletedEvent} is published and only then does {@link #await}
 * return.
 *
 * Metrics: conveyor.run.outcomes{pipeline, outcome}, conveyor.runs.active
 */
@Service
public class RunCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RunCoordinator.class);

    private final StageExecutor       stageExecutor;
    private final StageActionRegistry actions;
    private final RunLedger           ledger;
    private final RunEventPublisher   events;
    private final MetricsSink         sink;
    private final MeterRegistry       meterRegistry;
    private final Clock               clock;

    private final ExecutorService workers;
    private final ExecutorService drivers;

    private final Map<UUID, RunDriver> active = new ConcurrentHashMap<>();

    public RunCoordinator(StageExecutor stageExecutor,
                          StageActionRegistry actions,
                          RunLedger ledger,
                          RunEventPublisher events,
                          MetricsSink sink,
                          MeterRegistry meterRegistry,
                          Clock clock,
                          EngineSettings settings) {
        this.stageExecutor = stageExecutor;
        this.actions       = actions;
        this.ledger        = ledger;
        this.events        = events;
        this.sink          = sink;
        this.meterRegistry = meterRegistry;
        this.clock         = clock;

        this.workers = Executors.newFixedThreadPool(settings.workerCount(), new CustomizableThreadFactory("stage-worker-"));
        this.drivers = Executors.newCachedThreadPool(new CustomizableThreadFactory("run-driver-"));

        meterRegistry.gauge("conveyor.runs.active", active, Map::size);
    }

    // ------------------------------------------------------------------
    // start / await / cancel
    // ------------------------------------------------------------------

    /**
     * Validate the definition and start a run of it.
     *
     * @throws DefinitionInvalidException if the definition cannot run; no Run is created
     */
    public RunHandle start(PipelineDefinition definition, RunContext context) {
        PipelineGraph graph = PipelineGraph.compile(definition);
        actions.checkDefinition(definition);

        Run run = new Run(UUID.randomUUID(), graph, context, clock.instant());
        UUID runId = run.getId();
        RunDriver driver = new RunDriver(run, stageExecutor, workers, ledger, events, sink,
                meterRegistry, clock, () -> active.remove(runId));
        active.put(runId, driver);
        drivers.submit(driver);

        log.info("Started run {} of '{}' v{} at {}{}", runId, definition.name(), definition.version(),
                context.sourceVersion(),
                context.triggeredBy() == null ? "" : " (triggered by " + context.triggeredBy() + ")");
        return driver.handle();
    }

    /** Block until the run is terminal and recorded. */
    public RunOutcome await(RunHandle handle) throws InterruptedException {
        try {
            return handle.outcome().get();
        } catch (ExecutionException e) {
            throw unwrap(handle, e);
        }
    }

    /**
     * Block at most {@code timeout} for the run.
     *
     * @throws TimeoutException if the run is still going; it keeps running
     */
    public RunOutcome await(RunHandle handle, Duration timeout) throws InterruptedException, TimeoutException {
        try {
            return handle.outcome().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw unwrap(handle, e);
        }
    }

    public boolean cancel(RunHandle handle) {
        return cancel(handle.runId());
    }

    /**
     * Request cancellation: in-flight stages are interrupted, pending ones
     * skipped, and the run ends CANCELLED.
     *
     * @return false if the run is unknown or already finished
     */
    public boolean cancel(UUID runId) {
        RunDriver driver = active.get(runId);
        if (driver == null) {
            return false;
        }
        boolean requested = driver.requestCancel();
        if (requested) {
            log.info("Cancellation requested for run {}", runId);
        }
        return requested;
    }

    // ------------------------------------------------------------------
    // Live runs
    // ------------------------------------------------------------------

    /** Current view of a run that has not completed yet. */
    public Optional<RunOutcome> find(UUID runId) {
        RunDriver driver = active.get(runId);
        return driver == null ? Optional.empty() : Optional.of(driver.snapshot());
    }

    public List<RunOutcome> activeRuns() {
        return active.values().stream()
                .map(RunDriver::snapshot)
                .sorted(Comparator.comparing(RunOutcome::runId))
                .toList();
    }

    public int activeCount() {
        return active.size();
    }

    /** Cancel every live run and stop the thread pools. */
    @PreDestroy
    public void shutdown() {
        log.info("Shutting down; cancelling {} active run(s)", active.size());
        active.keySet().forEach(this::cancel);
        drivers.shutdown();
        try {
            if (!drivers.awaitTermination(10, TimeUnit.SECONDS)) {
                drivers.shutdownNow();
            }
        } catch (InterruptedException e) {
            drivers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        workers.shutdownNow();
    }

    private static RuntimeException unwrap(RunHandle handle, ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException re) {
            return re;
        }
        return new IllegalStateException("Run " + handle.runId() + " failed", cause);
    }
}
