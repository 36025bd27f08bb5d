package com.conveyor.orchestrator.service;

import com.conveyor.orchestrator.ledger.RunLedger;
import com.conveyor.orchestrator.model.ArtifactReference;
import com.conveyor.orchestrator.model.Run;
import com.conveyor.orchestrator.model.RunOutcome;
import com.conveyor.orchestrator.model.RunState;
import com.conveyor.orchestrator.model.Stage;
import com.conveyor.orchestrator.model.StageResult;
import com.conveyor.orchestrator.model.StageSpec;
import com.conveyor.orchestrator.model.StageState;
import com.conveyor.orchestrator.pipeline.PipelineGraph;
import com.conveyor.orchestrator.platform.MetricsSink;
import com.conveyor.orchestrator.stage.StageContext;
import com.conveyor.orchestrator.stage.StageExecutor;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Drives one Run from PENDING to a terminal state.
 *
 * The driver thread is the only writer of the Run. It dispatches every
 * runnable stage to the shared worker pool and then waits on its completion
 * queue; workers put their {@link StageResult} on the queue and never touch
 * the Run. A cancel request is one more message on the same queue.
 */
class RunDriver implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(RunDriver.class);

    /** One message on the completion queue: a stage result, or {@link #CANCEL}. */
    private record Signal(String stage, StageResult result) {}

    private static final Signal CANCEL = new Signal(null, null);

    private final Run               run;
    private final RunHandle         handle;
    private final StageExecutor     stageExecutor;
    private final ExecutorService   workers;
    private final RunLedger         ledger;
    private final RunEventPublisher events;
    private final MetricsSink       sink;
    private final MeterRegistry     meterRegistry;
    private final Clock             clock;
    private final Runnable          onClose;

    private final BlockingQueue<Signal> completions = new LinkedBlockingQueue<>();
    private final Map<String, Future<?>> inFlight   = new LinkedHashMap<>();

    // guarded by this
    private boolean cancelRequested;
    private boolean closed;

    private volatile RunOutcome latest;

    RunDriver(Run run,
              StageExecutor stageExecutor,
              ExecutorService workers,
              RunLedger ledger,
              RunEventPublisher events,
              MetricsSink sink,
              MeterRegistry meterRegistry,
              Clock clock,
              Runnable onClose) {
        this.run           = run;
        this.handle        = new RunHandle(run.getId(), run.getPipeline());
        this.stageExecutor = stageExecutor;
        this.workers       = workers;
        this.ledger        = ledger;
        this.events        = events;
        this.sink          = sink;
        this.meterRegistry = meterRegistry;
        this.clock         = clock;
        this.onClose       = onClose;
        this.latest        = run.toOutcome();
    }

    RunHandle handle() {
        return handle;
    }

    /** Latest published view of the run; safe from any thread. */
    RunOutcome snapshot() {
        return latest;
    }

    /**
     * Ask the driver to cancel the run.
     *
     * @return false if the run already reached its terminal state
     */
    synchronized boolean requestCancel() {
        if (closed) return false;
        if (!cancelRequested) {
            cancelRequested = true;
            completions.add(CANCEL);
        }
        return true;
    }

    // ------------------------------------------------------------------
    // Driver loop
    // ------------------------------------------------------------------

    @Override
    public void run() {
        MDC.put("runId", run.getId().toString());
        MDC.put("pipeline", run.getPipeline());
        try {
            run.setState(RunState.RUNNING);
            run.setStartedAt(clock.instant());
            log.info("Run started: {} stages {}", run.getPipeline(), run.getGraph().topologicalOrder());
            dispatchRunnable();
            publishSnapshot();

            while (!inFlight.isEmpty()) {
                Signal signal = completions.take();
                if (signal == CANCEL) {
                    cancelInFlight();
                    break;
                }
                applyResult(signal);
                dispatchRunnable();
                publishSnapshot();
            }
        } catch (InterruptedException e) {
            log.warn("Driver of run {} interrupted; cancelling the run", run.getId());
            synchronized (this) {
                cancelRequested = true;
            }
            cancelInFlight();
        } catch (RuntimeException e) {
            log.error("Driver of run {} failed: {}", run.getId(), e.getMessage(), e);
            cancelInFlight();
            skipRemaining("run aborted: " + e.getMessage());
        }

        try {
            finish();
        } catch (RuntimeException e) {
            log.error("Could not complete run {}: {}", run.getId(), e.getMessage(), e);
            onClose.run();
            handle.outcome().completeExceptionally(e);
        } finally {
            MDC.remove("pipeline");
            MDC.remove("runId");
        }
    }

    private void dispatchRunnable() {
        synchronized (this) {
            if (cancelRequested) return;
        }
        PipelineGraph graph = run.getGraph();
        for (Stage stage : run.getStages()) {
            if (stage.getState() != StageState.PENDING) continue;
            boolean ready = graph.dependenciesOf(stage.getName()).stream()
                    .allMatch(dep -> run.stage(dep).getState() == StageState.SUCCEEDED);
            if (ready) {
                dispatch(stage);
            }
        }
    }

    private void dispatch(Stage stage) {
        StageSpec    spec = stage.getSpec();
        StageContext ctx  = contextFor(spec);
        stage.markRunning(clock.instant());
        log.info("Dispatching stage '{}' ({})", spec.name(), spec.classification());

        Future<?> future = workers.submit(() -> {
            StageResult result;
            try {
                result = stageExecutor.execute(spec, ctx);
            } catch (RuntimeException e) {
                log.error("Stage '{}' of run {} crashed: {}", spec.name(), ctx.runId(), e.getMessage(), e);
                result = StageResult.failed(1, e.getClass().getSimpleName() + ": " + e.getMessage(), clock.instant());
            }
            completions.add(new Signal(spec.name(), result));
        });
        inFlight.put(spec.name(), future);
    }

    private StageContext contextFor(StageSpec spec) {
        List<ArtifactReference> upstream = new ArrayList<>();
        for (String dep : run.getGraph().transitiveDependenciesOf(spec.name())) {
            ArtifactReference artifact = run.stage(dep).getArtifact();
            if (artifact != null) upstream.add(artifact);
        }
        return new StageContext(run.getId(), run.getPipeline(), run.getContext(), upstream,
                run.getDefinition().healthCheck());
    }

    private void applyResult(Signal signal) {
        inFlight.remove(signal.stage());
        Stage stage = run.stage(signal.stage());
        if (stage.getState() != StageState.RUNNING) {
            return;
        }
        StageResult result = signal.result();
        stage.complete(result);
        log.info("Stage '{}' {} after {} attempt(s)", stage.getName(), result.state(), result.attempts());
        shipOutput(stage);

        if (result.state().blocksDependents()) {
            String reason = "upstream stage '" + stage.getName() + "' " + result.state();
            for (String dependent : run.getGraph().transitiveDependentsOf(stage.getName())) {
                Stage d = run.stage(dependent);
                if (d.getState() == StageState.PENDING) {
                    d.skip(clock.instant(), reason);
                    log.info("Stage '{}' SKIPPED: {}", dependent, reason);
                }
            }
        }
    }

    private void cancelInFlight() {
        log.info("Cancelling run {}: interrupting {}", run.getId(), inFlight.keySet());
        inFlight.values().forEach(f -> f.cancel(true));
        inFlight.clear();
        skipRemaining("run cancelled");
    }

    private void skipRemaining(String reason) {
        Instant now = clock.instant();
        for (Stage stage : run.getStages()) {
            stage.skip(now, reason);
        }
    }

    // ------------------------------------------------------------------
    // Completion
    // ------------------------------------------------------------------

    private void finish() {
        boolean cancelled;
        synchronized (this) {
            closed    = true;
            cancelled = cancelRequested;
        }
        if (!run.allStagesTerminal()) {
            skipRemaining(cancelled ? "run cancelled" : "unreachable");
        }

        RunState state = cancelled ? RunState.CANCELLED
                : run.allStagesSucceeded() ? RunState.SUCCEEDED
                : RunState.FAILED;
        run.setState(state);
        run.setCompletedAt(clock.instant());
        RunOutcome outcome = run.toOutcome();
        latest = outcome;

        Duration took = Duration.between(run.getStartedAt(), run.getCompletedAt());
        log.info("Run {} of '{}' finished {} in {}", run.getId(), run.getPipeline(), state, took);
        meterRegistry.counter("conveyor.run.outcomes",
                "pipeline", run.getPipeline(), "outcome", state.name()).increment();
        sink.ingestSamples(List.of(new MetricsSink.Sample("conveyor.run.duration.seconds",
                took.toMillis() / 1000.0,
                Map.of("pipeline", run.getPipeline(), "outcome", state.name()),
                run.getCompletedAt())));

        ledger.record(run);
        onClose.run();

        try {
            events.publish(new RunCompletedEvent(run, outcome));
        } catch (RuntimeException e) {
            log.error("A listener failed on completion of run {}: {}", run.getId(), e.getMessage(), e);
        }
        handle.outcome().complete(outcome);
    }

    private void publishSnapshot() {
        latest = run.toOutcome();
    }

    private void shipOutput(Stage stage) {
        String output = stage.getOutput();
        if (output == null || output.isEmpty()) return;
        String prefix = "[" + run.getId() + "/" + stage.getName() + "] ";
        List<String> lines = output.lines().map(line -> prefix + line).toList();
        sink.ingestLogs(lines);
    }
}
