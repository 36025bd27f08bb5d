package com.conveyor.orchestrator.stage;

import com.conveyor.orchestrator.model.StageResult;
import com.conveyor.orchestrator.model.StageSpec;
import com.conveyor.orchestrator.model.StageState;
import com.conveyor.orchestrator.support.Sleeper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one stage to a terminal result.
 *
 * <p>Each attempt runs the stage's {@link StageAction} on its own thread and
 * waits at most the stage timeout for it. When the timeout elapses the attempt
 * thread is interrupted, which makes command actions destroy their process
 * tree, and the attempt counts as TIMED_OUT.
 *
 * <p>A FAILED or TIMED_OUT attempt is repeated up to {@code retryCount} times,
 * sleeping {@link Backoff#delayBefore(int)} in between. Only the final
 * attempt's result is returned, together with the number of attempts made.
 *
 * <p>The executor never touches the Run. It blocks the calling worker thread;
 * interrupting that thread (run cancelled) aborts the current attempt or
 * backoff and yields a SKIPPED result.
 *
 * Metrics:
 * <pre>
 *   conveyor.stage.attempts{classification, state}
 *   conveyor.stage.duration{classification, state}
 * </pre>
 */
@Component
public class StageExecutor {

    private static final Logger log = LoggerFactory.getLogger(StageExecutor.class);

    private final StageActionRegistry actions;
    private final Backoff             backoff;
    private final Clock               clock;
    private final Sleeper             sleeper;
    private final MeterRegistry       meterRegistry;
    private final ExecutorService     attemptThreads;

    public StageExecutor(StageActionRegistry actions,
                         Backoff backoff,
                         Clock clock,
                         Sleeper sleeper,
                         MeterRegistry meterRegistry) {
        this.actions       = actions;
        this.backoff       = backoff;
        this.clock         = clock;
        this.sleeper       = sleeper;
        this.meterRegistry = meterRegistry;

        CustomizableThreadFactory threads = new CustomizableThreadFactory("stage-attempt-");
        threads.setDaemon(true);
        this.attemptThreads = Executors.newCachedThreadPool(threads);
    }

    /**
     * Execute a stage whose dependencies have all succeeded.
     *
     * @return terminal result of the final attempt; never null
     */
    public StageResult execute(StageSpec spec, StageContext ctx) {
        MDC.put("runId", ctx.runId().toString());
        MDC.put("pipeline", ctx.pipeline());
        MDC.put("stage", spec.name());
        Timer.Sample sample = Timer.start(meterRegistry);
        int maxAttempts = spec.retryCount() + 1;
        int attempt = 0;
        StageResult result = null;
        try {
            while (attempt < maxAttempts) {
                attempt++;
                MDC.put("attempt", String.valueOf(attempt));
                if (attempt > 1) {
                    Duration delay = backoff.delayBefore(attempt - 1);
                    log.info("Retrying stage '{}' in {} (attempt {}/{})", spec.name(), delay, attempt, maxAttempts);
                    sleeper.sleep(delay);
                }
                result = runAttempt(spec, ctx, attempt);
                meterRegistry.counter("conveyor.stage.attempts",
                        "classification", tag(spec), "state", result.state().name()).increment();
                if (result.succeeded()) {
                    break;
                }
                log.warn("Stage '{}' attempt {}/{} ended {}: {}",
                        spec.name(), attempt, maxAttempts, result.state(), abbreviate(result.output()));
            }
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Stage '{}' cancelled during attempt {}", spec.name(), attempt);
            result = StageResult.cancelled(attempt, clock.instant());
            return result;
        } finally {
            if (result != null) {
                sample.stop(meterRegistry.timer("conveyor.stage.duration",
                        "classification", tag(spec), "state", result.state().name()));
            }
            MDC.remove("attempt");
            MDC.remove("stage");
            MDC.remove("pipeline");
            MDC.remove("runId");
        }
    }

    /** Stop the attempt threads; in-flight attempts are interrupted. */
    @PreDestroy
    public void shutdown() {
        attemptThreads.shutdownNow();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private StageResult runAttempt(StageSpec spec, StageContext ctx, int attempt) throws InterruptedException {
        StageAction action = actions.get(spec.action().type());
        Map<String, String> mdc = MDC.getCopyOfContextMap();

        Future<ActionOutcome> future = attemptThreads.submit(() -> {
            if (mdc != null) MDC.setContextMap(mdc);
            try {
                return action.perform(spec, ctx);
            } finally {
                MDC.clear();
            }
        });

        try {
            ActionOutcome outcome = future.get(spec.timeout().toMillis(), TimeUnit.MILLISECONDS);
            StageState state = outcome.succeeded() ? StageState.SUCCEEDED : StageState.FAILED;
            return new StageResult(state, attempt, outcome.exitCode(), outcome.output(),
                    outcome.artifact(), outcome.outputRef(), clock.instant());
        } catch (TimeoutException e) {
            future.cancel(true);
            return new StageResult(StageState.TIMED_OUT, attempt, null,
                    "Stage exceeded its timeout of " + spec.timeout() + " and was terminated",
                    null, null, clock.instant());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Stage '{}' action '{}' threw {}", spec.name(), action.type(), cause.toString(), cause);
            return StageResult.failed(attempt,
                    cause.getClass().getSimpleName() + ": " + cause.getMessage(), clock.instant());
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    private static String tag(StageSpec spec) {
        return spec.classification().name().toLowerCase();
    }

    private static String abbreviate(String output) {
        if (output == null) return "(no output)";
        String trimmed = output.strip();
        return trimmed.length() <= 200 ? trimmed : "..." + trimmed.substring(trimmed.length() - 200);
    }
}
