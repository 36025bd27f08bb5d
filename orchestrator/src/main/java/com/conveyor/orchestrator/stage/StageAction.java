package com.conveyor.orchestrator.stage;

import com.conveyor.orchestrator.model.PipelineDefinition;
import com.conveyor.orchestrator.model.StageSpec;

import java.util.List;

/**
 * The work behind a stage: running a command, publishing an artifact,
 * applying a workload, or waiting for it to become healthy.
 *
 * <p>Actions are stateless and shared by every run. They report the outcome
 * of one attempt; timeouts, retries and state transitions belong to the
 * {@link StageExecutor} and the run coordinator.
 *
 * <p>Cancellation and timeouts arrive as a thread interrupt. An action that
 * blocks (a child process, a sleep, an HTTP call) must let the
 * {@link InterruptedException} propagate and release what it started.
 */
public interface StageAction {

    /** Action type that stage descriptors refer to, e.g. "command". */
    String type();

    /**
     * Run one attempt.
     *
     * @return SUCCEEDED or FAILED outcome with diagnostic output
     * @throws InterruptedException when the attempt is timed out or cancelled
     * @throws Exception            any other error; reported as a FAILED attempt
     */
    ActionOutcome perform(StageSpec spec, StageContext ctx) throws Exception;

    /**
     * Problems that make the stage unrunnable no matter what, checked before a
     * run starts. Empty when the stage is well-formed.
     */
    default List<String> problems(StageSpec spec, PipelineDefinition pipeline) {
        return List.of();
    }
}
