package com.conveyor.orchestrator.service;

import com.conveyor.orchestrator.model.Run;
import com.conveyor.orchestrator.model.RunOutcome;

/**
 * Published once per run after its terminal state is fixed and recorded.
 * The run is no longer modified at that point.
 */
public record RunCompletedEvent(Run run, RunOutcome outcome) {}
