package com.conveyor.orchestrator.model;

import java.time.Instant;

/**
 * One execution of a {@link StageSpec} within a {@link Run}.
 *
 * Owned by its Run. Only the run coordinator's driver thread calls the
 * transition methods; everything else reads immutable {@link StageSnapshot}s.
 */
public class Stage {

    private final StageSpec spec;

    private StageState        state = StageState.PENDING;
    private int               attempts;
    private Instant           startedAt;
    private Instant           finishedAt;
    private Integer           exitCode;
    private String            output;
    private ArtifactReference artifact;
    private String            outputRef;

    public Stage(StageSpec spec) {
        this.spec = spec;
    }

    // ------------------------------------------------------------------
    // Transitions
    // ------------------------------------------------------------------

    public void markRunning(Instant now) {
        requireState(StageState.PENDING, "start");
        this.state     = StageState.RUNNING;
        this.startedAt = now;
    }

    public void complete(StageResult result) {
        requireState(StageState.RUNNING, "complete");
        this.state      = result.state();
        this.attempts   = result.attempts();
        this.exitCode   = result.exitCode();
        this.output     = result.output();
        this.artifact   = result.artifact();
        this.outputRef  = result.outputRef();
        this.finishedAt = result.finishedAt();
    }

    /** PENDING or RUNNING → SKIPPED; a no-op on stages that already finished. */
    public void skip(Instant now, String reason) {
        if (state.isTerminal()) return;
        this.state      = StageState.SKIPPED;
        this.finishedAt = now;
        this.output     = reason;
    }

    private void requireState(StageState expected, String operation) {
        if (state != expected) {
            throw new IllegalStateException("Cannot " + operation + " stage '" + spec.name()
                    + "' in state " + state);
        }
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public StageSpec         getSpec()       { return spec; }
    public String            getName()       { return spec.name(); }
    public StageState        getState()      { return state; }
    public int               getAttempts()   { return attempts; }
    public Instant           getStartedAt()  { return startedAt; }
    public Instant           getFinishedAt() { return finishedAt; }
    public Integer           getExitCode()   { return exitCode; }
    public String            getOutput()     { return output; }
    public ArtifactReference getArtifact()   { return artifact; }
    public String            getOutputRef()  { return outputRef; }

    public StageSnapshot snapshot() {
        return new StageSnapshot(spec.name(), spec.classification(), state, startedAt, finishedAt,
                attempts, exitCode, output, artifact, outputRef);
    }
}
