package com.conveyor.orchestrator.model;

import com.conveyor.orchestrator.pipeline.PipelineGraph;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * One instantiation of a {@link PipelineDefinition}.
 *
 * A Run owns one {@link Stage} per StageSpec, kept in topological order. Its
 * state is advanced by exactly one thread (the run driver); other threads see
 * the Run through {@link RunOutcome} snapshots.
 */
public class Run {

    private final UUID               id;
    private final PipelineDefinition definition;
    private final PipelineGraph      graph;
    private final RunContext         context;
    private final Map<String, Stage> stages = new LinkedHashMap<>();
    private final Instant            createdAt;

    private RunState state = RunState.PENDING;
    private Instant  startedAt;
    private Instant  completedAt;

    public Run(UUID id, PipelineGraph graph, RunContext context, Instant createdAt) {
        this.id         = id;
        this.graph      = graph;
        this.definition = graph.definition();
        this.context    = context;
        this.createdAt  = createdAt;
        for (String name : graph.topologicalOrder()) {
            stages.put(name, new Stage(graph.spec(name)));
        }
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID               getId()          { return id; }
    public PipelineDefinition getDefinition()  { return definition; }
    public PipelineGraph      getGraph()       { return graph; }
    public RunContext         getContext()     { return context; }
    public RunState           getState()       { return state; }
    public Instant            getCreatedAt()   { return createdAt; }
    public Instant            getStartedAt()   { return startedAt; }
    public Instant            getCompletedAt() { return completedAt; }
    public String             getPipeline()    { return definition.name(); }

    public void setState(RunState state)           { this.state = state; }
    public void setStartedAt(Instant startedAt)     { this.startedAt = startedAt; }
    public void setCompletedAt(Instant completedAt) { this.completedAt = completedAt; }

    public Stage stage(String name) {
        Stage stage = stages.get(name);
        if (stage == null) {
            throw new IllegalArgumentException("Run " + id + " has no stage named '" + name + "'");
        }
        return stage;
    }

    /** Stages in topological order. */
    public Collection<Stage> getStages() {
        return Collections.unmodifiableCollection(stages.values());
    }

    public boolean allStagesSucceeded() {
        return stages.values().stream().allMatch(s -> s.getState() == StageState.SUCCEEDED);
    }

    public boolean allStagesTerminal() {
        return stages.values().stream().allMatch(s -> s.getState().isTerminal());
    }

    public List<StageSnapshot> stageSnapshots() {
        return stages.values().stream().map(Stage::snapshot).toList();
    }

    public RunOutcome toOutcome() {
        return new RunOutcome(id, definition.name(), definition.version(), definition.kind(), state,
                context.sourceVersion(), context.artifact(), context.triggeredBy(),
                startedAt, completedAt, stageSnapshots());
    }
}
