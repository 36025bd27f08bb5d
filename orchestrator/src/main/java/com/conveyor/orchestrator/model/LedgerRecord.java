package com.conveyor.orchestrator.model;

import jakarta.persistence.*;
import org.springframework.data.domain.Persistable;

import java.time.Instant;
import java.util.UUID;

/**
 * Persistent form of a ledger entry.
 *
 * The id is the run id, assigned by the coordinator, so the entity reports
 * itself as new until it was loaded or stored. A second insert of the same
 * run then fails on the primary key instead of silently merging.
 *
 * DB table: ledger_entries  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "ledger_entries")
public class LedgerRecord implements Persistable<UUID> {

    @Id
    @Column(name = "run_id")
    private UUID runId;

    @Column(nullable = false)
    private String pipeline;

    @Column(name = "pipeline_version", nullable = false)
    private String pipelineVersion;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PipelineKind kind;

    @Column(name = "source_version")
    private String sourceVersion;

    @Column(name = "artifact_id")
    private String artifactId;

    @Column(name = "artifact_version")
    private String artifactVersion;

    @Column(name = "triggered_by")
    private UUID triggeredBy;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RunState outcome;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at", nullable = false)
    private Instant completedAt;

    // JSON array of stage snapshots.
    @Column(name = "stages_json", nullable = false, columnDefinition = "TEXT")
    private String stagesJson;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private Instant recordedAt = Instant.now();

    @Transient
    private boolean isNew = true;

    @PostLoad
    @PostPersist
    void markNotNew() {
        this.isNew = false;
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected LedgerRecord() {}   // required by JPA

    public LedgerRecord(UUID runId, String pipeline, String pipelineVersion, PipelineKind kind,
                        RunState outcome, Instant startedAt, Instant completedAt, String stagesJson) {
        this.runId           = runId;
        this.pipeline        = pipeline;
        this.pipelineVersion = pipelineVersion;
        this.kind            = kind;
        this.outcome         = outcome;
        this.startedAt       = startedAt;
        this.completedAt     = completedAt;
        this.stagesJson      = stagesJson;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    @Override public UUID    getId()  { return runId; }
    @Override public boolean isNew()  { return isNew; }

    public UUID         getRunId()           { return runId; }
    public String       getPipeline()        { return pipeline; }
    public String       getPipelineVersion() { return pipelineVersion; }
    public PipelineKind getKind()            { return kind; }
    public String       getSourceVersion()   { return sourceVersion; }
    public String       getArtifactId()      { return artifactId; }
    public String       getArtifactVersion() { return artifactVersion; }
    public UUID         getTriggeredBy()     { return triggeredBy; }
    public RunState     getOutcome()         { return outcome; }
    public Instant      getStartedAt()       { return startedAt; }
    public Instant      getCompletedAt()     { return completedAt; }
    public String       getStagesJson()      { return stagesJson; }
    public Instant      getRecordedAt()      { return recordedAt; }

    public void setSourceVersion(String v)  { this.sourceVersion = v; }
    public void setArtifactId(String v)     { this.artifactId = v; }
    public void setArtifactVersion(String v) { this.artifactVersion = v; }
    public void setTriggeredBy(UUID v)      { this.triggeredBy = v; }
}
