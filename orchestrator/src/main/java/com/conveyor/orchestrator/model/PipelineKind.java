package com.conveyor.orchestrator.model;

/**
 * CI pipelines build and publish an artifact and may have a downstream pipeline;
 * CD pipelines consume an artifact and deploy it.
 */
public enum PipelineKind {
    CI,
    CD
}
