package com.conveyor.orchestrator.platform.dto;

/**
 * Request body for POST /artifacts on the artifact registry.
 */
public record PublishArtifactRequest(
        String name,
        String version,
        String payload_ref
) {}
