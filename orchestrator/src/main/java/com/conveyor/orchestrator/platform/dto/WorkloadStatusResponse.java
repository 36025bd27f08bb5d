package com.conveyor.orchestrator.platform.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Response from GET /workloads/{selector}/status.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkloadStatusResponse(
        int    desired_replicas,
        int    ready_replicas,
        String last_error
) {}
