package com.conveyor.orchestrator.platform.dto;

import java.util.Map;

/**
 * Request body for POST /workloads on the deployment platform.
 */
public record ApplyWorkloadRequest(
        String              name,
        String              image,
        int                 replicas,
        String              selector,
        Map<String, String> labels
) {}
