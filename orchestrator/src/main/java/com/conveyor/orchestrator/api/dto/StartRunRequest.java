package com.conveyor.orchestrator.api.dto;

import java.util.Map;

/**
 * Request body for POST /runs.
 *
 * artifactId/artifactVersion are optional; set them to start a delivery
 * pipeline by hand with an artifact that was published earlier.
 */
public record StartRunRequest(
        String              pipeline,
        String              sourceVersion,
        String              artifactId,
        String              artifactVersion,
        Map<String, String> parameters
) {}
