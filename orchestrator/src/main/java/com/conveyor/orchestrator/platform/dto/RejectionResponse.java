package com.conveyor.orchestrator.platform.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Body of a 4xx answer from the registry or the platform.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RejectionResponse(String reason) {}
