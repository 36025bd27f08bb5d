package com.conveyor.orchestrator.service;

import java.util.Map;
import java.util.Optional;

/**
 * Which CD pipeline follows which CI pipeline.
 *
 * @param downstreamByUpstream upstream pipeline name → downstream pipeline name
 */
public record TriggerSettings(Map<String, String> downstreamByUpstream) {

    public TriggerSettings {
        downstreamByUpstream = downstreamByUpstream == null ? Map.of() : Map.copyOf(downstreamByUpstream);
    }

    public Optional<String> downstreamOf(String upstream) {
        return Optional.ofNullable(downstreamByUpstream.get(upstream));
    }
}
