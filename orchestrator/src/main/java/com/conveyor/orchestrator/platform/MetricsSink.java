package com.conveyor.orchestrator.platform;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * External time-series and log sink. Fire-and-forget: the engine never reads
 * anything back, and implementations must not throw.
 */
public interface MetricsSink {

    record Sample(String series, double value, Map<String, String> tags, Instant at) {
        public Sample {
            tags = tags == null ? Map.of() : Map.copyOf(tags);
        }
    }

    void ingestSamples(List<Sample> samples);

    void ingestLogs(List<String> lines);
}
