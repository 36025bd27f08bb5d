package com.conveyor.orchestrator.platform;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Ships samples and stage output through a dedicated logger ("conveyor.sink"),
 * from where the log shipper forwards them.
 */
public class LoggingMetricsSink implements MetricsSink {

    private static final Logger log  = LoggerFactory.getLogger(LoggingMetricsSink.class);
    private static final Logger sink = LoggerFactory.getLogger("conveyor.sink");

    @Override
    public void ingestSamples(List<Sample> samples) {
        try {
            for (Sample s : samples) {
                sink.info("sample series={} value={} at={} tags={}", s.series(), s.value(), s.at(), s.tags());
            }
        } catch (RuntimeException e) {
            log.warn("Could not ship {} samples: {}", samples.size(), e.getMessage());
        }
    }

    @Override
    public void ingestLogs(List<String> lines) {
        try {
            for (String line : lines) {
                sink.info(line);
            }
        } catch (RuntimeException e) {
            log.warn("Could not ship {} log lines: {}", lines.size(), e.getMessage());
        }
    }
}
