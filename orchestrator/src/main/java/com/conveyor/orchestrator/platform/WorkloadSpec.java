package com.conveyor.orchestrator.platform;

import java.util.Map;

/**
 * Desired state of a workload on the deployment platform.
 *
 * @param selector label selector the platform uses to find the workload's replicas
 */
public record WorkloadSpec(
        String              name,
        String              image,
        int                 replicas,
        String              selector,
        Map<String, String> labels
) {

    public WorkloadSpec {
        labels = labels == null ? Map.of() : Map.copyOf(labels);
    }
}
