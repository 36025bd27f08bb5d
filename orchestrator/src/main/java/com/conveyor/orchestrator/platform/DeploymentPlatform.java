package com.conveyor.orchestrator.platform;

/**
 * The platform workloads are deployed to. Consumed by deploy stages and the
 * health gate.
 */
public interface DeploymentPlatform {

    /** @throws PlatformException when the platform cannot be reached or fails unexpectedly */
    Receipt apply(WorkloadSpec spec);

    /** @throws PlatformException when the platform cannot be reached or fails unexpectedly */
    WorkloadStatus status(String selector);
}
