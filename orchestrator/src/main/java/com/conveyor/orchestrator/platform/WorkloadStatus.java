package com.conveyor.orchestrator.platform;

/**
 * Replica health of a workload as reported by the platform.
 *
 * @param lastError most recent error reported for the workload, null if none
 */
public record WorkloadStatus(int desiredReplicas, int readyReplicas, String lastError) {

    /** Every desired replica is ready and the platform reports no error. */
    public boolean converged() {
        return desiredReplicas > 0 && readyReplicas == desiredReplicas && lastError == null;
    }

    public String describe() {
        String replicas = "ready " + readyReplicas + "/" + desiredReplicas;
        return lastError == null ? replicas : replicas + ", last error: " + lastError;
    }
}
