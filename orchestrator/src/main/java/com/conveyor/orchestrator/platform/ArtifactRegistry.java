package com.conveyor.orchestrator.platform;

/**
 * Accepts named, versioned build artifacts. Consumed by publish stages.
 */
public interface ArtifactRegistry {

    /**
     * @param payloadRef where the build left the artifact (path or URL)
     * @throws PlatformException when the registry cannot be reached or fails unexpectedly
     */
    Receipt publish(String name, String version, String payloadRef);
}
