package com.conveyor.orchestrator.model;

import java.util.Objects;

/**
 * Versioned build output produced by a publish stage.
 *
 * @param id      opaque identifier understood by the artifact registry (e.g. "web-api")
 * @param version version tag the artifact was published under
 */
public record ArtifactReference(String id, String version) {

    public ArtifactReference {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(version, "version");
    }

    /** "id:version", the form used for container images and log lines. */
    public String coordinates() {
        return id + ":" + version;
    }
}
