package com.titanic.inference.artifact;

import java.time.Instant;

public record ArtifactInfo(String name, boolean exists, long sizeBytes, Instant lastModified) {
    public static ArtifactInfo missing(String name) {
        return new ArtifactInfo(name, false, 0L, null);
    }
}
