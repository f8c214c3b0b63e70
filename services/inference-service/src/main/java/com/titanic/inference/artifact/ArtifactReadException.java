package com.titanic.inference.artifact;

public class ArtifactReadException extends RuntimeException {
    private final String artifact;

    public ArtifactReadException(String artifact, String message) {
        super(message);
        this.artifact = artifact;
    }

    public ArtifactReadException(String artifact, String message, Throwable cause) {
        super(message, cause);
        this.artifact = artifact;
    }

    public String getArtifact() {
        return artifact;
    }
}
