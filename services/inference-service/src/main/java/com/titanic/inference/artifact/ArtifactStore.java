package com.titanic.inference.artifact;

import java.nio.file.Path;

public interface ArtifactStore {
    Path root();

    boolean exists(String name);

    ArtifactInfo describe(String name);

    <T> T read(String name, Class<T> type);
}
