package com.titanic.inference.health;

import java.nio.file.Path;

public interface ResourceProbe {
    long freeMemoryBytes();

    /**
     * Usable bytes on the file store holding {@code path}, or -1 when it cannot be read.
     */
    long freeDiskBytes(Path path);
}
