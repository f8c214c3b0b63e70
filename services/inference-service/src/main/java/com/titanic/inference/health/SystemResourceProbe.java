package com.titanic.inference.health;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class SystemResourceProbe implements ResourceProbe {
    private static final Logger log = LoggerFactory.getLogger(SystemResourceProbe.class);

    @Override
    public long freeMemoryBytes() {
        Runtime runtime = Runtime.getRuntime();
        long used = runtime.totalMemory() - runtime.freeMemory();
        return runtime.maxMemory() - used;
    }

    @Override
    public long freeDiskBytes(Path path) {
        try {
            return Files.getFileStore(path).getUsableSpace();
        } catch (IOException ex) {
            log.warn("disk probe failed path={} error={}", path, ex.getMessage());
            return -1L;
        }
    }
}
