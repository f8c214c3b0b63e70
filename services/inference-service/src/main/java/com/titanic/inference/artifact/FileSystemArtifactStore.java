package com.titanic.inference.artifact;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.titanic.inference.config.InferenceProperties;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Component
public class FileSystemArtifactStore implements ArtifactStore {
    private static final Logger log = LoggerFactory.getLogger(FileSystemArtifactStore.class);

    private final Path root;
    private final ObjectMapper objectMapper;

    @Autowired
    public FileSystemArtifactStore(InferenceProperties properties, ObjectMapper objectMapper) {
        this(resolveRoot(properties.getModelsDir()), objectMapper);
    }

    public FileSystemArtifactStore(Path root, ObjectMapper objectMapper) {
        this.root = root.toAbsolutePath().normalize();
        this.objectMapper = objectMapper;
    }

    @Override
    public Path root() {
        return root;
    }

    @Override
    public boolean exists(String name) {
        return Files.isRegularFile(resolve(name));
    }

    @Override
    public ArtifactInfo describe(String name) {
        Path path = resolve(name);
        if (!Files.isRegularFile(path)) {
            return ArtifactInfo.missing(name);
        }
        try {
            BasicFileAttributes attributes = Files.readAttributes(path, BasicFileAttributes.class);
            return new ArtifactInfo(name, true, attributes.size(), attributes.lastModifiedTime().toInstant());
        } catch (IOException ex) {
            log.warn("artifact stat failed name={} error={}", name, ex.getMessage());
            return ArtifactInfo.missing(name);
        }
    }

    @Override
    public <T> T read(String name, Class<T> type) {
        Path path = resolve(name);
        if (!Files.isRegularFile(path)) {
            throw new ArtifactReadException(name, "artifact not found: " + name);
        }
        try (InputStream input = Files.newInputStream(path)) {
            T value = objectMapper.readValue(input, type);
            if (value == null) {
                throw new ArtifactReadException(name, "artifact is empty: " + name);
            }
            log.debug("artifact read name={} type={}", name, type.getSimpleName());
            return value;
        } catch (IOException ex) {
            throw new ArtifactReadException(name, "artifact unreadable: " + name, ex);
        }
    }

    private Path resolve(String name) {
        if (name == null || name.isBlank()) {
            throw new ArtifactReadException(String.valueOf(name), "artifact name required");
        }
        Path resolved = root.resolve(name).normalize();
        if (!resolved.startsWith(root)) {
            throw new ArtifactReadException(name, "artifact outside models directory: " + name);
        }
        return resolved;
    }

    static Path resolveRoot(String path) {
        Path direct = Path.of(path);
        if (Files.exists(direct) || direct.isAbsolute()) {
            return direct;
        }
        Path candidate = direct;
        for (int i = 0; i < 4; i++) {
            if (Files.exists(candidate)) {
                return candidate;
            }
            candidate = Path.of("..").resolve(candidate).normalize();
        }
        return direct;
    }
}
