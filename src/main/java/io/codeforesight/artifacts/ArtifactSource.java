package io.codeforesight.artifacts;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Opens artifact locations. {@code classpath:/x} reads a bundled resource, anything else a file.
 */
public final class ArtifactSource {

    private static final String CLASSPATH_PREFIX = "classpath:";

    private ArtifactSource() {
    }

    public static InputStream open(String location) throws ModelLoadException {
        if (location == null || location.isBlank()) {
            throw new ModelLoadException("Artifact location is empty");
        }
        if (location.startsWith(CLASSPATH_PREFIX)) {
            String resource = location.substring(CLASSPATH_PREFIX.length());
            if (!resource.startsWith("/")) {
                resource = "/" + resource;
            }
            InputStream is = ArtifactSource.class.getResourceAsStream(resource);
            if (is == null) {
                throw new ModelLoadException("Artifact not found on classpath: " + resource);
            }
            return is;
        }
        Path path = Path.of(location);
        if (!Files.isRegularFile(path)) {
            throw new ModelLoadException("Artifact not found: " + path);
        }
        try {
            return Files.newInputStream(path);
        } catch (IOException e) {
            throw new ModelLoadException("Cannot read artifact " + path + ": " + e.getMessage(), e);
        }
    }
}
