package dev.devbase.manifest.manifest;

import java.nio.file.Path;

/**
 * Base failure raised while loading a package manifest.
 */
public class ManifestException extends RuntimeException {
    private final Path path;

    public ManifestException(String message, Path path) {
        super(message);
        this.path = path;
    }

    public ManifestException(String message, Path path, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
