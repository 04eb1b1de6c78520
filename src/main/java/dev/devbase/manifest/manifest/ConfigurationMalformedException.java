package dev.devbase.manifest.manifest;

import java.nio.file.Path;

/**
 * A manifest document exists but could not be parsed into a mapping.
 */
public final class ConfigurationMalformedException extends ManifestException {
    public ConfigurationMalformedException(String message, Path path) {
        super(message, path);
    }

    public ConfigurationMalformedException(String message, Path path, Throwable cause) {
        super(message, path, cause);
    }
}
