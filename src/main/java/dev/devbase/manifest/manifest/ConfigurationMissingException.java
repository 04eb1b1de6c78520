package dev.devbase.manifest.manifest;

import java.nio.file.Path;

/**
 * The base manifest does not exist; nothing can be resolved.
 */
public final class ConfigurationMissingException extends ManifestException {
    public ConfigurationMissingException(Path path) {
        super("Package configuration not found: " + path, path);
    }
}
