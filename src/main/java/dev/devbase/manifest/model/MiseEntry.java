package dev.devbase.manifest.model;

import java.util.Objects;
import java.util.Set;

/**
 * Tool managed by mise. {@code backend} overrides the registry key (e.g. {@code aqua:mikefarah/yq}).
 */
public record MiseEntry(String name, Set<String> tags, String version, String backend) implements PackageEntry {
    public MiseEntry {
        Objects.requireNonNull(name, "name");
        tags = Tags.copyOf(tags);
        version = version == null ? "" : version;
        backend = backend == null ? "" : backend;
    }

    public String toolKey() {
        return backend.isEmpty() ? name : backend;
    }

    @Override
    public Category category() {
        return Category.MISE;
    }

    @Override
    public String outputKey() {
        return toolKey();
    }
}
