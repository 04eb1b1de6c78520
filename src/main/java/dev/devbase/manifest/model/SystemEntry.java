package dev.devbase.manifest.model;

import java.util.Objects;
import java.util.Set;

public record SystemEntry(String name, Set<String> tags) implements PackageEntry {
    public SystemEntry {
        Objects.requireNonNull(name, "name");
        tags = Tags.copyOf(tags);
    }

    @Override
    public Category category() {
        return Category.SYSTEM;
    }
}
