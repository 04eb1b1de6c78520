package dev.devbase.manifest.model;

import java.util.Objects;
import java.util.Set;

public record CustomEntry(String name, Set<String> tags, String version, String installer) implements PackageEntry {
    public CustomEntry {
        Objects.requireNonNull(name, "name");
        tags = Tags.copyOf(tags);
        version = version == null ? "" : version;
        installer = installer == null ? "" : installer;
    }

    @Override
    public Category category() {
        return Category.CUSTOM;
    }
}
