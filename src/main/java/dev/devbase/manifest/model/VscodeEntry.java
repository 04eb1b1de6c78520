package dev.devbase.manifest.model;

import java.util.Objects;
import java.util.Set;

/**
 * VS Code extension; the name is the marketplace extension id.
 */
public record VscodeEntry(String name, Set<String> tags, String version) implements PackageEntry {
    public VscodeEntry {
        Objects.requireNonNull(name, "name");
        tags = Tags.copyOf(tags);
        version = version == null ? "" : version;
    }

    @Override
    public Category category() {
        return Category.VSCODE;
    }
}
