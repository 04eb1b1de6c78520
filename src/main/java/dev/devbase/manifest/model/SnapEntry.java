package dev.devbase.manifest.model;

import java.util.Objects;
import java.util.Set;

/**
 * Snap package; {@code options} is passed verbatim to {@code snap install} (e.g. {@code --classic}).
 */
public record SnapEntry(String name, Set<String> tags, String options) implements PackageEntry {
    public SnapEntry {
        Objects.requireNonNull(name, "name");
        tags = Tags.copyOf(tags);
        options = options == null ? "" : options;
    }

    @Override
    public Category category() {
        return Category.SNAP;
    }
}
