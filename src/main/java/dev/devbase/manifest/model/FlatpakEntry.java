package dev.devbase.manifest.model;

import java.util.Objects;
import java.util.Set;

public record FlatpakEntry(String name, Set<String> tags, String remote) implements PackageEntry {
    public static final String DEFAULT_REMOTE = "flathub";

    public FlatpakEntry {
        Objects.requireNonNull(name, "name");
        tags = Tags.copyOf(tags);
        remote = remote == null || remote.isEmpty() ? DEFAULT_REMOTE : remote;
    }

    @Override
    public Category category() {
        return Category.FLATPAK;
    }
}
