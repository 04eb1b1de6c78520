package dev.devbase.manifest.api;

/**
 * A pack offered by the manifest, with its human description.
 */
public record PackInfo(String name, String description) {
    public PackInfo {
        description = description == null ? "" : description;
    }

    public String toLine() {
        return name + "|" + description;
    }
}
