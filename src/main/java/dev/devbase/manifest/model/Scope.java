package dev.devbase.manifest.model;

import java.util.Objects;

/**
 * One node contributing entries to a resolution: {@code core} or a selected pack.
 */
public record Scope(String name, boolean isCore) {
    private static final Scope CORE = new Scope("core", true);

    public Scope {
        Objects.requireNonNull(name, "name");
    }

    public static Scope core() {
        return CORE;
    }

    public static Scope pack(String name) {
        return new Scope(name, false);
    }

    /**
     * Path of the scope node inside the manifest, e.g. {@code core} or {@code packs.java}.
     */
    public String path() {
        return isCore ? "core" : "packs." + name;
    }
}
