package dev.devbase.manifest.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Kinds of installable entries a manifest scope can carry.
 */
public enum Category {
    SYSTEM("system"),
    SNAP("snap"),
    FLATPAK("flatpak"),
    MISE("mise"),
    CUSTOM("custom"),
    VSCODE("vscode");

    /**
     * Manager-agnostic half of the system package split.
     */
    public static final String COMMON_KEY = "common";

    private final String key;

    Category(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public boolean isSystem() {
        return this == SYSTEM;
    }

    /**
     * Looks a category up by its manifest key; unknown names are not an error.
     */
    public static Optional<Category> from(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Category category : values()) {
            if (category.key.equals(normalized)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }
}
