package dev.devbase.manifest.api;

import java.util.Locale;

/**
 * Desktop app store available on the host, as reported by distro detection.
 */
public enum AppStore {
    SNAP,
    FLATPAK,
    NONE;

    public static AppStore from(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        try {
            return AppStore.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return NONE;
        }
    }
}
