package dev.devbase.manifest.api;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered list of selected pack names. Order drives both output order and precedence.
 */
public record PackSelection(List<String> packs) {
    public static final String DEFAULT_PACKS = "java node python go ruby";

    public PackSelection {
        packs = List.copyOf(packs);
    }

    public static PackSelection of(String... packs) {
        return new PackSelection(List.of(packs));
    }

    public static PackSelection defaults() {
        return parse(DEFAULT_PACKS);
    }

    /**
     * Parses a space-separated token list; a blank value selects {@link #DEFAULT_PACKS}.
     */
    public static PackSelection parse(String raw) {
        if (raw == null || raw.isBlank()) {
            raw = DEFAULT_PACKS;
        }
        var names = new ArrayList<String>();
        for (String token : raw.trim().split("\\s+")) {
            if (!token.isEmpty()) {
                names.add(token);
            }
        }
        return new PackSelection(names);
    }

    public boolean isEmpty() {
        return packs.isEmpty();
    }

    @Override
    public String toString() {
        return String.join(" ", packs);
    }
}
