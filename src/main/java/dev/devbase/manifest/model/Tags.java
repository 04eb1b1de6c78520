package dev.devbase.manifest.model;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Helpers for entry tag sets. Tag sets keep manifest order so they render the way they were written.
 */
public final class Tags {
    private Tags() {}

    public static Set<String> copyOf(Collection<String> tags) {
        if (tags == null || tags.isEmpty()) {
            return Set.of();
        }
        var copy = new LinkedHashSet<String>();
        for (String tag : tags) {
            if (tag != null && !tag.isBlank()) {
                copy.add(tag.trim());
            }
        }
        return Collections.unmodifiableSet(copy);
    }

    public static Set<String> of(String... tags) {
        return copyOf(Arrays.asList(tags));
    }
}
