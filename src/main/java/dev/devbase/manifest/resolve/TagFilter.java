package dev.devbase.manifest.resolve;

import dev.devbase.manifest.api.ExecutionContext;
import java.util.Set;

/**
 * Per-entry exclusion predicates. Unknown tags are ignored so newer manifests keep working.
 */
public final class TagFilter {
    public static final String SKIP_WSL = "@skip-wsl";

    private TagFilter() {}

    public static boolean excludes(Set<String> tags, ExecutionContext context) {
        if (tags == null || tags.isEmpty()) {
            return false;
        }
        return context.wsl() && tags.contains(SKIP_WSL);
    }

    public static boolean includes(Set<String> tags, ExecutionContext context) {
        return !excludes(tags, context);
    }
}
