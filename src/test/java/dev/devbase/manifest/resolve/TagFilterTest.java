package dev.devbase.manifest.resolve;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.devbase.manifest.api.AppStore;
import dev.devbase.manifest.api.ExecutionContext;
import dev.devbase.manifest.model.Tags;
import java.util.Set;
import org.junit.jupiter.api.Test;

class TagFilterTest {
    private static final ExecutionContext WSL = new ExecutionContext("apt", AppStore.NONE, true);
    private static final ExecutionContext DESKTOP = new ExecutionContext("apt", AppStore.SNAP, false);

    @Test
    void skipWslExcludesOnlyUnderWsl() {
        var tags = Tags.of(TagFilter.SKIP_WSL);
        assertTrue(TagFilter.excludes(tags, WSL));
        assertFalse(TagFilter.excludes(tags, DESKTOP));
    }

    @Test
    void untaggedEntriesAreNeverExcluded() {
        assertFalse(TagFilter.excludes(Set.of(), WSL));
        assertFalse(TagFilter.excludes(null, WSL));
    }

    @Test
    void unknownTagsAreIgnored() {
        assertTrue(TagFilter.includes(Tags.of("@gui", "@skip-macos"), WSL));
        assertFalse(TagFilter.excludes(Tags.of("@gui", TagFilter.SKIP_WSL), DESKTOP));
        assertTrue(TagFilter.excludes(Tags.of("@gui", TagFilter.SKIP_WSL), WSL));
    }
}
