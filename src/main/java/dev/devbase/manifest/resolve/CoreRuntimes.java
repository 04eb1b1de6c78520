package dev.devbase.manifest.resolve;

import dev.devbase.manifest.api.PackSelection;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Language runtimes implied by each well-known pack, used to order runtime installation.
 */
public final class CoreRuntimes {
    private static final Map<String, List<String>> RUNTIMES = Map.of(
        "java", List.of("java", "maven", "gradle"),
        "node", List.of("node"),
        "python", List.of("python"),
        "go", List.of("go"),
        "ruby", List.of("ruby"),
        "rust", List.of("rust")
    );

    private CoreRuntimes() {}

    public static List<String> forPacks(PackSelection packs) {
        var runtimes = new ArrayList<String>();
        for (String pack : packs.packs()) {
            runtimes.addAll(RUNTIMES.getOrDefault(pack, List.of()));
        }
        return runtimes;
    }
}
