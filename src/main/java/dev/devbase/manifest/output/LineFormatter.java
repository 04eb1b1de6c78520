package dev.devbase.manifest.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.devbase.manifest.model.CustomEntry;
import dev.devbase.manifest.model.FlatpakEntry;
import dev.devbase.manifest.model.MiseEntry;
import dev.devbase.manifest.model.PackageEntry;
import dev.devbase.manifest.model.SnapEntry;
import dev.devbase.manifest.model.SystemEntry;
import dev.devbase.manifest.model.VscodeEntry;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Pipe-delimited line form of resolved entries, as read by the shell installers.
 *
 * <pre>
 * system   name
 * snap     name|options
 * flatpak  name|remote
 * mise     toolKey|version
 * custom   name|version|installer|tags
 * vscode   extensionId|version|tags
 * </pre>
 */
public final class LineFormatter {
    private static final ObjectMapper JSON = new ObjectMapper();

    private LineFormatter() {}

    public static List<String> format(List<? extends PackageEntry> entries) {
        var lines = new ArrayList<String>(entries.size());
        for (PackageEntry entry : entries) {
            lines.add(format(entry));
        }
        return lines;
    }

    public static String format(PackageEntry entry) {
        if (entry instanceof SystemEntry system) {
            return system.name();
        }
        if (entry instanceof SnapEntry snap) {
            return join(snap.name(), snap.options());
        }
        if (entry instanceof FlatpakEntry flatpak) {
            return join(flatpak.name(), flatpak.remote());
        }
        if (entry instanceof MiseEntry mise) {
            return join(mise.toolKey(), mise.version());
        }
        if (entry instanceof CustomEntry custom) {
            return join(custom.name(), custom.version(), custom.installer(), renderTags(custom.tags()));
        }
        if (entry instanceof VscodeEntry vscode) {
            return join(vscode.name(), vscode.version(), renderTags(vscode.tags()));
        }
        throw new IllegalArgumentException("Unsupported entry type: " + entry.getClass().getName());
    }

    /**
     * Tags as a flow list ({@code ["@skip-wsl"]}); empty when the entry has none.
     */
    static String renderTags(Set<String> tags) {
        if (tags.isEmpty()) {
            return "";
        }
        try {
            return JSON.writeValueAsString(List.copyOf(tags));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to render tags " + tags, ex);
        }
    }

    private static String join(String... fields) {
        return String.join("|", fields);
    }
}
