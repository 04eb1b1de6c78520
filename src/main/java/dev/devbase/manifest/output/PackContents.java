package dev.devbase.manifest.output;

import com.fasterxml.jackson.databind.JsonNode;
import dev.devbase.manifest.api.ExecutionContext;
import dev.devbase.manifest.manifest.ManifestDocument;
import dev.devbase.manifest.model.Category;
import dev.devbase.manifest.model.Scope;
import java.util.ArrayList;
import java.util.List;

/**
 * Human-readable summary of one pack for the pack picker: primary tools by name, then a count of the system
 * packages that come along. Tags are not evaluated here.
 */
public final class PackContents {
    static final String VSCODE_SUFFIX = " (VS Code)";

    private PackContents() {}

    public static List<String> describe(
        ManifestDocument document,
        String pack,
        boolean showVscode,
        ExecutionContext context
    ) {
        var lines = new ArrayList<String>();
        if (!document.hasPack(pack)) {
            return lines;
        }
        Scope scope = Scope.pack(pack);
        lines.addAll(keys(document.section(scope, Category.MISE.key())));
        lines.addAll(keys(document.section(scope, Category.CUSTOM.key())));
        if (showVscode) {
            for (String extension : keys(document.section(scope, Category.VSCODE.key()))) {
                lines.add(extension + VSCODE_SUFFIX);
            }
        }

        int systemCount = count(document.section(scope, Category.COMMON_KEY))
            + count(document.section(scope, context.packageManager()));
        if (systemCount > 0) {
            lines.add("+ " + systemCount + " system packages");
        }
        return lines;
    }

    private static List<String> keys(JsonNode section) {
        var keys = new ArrayList<String>();
        if (section.isObject()) {
            section.fieldNames().forEachRemaining(keys::add);
        }
        return keys;
    }

    private static int count(JsonNode section) {
        return section.isObject() ? section.size() : 0;
    }
}
