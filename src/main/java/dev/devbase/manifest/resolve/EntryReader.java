package dev.devbase.manifest.resolve;

import com.fasterxml.jackson.databind.JsonNode;
import dev.devbase.manifest.model.Category;
import dev.devbase.manifest.model.CustomEntry;
import dev.devbase.manifest.model.FlatpakEntry;
import dev.devbase.manifest.model.MiseEntry;
import dev.devbase.manifest.model.PackageEntry;
import dev.devbase.manifest.model.SnapEntry;
import dev.devbase.manifest.model.SystemEntry;
import dev.devbase.manifest.model.Tags;
import dev.devbase.manifest.model.VscodeEntry;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Turns a manifest section ({@code name -> attributes}) into typed entries, in document order.
 *
 * <p>Best effort only: a section that is not a mapping yields nothing, and an entry whose body is not a mapping
 * (e.g. {@code git:} with no value) is read with empty attributes.
 */
public final class EntryReader {
    private EntryReader() {}

    public static List<PackageEntry> read(Category category, JsonNode section) {
        if (section == null || !section.isObject()) {
            return List.of();
        }
        var entries = new ArrayList<PackageEntry>();
        var fields = section.fields();
        while (fields.hasNext()) {
            var field = fields.next();
            String name = field.getKey();
            if (name.isBlank()) {
                continue;
            }
            entries.add(toEntry(category, name, field.getValue()));
        }
        return entries;
    }

    static PackageEntry toEntry(Category category, String name, JsonNode body) {
        Set<String> tags = tags(body);
        switch (category) {
            case SYSTEM:
                return new SystemEntry(name, tags);
            case SNAP:
                return new SnapEntry(name, tags, text(body, "options"));
            case FLATPAK:
                return new FlatpakEntry(name, tags, text(body, "remote"));
            case MISE:
                return new MiseEntry(name, tags, text(body, "version"), text(body, "backend"));
            case CUSTOM:
                return new CustomEntry(name, tags, text(body, "version"), text(body, "installer"));
            case VSCODE:
                return new VscodeEntry(name, tags, text(body, "version"));
            default:
                throw new IllegalArgumentException("Unsupported category: " + category);
        }
    }

    /**
     * Scalar attribute as text; absent, null and structured values read as empty.
     */
    public static String text(JsonNode body, String field) {
        if (body == null || !body.isObject()) {
            return "";
        }
        JsonNode value = body.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            return "";
        }
        return value.asText();
    }

    static Set<String> tags(JsonNode body) {
        if (body == null || !body.isObject()) {
            return Set.of();
        }
        JsonNode raw = body.get("tags");
        if (raw == null || raw.isNull()) {
            return Set.of();
        }
        var tags = new ArrayList<String>();
        if (raw.isArray()) {
            for (JsonNode item : raw) {
                if (item.isValueNode() && !item.isNull()) {
                    tags.add(item.asText());
                }
            }
        } else if (raw.isValueNode()) {
            for (String token : raw.asText().split("[,\\s]+")) {
                if (!token.isEmpty()) {
                    tags.add(token);
                }
            }
        }
        return Tags.copyOf(tags);
    }
}
