package dev.devbase.manifest.manifest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

/**
 * Deep-merges an overlay document onto a base document.
 *
 * <p>Mappings are merged key by key; any other overlay value (scalar, list or null) replaces the base value
 * wholesale. Keys already present in the base keep their position, new overlay keys are appended in overlay
 * order. Neither input is modified.
 */
public final class ManifestMerger {
    private ManifestMerger() {}

    public static ObjectNode merge(ObjectNode base, ObjectNode overlay) {
        Objects.requireNonNull(base, "base");
        ObjectNode result = base.deepCopy();
        if (overlay == null) {
            return result;
        }
        mergeInto(result, overlay);
        return result;
    }

    private static void mergeInto(ObjectNode target, ObjectNode overlay) {
        Iterator<Map.Entry<String, JsonNode>> fields = overlay.fields();
        while (fields.hasNext()) {
            var field = fields.next();
            String key = field.getKey();
            JsonNode incoming = field.getValue();
            JsonNode existing = target.get(key);
            if (existing instanceof ObjectNode existingObject && incoming instanceof ObjectNode incomingObject) {
                mergeInto(existingObject, incomingObject);
            } else {
                target.set(key, incoming.deepCopy());
            }
        }
    }
}
