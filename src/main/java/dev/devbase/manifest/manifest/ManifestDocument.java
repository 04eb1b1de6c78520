package dev.devbase.manifest.manifest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.devbase.manifest.model.Scope;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Read-only view over the merged manifest ({@code core} plus {@code packs.<name>}).
 *
 * <p>Lookups never fail: absent or oddly shaped nodes come back as {@link MissingNode}.
 */
public final class ManifestDocument {
    private final ObjectNode root;

    public ManifestDocument(ObjectNode root) {
        this.root = Objects.requireNonNull(root, "root").deepCopy();
    }

    /**
     * Returns a copy of the merged tree.
     */
    public ObjectNode toTree() {
        return root.deepCopy();
    }

    public JsonNode core() {
        return root.path("core");
    }

    public JsonNode pack(String name) {
        if (name == null || name.isBlank()) {
            return MissingNode.getInstance();
        }
        return root.path("packs").path(name);
    }

    public boolean hasPack(String name) {
        return pack(name).isObject();
    }

    public List<String> packNames() {
        var packs = root.path("packs");
        var names = new ArrayList<String>();
        if (packs.isObject()) {
            packs.fieldNames().forEachRemaining(names::add);
        }
        return names;
    }

    public String packDescription(String name) {
        var description = pack(name).path("description");
        return description.isValueNode() && !description.isNull() ? description.asText() : "";
    }

    /**
     * Sub-tree {@code <scope>.<key>} (for example {@code core.mise} or {@code packs.java.common}).
     */
    public JsonNode section(Scope scope, String key) {
        var scopeNode = scope.isCore() ? core() : pack(scope.name());
        return scopeNode.path(key);
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof ManifestDocument doc && root.equals(doc.root);
    }

    @Override
    public int hashCode() {
        return root.hashCode();
    }
}
