package dev.devbase.manifest.resolve;

import dev.devbase.manifest.model.Scope;

/**
 * One manifest sub-tree to read entries from: {@code <scope>.<key>}.
 */
public record ScopeSection(Scope scope, String key) {
    public String path() {
        return scope.path() + "." + key;
    }
}
