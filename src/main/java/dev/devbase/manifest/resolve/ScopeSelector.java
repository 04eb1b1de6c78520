package dev.devbase.manifest.resolve;

import dev.devbase.manifest.api.ExecutionContext;
import dev.devbase.manifest.api.PackSelection;
import dev.devbase.manifest.model.Category;
import dev.devbase.manifest.model.Scope;
import java.util.ArrayList;
import java.util.List;

/**
 * Enumerates, in resolution order, the manifest sections a category is read from.
 *
 * <p>Core always comes first, then each selected pack in selection order. System packages read two sections per
 * scope: {@code common} followed by the active package manager's key.
 */
public final class ScopeSelector {
    private ScopeSelector() {}

    public static List<Scope> scopes(PackSelection packs) {
        var scopes = new ArrayList<Scope>(packs.packs().size() + 1);
        scopes.add(Scope.core());
        for (String pack : packs.packs()) {
            scopes.add(Scope.pack(pack));
        }
        return scopes;
    }

    public static List<ScopeSection> select(Category category, PackSelection packs, ExecutionContext context) {
        var sections = new ArrayList<ScopeSection>();
        for (Scope scope : scopes(packs)) {
            sections.addAll(sectionsFor(scope, category, context));
        }
        return sections;
    }

    public static List<ScopeSection> sectionsFor(Scope scope, Category category, ExecutionContext context) {
        if (category.isSystem()) {
            return List.of(
                new ScopeSection(scope, Category.COMMON_KEY),
                new ScopeSection(scope, context.packageManager())
            );
        }
        return List.of(new ScopeSection(scope, category.key()));
    }
}
