package dev.devbase.manifest.resolve;

import dev.devbase.manifest.api.DuplicatePolicy;
import dev.devbase.manifest.api.ExecutionContext;
import dev.devbase.manifest.api.PackSelection;
import dev.devbase.manifest.manifest.ManifestDocument;
import dev.devbase.manifest.model.Category;
import dev.devbase.manifest.model.PackageEntry;
import dev.devbase.manifest.model.Scope;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Selects the entries of a category across core and the selected packs, applying tag exclusion.
 */
public final class PackageResolver {
    private static final Logger LOG = LoggerFactory.getLogger(PackageResolver.class);

    private final ManifestDocument document;
    private final PackSelection packs;
    private final ExecutionContext context;
    private final DuplicatePolicy duplicatePolicy;

    public PackageResolver(
        ManifestDocument document,
        PackSelection packs,
        ExecutionContext context,
        DuplicatePolicy duplicatePolicy
    ) {
        this.document = Objects.requireNonNull(document, "document");
        this.packs = Objects.requireNonNull(packs, "packs");
        this.context = Objects.requireNonNull(context, "context");
        this.duplicatePolicy = Objects.requireNonNull(duplicatePolicy, "duplicatePolicy");
    }

    public ExecutionContext context() {
        return context;
    }

    /**
     * Resolves by category name; unknown names yield an empty list.
     */
    public List<PackageEntry> resolve(String categoryName) {
        return Category.from(categoryName).map(this::resolve).orElseGet(() -> {
            LOG.debug("Unknown package category '{}', nothing to resolve", categoryName);
            return List.of();
        });
    }

    public List<PackageEntry> resolve(Category category) {
        var resolved = new ArrayList<PackageEntry>();
        var emitted = new HashSet<String>();
        for (ScopeSection section : ScopeSelector.select(category, packs, context)) {
            var entries = EntryReader.read(category, document.section(section.scope(), section.key()));
            int kept = 0;
            for (PackageEntry entry : entries) {
                if (TagFilter.excludes(entry.tags(), context)) {
                    LOG.debug("Skipping {} from {} (tags {})", entry.name(), section.path(), entry.tags());
                    continue;
                }
                if (duplicatePolicy == DuplicatePolicy.FIRST_WINS && !emitted.add(entry.outputKey())) {
                    LOG.debug("Dropping duplicate {} from {}", entry.outputKey(), section.path());
                    continue;
                }
                resolved.add(entry);
                kept++;
            }
            if (!entries.isEmpty()) {
                LOG.debug("{}: {} of {} entries selected", section.path(), kept, entries.size());
            }
        }
        return resolved;
    }

    public <T extends PackageEntry> List<T> resolve(Category category, Class<T> type) {
        var typed = new ArrayList<T>();
        for (PackageEntry entry : resolve(category)) {
            typed.add(type.cast(entry));
        }
        return typed;
    }

    /**
     * First non-empty version of {@code tool}, searching {@code custom} then {@code mise} in core, then in each
     * selected pack in order. Core always outranks packs.
     */
    public Optional<String> toolVersion(String tool) {
        if (tool == null || tool.isBlank()) {
            return Optional.empty();
        }
        for (Scope scope : ScopeSelector.scopes(packs)) {
            for (Category category : List.of(Category.CUSTOM, Category.MISE)) {
                var body = document.section(scope, category.key()).path(tool);
                String version = EntryReader.text(body, "version");
                if (!version.isEmpty()) {
                    return Optional.of(version);
                }
            }
        }
        return Optional.empty();
    }
}
