package dev.devbase.manifest.model;

import java.util.Set;

/**
 * A resolved manifest entry. Each category has its own variant; all of them carry a name and a tag set.
 */
public sealed interface PackageEntry
    permits SystemEntry, SnapEntry, FlatpakEntry, MiseEntry, CustomEntry, VscodeEntry {

    String name();

    Set<String> tags();

    Category category();

    /**
     * Identity used when duplicates are collapsed; the entry name unless the variant says otherwise.
     */
    default String outputKey() {
        return name();
    }
}
