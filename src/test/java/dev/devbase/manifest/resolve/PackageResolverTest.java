package dev.devbase.manifest.resolve;

import static dev.devbase.manifest.support.ManifestFixtures.yaml;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.devbase.manifest.api.AppStore;
import dev.devbase.manifest.api.DuplicatePolicy;
import dev.devbase.manifest.api.ExecutionContext;
import dev.devbase.manifest.api.PackSelection;
import dev.devbase.manifest.manifest.ManifestDocument;
import dev.devbase.manifest.model.Category;
import dev.devbase.manifest.model.MiseEntry;
import dev.devbase.manifest.model.PackageEntry;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class PackageResolverTest {
    private static final ExecutionContext APT_WSL = new ExecutionContext("apt", AppStore.NONE, true);
    private static final ExecutionContext APT_DESKTOP = new ExecutionContext("apt", AppStore.SNAP, false);

    private static final ManifestDocument E2E = new ManifestDocument(yaml(String.join("\n",
        "core:",
        "  common:",
        "    git: {}",
        "    curl: {}",
        "  apt:",
        "    build-essential: {}",
        "packs:",
        "  python:",
        "    common:",
        "      python3:",
        "        tags: [\"@skip-wsl\"]",
        ""
    )));

    private static final ManifestDocument LAYERED = new ManifestDocument(yaml(String.join("\n",
        "core:",
        "  common:",
        "    git: {}",
        "  mise:",
        "    node: {version: '20'}",
        "    jq: {version: '1.7'}",
        "  custom:",
        "    jq: {version: '1.6', installer: script}",
        "packs:",
        "  a:",
        "    common:",
        "      git: {}",
        "      make: {}",
        "    mise:",
        "      node: {version: '18'}",
        "      deno: {version: '1.40'}",
        "  b:",
        "    common:",
        "      cmake: {}",
        "    mise:",
        "      deno: {version: '1.30'}",
        "      bun: {}",
        "    custom:",
        "      bun: {version: '1.1', installer: script}",
        ""
    )));

    @Test
    void systemPackagesSuppressSkipWslUnderWsl() {
        var resolver = new PackageResolver(E2E, PackSelection.of("python"), APT_WSL, DuplicatePolicy.KEEP_ALL);
        assertEquals(List.of("git", "curl", "build-essential"), names(resolver.resolve(Category.SYSTEM)));
    }

    @Test
    void systemPackagesKeepSkipWslOutsideWsl() {
        var resolver = new PackageResolver(E2E, PackSelection.of("python"), APT_DESKTOP, DuplicatePolicy.KEEP_ALL);
        assertEquals(List.of("git", "curl", "build-essential", "python3"), names(resolver.resolve(Category.SYSTEM)));
    }

    @Test
    void coreEntriesPrecedePacksInSelectionOrder() {
        var forward = new PackageResolver(LAYERED, PackSelection.of("a", "b"), APT_DESKTOP, DuplicatePolicy.KEEP_ALL);
        var reversed = new PackageResolver(LAYERED, PackSelection.of("b", "a"), APT_DESKTOP, DuplicatePolicy.KEEP_ALL);
        assertEquals(List.of("git", "git", "make", "cmake"), names(forward.resolve(Category.SYSTEM)));
        assertEquals(List.of("git", "cmake", "git", "make"), names(reversed.resolve(Category.SYSTEM)));
    }

    @Test
    void unselectedPacksContributeNothing() {
        var resolver = new PackageResolver(LAYERED, PackSelection.of("b", "missing"), APT_DESKTOP, DuplicatePolicy.KEEP_ALL);
        assertEquals(List.of("git", "cmake"), names(resolver.resolve(Category.SYSTEM)));
    }

    @Test
    void duplicatesPassThroughByDefault() {
        var resolver = new PackageResolver(LAYERED, PackSelection.of("a", "b"), APT_DESKTOP, DuplicatePolicy.KEEP_ALL);
        var keys = resolver.resolve(Category.MISE, MiseEntry.class).stream().map(MiseEntry::toolKey).toList();
        assertEquals(List.of("node", "jq", "node", "deno", "deno", "bun"), keys);
    }

    @Test
    void firstWinsDropsLaterDuplicates() {
        var resolver = new PackageResolver(LAYERED, PackSelection.of("a", "b"), APT_DESKTOP, DuplicatePolicy.FIRST_WINS);
        assertEquals(List.of("git", "make", "cmake"), names(resolver.resolve(Category.SYSTEM)));
        var mise = resolver.resolve(Category.MISE, MiseEntry.class);
        assertEquals(List.of("node", "jq", "deno", "bun"), mise.stream().map(MiseEntry::toolKey).toList());
        assertEquals("20", mise.get(0).version());
        assertEquals("1.40", mise.get(2).version());
    }

    @Test
    void unknownCategoryResolvesToEmpty() {
        var resolver = new PackageResolver(LAYERED, PackSelection.of("a"), APT_DESKTOP, DuplicatePolicy.KEEP_ALL);
        assertTrue(resolver.resolve("docker").isEmpty());
        assertTrue(resolver.resolve((String) null).isEmpty());
    }

    @Test
    void coreVersionOutranksPacks() {
        var doc = new ManifestDocument(yaml(
            "core:\n  mise:\n    node:\n      version: '20'\npacks:\n  node:\n    mise:\n      node:\n        version: '18'\n"
        ));
        var resolver = new PackageResolver(doc, PackSelection.of("node"), APT_DESKTOP, DuplicatePolicy.KEEP_ALL);
        assertEquals(Optional.of("20"), resolver.toolVersion("node"));
    }

    @Test
    void toolVersionSearchesCustomBeforeMise() {
        var resolver = new PackageResolver(LAYERED, PackSelection.of("a", "b"), APT_DESKTOP, DuplicatePolicy.KEEP_ALL);
        assertEquals(Optional.of("1.6"), resolver.toolVersion("jq"));
    }

    @Test
    void toolVersionFollowsSelectionOrderAcrossPacks() {
        var ab = new PackageResolver(LAYERED, PackSelection.of("a", "b"), APT_DESKTOP, DuplicatePolicy.KEEP_ALL);
        var ba = new PackageResolver(LAYERED, PackSelection.of("b", "a"), APT_DESKTOP, DuplicatePolicy.KEEP_ALL);
        assertEquals(Optional.of("1.40"), ab.toolVersion("deno"));
        assertEquals(Optional.of("1.30"), ba.toolVersion("deno"));
        assertEquals(Optional.of("1.1"), ab.toolVersion("bun"));
    }

    @Test
    void toolVersionMissIsEmpty() {
        var resolver = new PackageResolver(LAYERED, PackSelection.of("a"), APT_DESKTOP, DuplicatePolicy.KEEP_ALL);
        assertEquals(Optional.empty(), resolver.toolVersion("bun"));
        assertEquals(Optional.empty(), resolver.toolVersion("terraform"));
        assertEquals(Optional.empty(), resolver.toolVersion(""));
    }

    private static List<String> names(List<PackageEntry> entries) {
        return entries.stream().map(PackageEntry::name).toList();
    }
}
