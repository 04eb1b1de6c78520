package dev.devbase.manifest.resolve;

import static org.junit.jupiter.api.Assertions.assertEquals;

import dev.devbase.manifest.api.AppStore;
import dev.devbase.manifest.api.ExecutionContext;
import dev.devbase.manifest.api.PackSelection;
import dev.devbase.manifest.model.Category;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class ScopeSelectorTest {
    private static final ExecutionContext DNF = new ExecutionContext("dnf", AppStore.FLATPAK, false);

    @Test
    void systemCategoryReadsCommonThenManagerPerScope() {
        var sections = ScopeSelector.select(Category.SYSTEM, PackSelection.of("java", "python"), DNF);
        assertEquals(
            List.of(
                "core.common", "core.dnf",
                "packs.java.common", "packs.java.dnf",
                "packs.python.common", "packs.python.dnf"
            ),
            paths(sections)
        );
    }

    @Test
    void flatCategoriesReadOneSectionPerScope() {
        var sections = ScopeSelector.select(Category.MISE, PackSelection.of("node", "java"), DNF);
        assertEquals(List.of("core.mise", "packs.node.mise", "packs.java.mise"), paths(sections));
    }

    @Test
    void emptySelectionReadsCoreOnly() {
        var sections = ScopeSelector.select(Category.VSCODE, new PackSelection(List.of()), DNF);
        assertEquals(List.of("core.vscode"), paths(sections));
    }

    private static List<String> paths(List<ScopeSection> sections) {
        return sections.stream().map(ScopeSection::path).collect(Collectors.toList());
    }
}
