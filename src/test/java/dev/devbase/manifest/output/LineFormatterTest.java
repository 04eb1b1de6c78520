package dev.devbase.manifest.output;

import static org.junit.jupiter.api.Assertions.assertEquals;

import dev.devbase.manifest.model.CustomEntry;
import dev.devbase.manifest.model.FlatpakEntry;
import dev.devbase.manifest.model.MiseEntry;
import dev.devbase.manifest.model.SnapEntry;
import dev.devbase.manifest.model.SystemEntry;
import dev.devbase.manifest.model.Tags;
import dev.devbase.manifest.model.VscodeEntry;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class LineFormatterTest {
    @Test
    void formatsEachCategorySchema() {
        assertEquals("git", LineFormatter.format(new SystemEntry("git", Set.of())));
        assertEquals("code|--classic", LineFormatter.format(new SnapEntry("code", Set.of(), "--classic")));
        assertEquals("vlc|", LineFormatter.format(new SnapEntry("vlc", Set.of(), null)));
        assertEquals("org.gimp.GIMP|flathub", LineFormatter.format(new FlatpakEntry("org.gimp.GIMP", Set.of(), null)));
        assertEquals("aqua:mikefarah/yq|4.40.0",
            LineFormatter.format(new MiseEntry("yq", Set.of(), "4.40.0", "aqua:mikefarah/yq")));
        assertEquals("usage|", LineFormatter.format(new MiseEntry("usage", Set.of(), null, null)));
    }

    @Test
    void customAndVscodeCarryTheirTags() {
        var intellij = new CustomEntry("intellij", Tags.of("@skip-wsl", "@gui"), "2024.1", "jetbrains-toolbox");
        assertEquals("intellij|2024.1|jetbrains-toolbox|[\"@skip-wsl\",\"@gui\"]", LineFormatter.format(intellij));
        assertEquals("dbeaver||deb|", LineFormatter.format(new CustomEntry("dbeaver", Set.of(), null, "deb")));
        assertEquals("redhat.vscode-yaml|1.14.0|",
            LineFormatter.format(new VscodeEntry("redhat.vscode-yaml", Set.of(), "1.14.0")));
    }

    @Test
    void formatsListsInOrder() {
        var lines = LineFormatter.format(List.of(new SystemEntry("b", Set.of()), new SystemEntry("a", Set.of())));
        assertEquals(List.of("b", "a"), lines);
    }
}
