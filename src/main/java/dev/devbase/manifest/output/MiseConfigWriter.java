package dev.devbase.manifest.output;

import dev.devbase.manifest.model.MiseEntry;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;

/**
 * Generates the mise {@code config.toml}: a preamble followed by a {@code [tools]} table built from the resolved
 * mise entries. A tool key is written once; its first occurrence wins.
 *
 * <p>The preamble is the template's content up to (not including) its {@code [tools]} header, or the bundled
 * default block when no template exists. Not safe for concurrent writers targeting the same path.
 */
public final class MiseConfigWriter {
    private static final Logger LOG = LoggerFactory.getLogger(MiseConfigWriter.class);
    static final String TOOLS_HEADER = "[tools]";
    private static final String DEFAULT_PREAMBLE_RESOURCE = "/mise-preamble.toml";

    private MiseConfigWriter() {}

    public static void write(Path output, List<MiseEntry> tools, Optional<Path> template) {
        List<String> lines = toolLines(tools);
        String content = render(preamble(template), lines);
        try {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(output, content, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to write mise config " + output, ex);
        }
        LOG.info("Wrote mise config {} ({} tools)", output, lines.size());

        TomlParseResult parsed = Toml.parse(content);
        if (parsed.hasErrors()) {
            LOG.warn("Generated mise config {} is not valid TOML: {}", output, parsed.errors().get(0));
        }
    }

    public static String render(List<MiseEntry> tools, Optional<Path> template) {
        return render(preamble(template), toolLines(tools));
    }

    private static String render(String preamble, List<String> toolLines) {
        var out = new StringBuilder(preamble);
        out.append('\n').append(TOOLS_HEADER).append('\n');
        for (String line : toolLines) {
            out.append(line).append('\n');
        }
        return out.toString();
    }

    /**
     * One assignment per tool key, first occurrence wins so core pins outrank packs. Entries without a version
     * are left out.
     */
    static List<String> toolLines(List<MiseEntry> tools) {
        var lines = new ArrayList<String>();
        var emitted = new HashSet<String>();
        for (MiseEntry tool : tools) {
            String key = tool.toolKey();
            if (key.isEmpty() || tool.version().isEmpty()) {
                continue;
            }
            if (!emitted.add(key)) {
                LOG.debug("Skipping {} = {}, already pinned", key, tool.version());
                continue;
            }
            lines.add(toolLine(key, tool.version()));
        }
        return lines;
    }

    /**
     * Assignment line for one tool. Keys containing {@code :} or {@code [} (backend-qualified keys such as
     * {@code aqua:mikefarah/yq}) are quoted; all others are written bare.
     */
    public static String toolLine(String key, String version) {
        if (key.contains(":") || key.contains("[")) {
            return "\"" + key + "\" = \"" + version + "\"";
        }
        return key + " = \"" + version + "\"";
    }

    static String preamble(Optional<Path> template) {
        if (template.isPresent() && Files.isRegularFile(template.get())) {
            return templatePreamble(template.get());
        }
        return defaultPreamble();
    }

    private static String templatePreamble(Path template) {
        List<String> lines;
        try {
            lines = Files.readAllLines(template, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read mise template " + template, ex);
        }
        var out = new StringBuilder();
        for (String line : lines) {
            if (TOOLS_HEADER.equals(line)) {
                break;
            }
            out.append(line).append('\n');
        }
        return out.toString();
    }

    static String defaultPreamble() {
        try (InputStream in = MiseConfigWriter.class.getResourceAsStream(DEFAULT_PREAMBLE_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing bundled resource " + DEFAULT_PREAMBLE_RESOURCE);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read bundled mise preamble", ex);
        }
    }
}
