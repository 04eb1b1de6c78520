package dev.devbase.manifest.manifest;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the base manifest and the optional organization overlay, and memoizes the merged document.
 *
 * <p>A missing base manifest is fatal. An overlay that is configured but missing or unparsable is skipped with
 * a warning and resolution continues on the base document alone.
 */
public final class ManifestStore {
    private static final Logger LOG = LoggerFactory.getLogger(ManifestStore.class);
    private static final ObjectMapper YAML_MAPPER = YAMLMapper.builder()
        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
        .configure(JsonNodeFeature.STRIP_TRAILING_BIGDECIMAL_ZEROES, false)
        .nodeFactory(JsonNodeFactory.withExactBigDecimals(true))
        .build();

    private final Path baseManifest;
    private final Optional<Path> overlay;
    private ManifestDocument cached;

    public ManifestStore(Path baseManifest, Optional<Path> overlay) {
        this.baseManifest = Objects.requireNonNull(baseManifest, "baseManifest");
        this.overlay = Objects.requireNonNull(overlay, "overlay");
    }

    public Path baseManifest() {
        return baseManifest;
    }

    public Optional<Path> overlay() {
        return overlay;
    }

    /**
     * Returns the merged document, reading the files on first use.
     *
     * @throws ConfigurationMissingException if the base manifest does not exist
     * @throws ConfigurationMalformedException if the base manifest cannot be parsed
     */
    public ManifestDocument load() {
        if (cached == null) {
            cached = readMerged();
        }
        return cached;
    }

    /**
     * Drops the memoized document so the next {@link #load()} reads the files again.
     */
    public void invalidate() {
        cached = null;
    }

    private ManifestDocument readMerged() {
        if (!Files.isRegularFile(baseManifest)) {
            throw new ConfigurationMissingException(baseManifest);
        }
        ObjectNode base = readDocument(baseManifest);
        LOG.info("Loaded package manifest {}", baseManifest);

        ObjectNode patch = overlay.flatMap(this::readOverlay).orElse(null);
        if (patch != null) {
            LOG.info("Applied package overlay {}", overlay.get());
        }
        return new ManifestDocument(ManifestMerger.merge(base, patch));
    }

    private Optional<ObjectNode> readOverlay(Path path) {
        if (!Files.isRegularFile(path)) {
            LOG.warn("Package overlay {} not found, using base manifest only", path);
            return Optional.empty();
        }
        try {
            return Optional.of(readDocument(path));
        } catch (ConfigurationMalformedException ex) {
            LOG.warn("Ignoring package overlay {}: {}", path, ex.getMessage());
            return Optional.empty();
        }
    }

    static ObjectNode readDocument(Path path) {
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(path.toFile());
        } catch (IOException ex) {
            throw new ConfigurationMalformedException("Unable to parse " + path + ": " + ex.getMessage(), path, ex);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            return JsonNodeFactory.instance.objectNode();
        }
        if (!(root instanceof ObjectNode object)) {
            throw new ConfigurationMalformedException("Manifest root must be a mapping: " + path, path);
        }
        return object;
    }
}
