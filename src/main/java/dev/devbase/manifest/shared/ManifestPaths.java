package dev.devbase.manifest.shared;

import dev.devbase.manifest.api.PackSelection;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Default locations and selections derived from the devbase environment.
 *
 * <p>System properties ({@code devbase.manifest}, {@code devbase.overlay}) win over environment variables.
 */
public final class ManifestPaths {
    public static final String BASE_MANIFEST = ".config/devbase/packages.yaml";
    public static final String OVERLAY_FILE = "packages-custom.yaml";
    public static final String MISE_TEMPLATE = ".config/mise/config.toml";

    private final UnaryOperator<String> env;
    private final UnaryOperator<String> properties;

    ManifestPaths(UnaryOperator<String> env, UnaryOperator<String> properties) {
        this.env = env;
        this.properties = properties;
    }

    public static ManifestPaths fromEnvironment() {
        return new ManifestPaths(System::getenv, System::getProperty);
    }

    public static ManifestPaths from(UnaryOperator<String> env) {
        return new ManifestPaths(env, key -> null);
    }

    public Optional<Path> baseManifest() {
        return property("devbase.manifest").or(() -> dotDirectory().map(dot -> dot.resolve(BASE_MANIFEST)));
    }

    /**
     * Explicit {@code devbase.overlay} path, else {@code $_DEVBASE_CUSTOM_PACKAGES/packages-custom.yaml} when that
     * file exists. A custom-packages directory without an overlay file means no overlay.
     */
    public Optional<Path> overlay() {
        return property("devbase.overlay").or(() -> value("_DEVBASE_CUSTOM_PACKAGES")
            .map(dir -> Path.of(dir).resolve(OVERLAY_FILE))
            .filter(Files::isRegularFile));
    }

    public Optional<Path> miseTemplate() {
        return dotDirectory().map(dot -> dot.resolve(MISE_TEMPLATE));
    }

    public PackSelection packs() {
        return PackSelection.parse(
            value("DEVBASE_SELECTED_PACKS").or(() -> value("DEVBASE_DEFAULT_PACKS")).orElse(null)
        );
    }

    private Optional<Path> dotDirectory() {
        return value("DEVBASE_DOT").map(Path::of);
    }

    private Optional<Path> property(String key) {
        String raw = properties.apply(key);
        return raw == null || raw.isBlank() ? Optional.empty() : Optional.of(Path.of(raw));
    }

    private Optional<String> value(String key) {
        String raw = env.apply(key);
        return raw == null || raw.isBlank() ? Optional.empty() : Optional.of(raw);
    }
}
