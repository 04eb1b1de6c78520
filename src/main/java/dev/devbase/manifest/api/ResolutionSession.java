package dev.devbase.manifest.api;

import dev.devbase.manifest.manifest.ManifestDocument;
import dev.devbase.manifest.manifest.ManifestStore;
import dev.devbase.manifest.model.Category;
import dev.devbase.manifest.model.CustomEntry;
import dev.devbase.manifest.model.FlatpakEntry;
import dev.devbase.manifest.model.MiseEntry;
import dev.devbase.manifest.model.PackageEntry;
import dev.devbase.manifest.model.SnapEntry;
import dev.devbase.manifest.model.SystemEntry;
import dev.devbase.manifest.model.VscodeEntry;
import dev.devbase.manifest.output.LineFormatter;
import dev.devbase.manifest.output.MiseConfigWriter;
import dev.devbase.manifest.output.PackContents;
import dev.devbase.manifest.resolve.CoreRuntimes;
import dev.devbase.manifest.resolve.PackageResolver;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Public entry point for resolving a package manifest.
 *
 * <p>A session owns the merged manifest: it is read lazily on first use and kept for the lifetime of the session.
 * To pick up a changed environment, build a new session (see {@link #withExecutionContext}). Sessions are not
 * thread-safe.
 */
public final class ResolutionSession {
    /** Category alias for the snap/flatpak projection chosen by the host's app store. */
    public static final String APP_STORE = "app-store";
    /** Category alias for the deprecated apt-only system projection. */
    public static final String APT = "apt";

    private final ResolutionConfiguration configuration;
    private final ManifestStore store;
    private PackageResolver resolver;

    public ResolutionSession(ResolutionConfiguration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.store = new ManifestStore(configuration.baseManifest(), configuration.overlay());
    }

    public ResolutionConfiguration configuration() {
        return configuration;
    }

    /**
     * A fresh session for a re-detected environment; the manifest files are read again on first use.
     */
    public ResolutionSession withExecutionContext(ExecutionContext context) {
        return new ResolutionSession(configuration.toBuilder().executionContext(context).build());
    }

    /**
     * The merged manifest.
     *
     * @throws dev.devbase.manifest.manifest.ConfigurationMissingException if the base manifest is absent
     */
    public ManifestDocument document() {
        return store.load();
    }

    public List<PackageEntry> entries(Category category) {
        return resolver().resolve(category);
    }

    public List<PackageEntry> entries(String category) {
        return resolver().resolve(category);
    }

    public List<SystemEntry> systemPackages() {
        return resolver().resolve(Category.SYSTEM, SystemEntry.class);
    }

    /**
     * System packages read from {@code common} and {@code apt}, whatever manager the host uses.
     *
     * @deprecated use {@link #systemPackages()}, which follows the detected package manager
     */
    @Deprecated
    public List<SystemEntry> aptPackages() {
        var aptContext = configuration.executionContext().withPackageManager(APT);
        return new PackageResolver(document(), configuration.packs(), aptContext, configuration.duplicatePolicy())
            .resolve(Category.SYSTEM, SystemEntry.class);
    }

    public List<SnapEntry> snapPackages() {
        return resolver().resolve(Category.SNAP, SnapEntry.class);
    }

    public List<FlatpakEntry> flatpakPackages() {
        return resolver().resolve(Category.FLATPAK, FlatpakEntry.class);
    }

    /**
     * Snap or flatpak entries depending on the host's app store; empty when it has none.
     */
    public List<PackageEntry> appStorePackages() {
        switch (configuration.executionContext().appStore()) {
            case SNAP:
                return new ArrayList<>(snapPackages());
            case FLATPAK:
                return new ArrayList<>(flatpakPackages());
            default:
                return List.of();
        }
    }

    public List<MiseEntry> misePackages() {
        return resolver().resolve(Category.MISE, MiseEntry.class);
    }

    public List<CustomEntry> customPackages() {
        return resolver().resolve(Category.CUSTOM, CustomEntry.class);
    }

    public List<VscodeEntry> vscodePackages() {
        return resolver().resolve(Category.VSCODE, VscodeEntry.class);
    }

    /**
     * Line form of a category for shell consumers. Besides the category keys this accepts {@value #APP_STORE} and
     * {@value #APT}; anything else yields no lines.
     */
    @SuppressWarnings("deprecation")
    public List<String> lines(String category) {
        String normalized = category == null ? "" : category.trim().toLowerCase(Locale.ROOT);
        if (APP_STORE.equals(normalized)) {
            return LineFormatter.format(appStorePackages());
        }
        if (APT.equals(normalized)) {
            return LineFormatter.format(aptPackages());
        }
        return LineFormatter.format(entries(normalized));
    }

    public List<PackInfo> availablePacks() {
        var doc = document();
        var packs = new ArrayList<PackInfo>();
        for (String name : doc.packNames()) {
            packs.add(new PackInfo(name, doc.packDescription(name)));
        }
        return packs;
    }

    public List<String> packContents(String pack, boolean showVscode) {
        return PackContents.describe(document(), pack, showVscode, configuration.executionContext());
    }

    public Optional<String> toolVersion(String tool) {
        return resolver().toolVersion(tool);
    }

    public List<String> coreRuntimes() {
        return CoreRuntimes.forPacks(configuration.packs());
    }

    /**
     * Writes the mise configuration for the resolved mise tools. Callers sharing an output path must serialize
     * their calls.
     */
    public void generateMiseConfig(Path output) {
        MiseConfigWriter.write(output, misePackages(), configuration.miseTemplate());
    }

    private PackageResolver resolver() {
        if (resolver == null) {
            resolver = new PackageResolver(
                document(),
                configuration.packs(),
                configuration.executionContext(),
                configuration.duplicatePolicy()
            );
        }
        return resolver;
    }
}
