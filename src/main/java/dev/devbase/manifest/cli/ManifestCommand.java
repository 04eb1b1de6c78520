package dev.devbase.manifest.cli;

import dev.devbase.manifest.api.AppStore;
import dev.devbase.manifest.api.DuplicatePolicy;
import dev.devbase.manifest.api.ExecutionContext;
import dev.devbase.manifest.api.PackInfo;
import dev.devbase.manifest.api.PackSelection;
import dev.devbase.manifest.api.ResolutionConfiguration;
import dev.devbase.manifest.api.ResolutionSession;
import dev.devbase.manifest.shared.ManifestPaths;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine;

/**
 * Line-oriented boundary used by the shell installers. Global options go before the subcommand, e.g.
 * {@code devbase-manifest --packs "java node" --wsl packages system}.
 */
@CommandLine.Command(
    name = "devbase-manifest",
    description = "Resolve devbase package manifests into installer package lists.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class ManifestCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-m", "--manifest"},
        description = "Base manifest (default: $DEVBASE_DOT/.config/devbase/packages.yaml).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path manifest;

    @CommandLine.Option(
        names = {"-o", "--overlay"},
        description = "Organization overlay (default: $_DEVBASE_CUSTOM_PACKAGES/packages-custom.yaml).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path overlay;

    @CommandLine.Option(
        names = "--mise-template",
        description = "mise config template whose non-tool section is copied (default: $DEVBASE_DOT/.config/mise/config.toml).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path miseTemplate;

    @CommandLine.Option(
        names = {"-p", "--packs"},
        description = "Space-separated pack selection (default: $DEVBASE_SELECTED_PACKS, then $DEVBASE_DEFAULT_PACKS).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String packs;

    @CommandLine.Option(
        names = "--package-manager",
        description = "System package manager key (apt, dnf, ...).",
        defaultValue = ExecutionContext.DEFAULT_PACKAGE_MANAGER
    )
    private String packageManager;

    @CommandLine.Option(
        names = "--app-store",
        description = "Host app store (snap|flatpak|none).",
        defaultValue = "snap"
    )
    private String appStore;

    @CommandLine.Option(names = "--wsl", description = "Resolve for a WSL host (applies @skip-wsl).")
    private boolean wsl;

    @CommandLine.Option(names = "--dedupe", description = "Emit only the first occurrence of each package name.")
    private boolean dedupe;

    @CommandLine.Option(names = "--debug", description = "Print stack traces on failure.")
    private boolean debug;

    @Override
    public Integer call() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing required subcommand.");
    }

    @CommandLine.Command(name = "packages", description = "Print resolved entries of a category, one per line.")
    int packages(
        @CommandLine.Parameters(
            paramLabel = "CATEGORY",
            description = "system|snap|flatpak|mise|custom|vscode|apt|app-store"
        ) String category
    ) {
        print(session().lines(category));
        return 0;
    }

    @CommandLine.Command(name = "packs", description = "Print available packs as name|description.")
    int listPacks() {
        print(session().availablePacks().stream().map(PackInfo::toLine).toList());
        return 0;
    }

    @CommandLine.Command(name = "pack-contents", description = "Print the tools a pack installs.")
    int packContents(
        @CommandLine.Parameters(paramLabel = "PACK") String pack,
        @CommandLine.Option(names = "--no-vscode", description = "Leave out VS Code extensions.") boolean noVscode
    ) {
        print(session().packContents(pack, !noVscode));
        return 0;
    }

    @CommandLine.Command(name = "tool-version", description = "Print the pinned version of a tool (nothing if unpinned).")
    int toolVersion(@CommandLine.Parameters(paramLabel = "TOOL") String tool) {
        session().toolVersion(tool).ifPresent(version -> print(List.of(version)));
        return 0;
    }

    @CommandLine.Command(name = "runtimes", description = "Print the language runtimes implied by the selected packs.")
    int runtimes() {
        print(List.of(String.join(" ", session().coreRuntimes())));
        return 0;
    }

    @CommandLine.Command(name = "mise-config", description = "Generate the mise config.toml.")
    int miseConfig(@CommandLine.Parameters(paramLabel = "OUTPUT") Path output) {
        session().generateMiseConfig(output);
        return 0;
    }

    private ResolutionSession session() {
        if (debug) {
            System.setProperty(ShortErrorHandler.DEBUG_PROPERTY, "true");
        }
        var defaults = ManifestPaths.fromEnvironment();
        Path base = Optional.ofNullable(manifest).or(defaults::baseManifest).orElseThrow(() ->
            new CommandLine.ParameterException(spec.commandLine(), "No manifest: set DEVBASE_DOT or pass --manifest.")
        );
        var configuration = ResolutionConfiguration.builder()
            .baseManifest(base)
            .overlay(Optional.ofNullable(overlay).or(defaults::overlay))
            .miseTemplate(Optional.ofNullable(miseTemplate).or(defaults::miseTemplate))
            .packs(packs != null ? PackSelection.parse(packs) : defaults.packs())
            .executionContext(new ExecutionContext(packageManager, AppStore.from(appStore), wsl))
            .duplicatePolicy(dedupe ? DuplicatePolicy.FIRST_WINS : DuplicatePolicy.KEEP_ALL)
            .build();
        return new ResolutionSession(configuration);
    }

    private void print(List<String> lines) {
        PrintWriter out = spec.commandLine().getOut();
        for (String line : lines) {
            out.println(line);
        }
        out.flush();
    }
}
