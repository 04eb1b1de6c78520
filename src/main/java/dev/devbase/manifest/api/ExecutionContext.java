package dev.devbase.manifest.api;

import java.util.Locale;
import java.util.Objects;

/**
 * Runtime facts supplied by the host detection collaborators.
 *
 * @param packageManager system package manager key used in the manifest ({@code apt}, {@code dnf}, ...)
 * @param appStore desktop app store, {@link AppStore#NONE} on hosts without one (e.g. WSL)
 * @param wsl whether the process runs under WSL
 */
public record ExecutionContext(String packageManager, AppStore appStore, boolean wsl) {
    public static final String DEFAULT_PACKAGE_MANAGER = "apt";

    public ExecutionContext {
        packageManager = packageManager == null || packageManager.isBlank()
            ? DEFAULT_PACKAGE_MANAGER
            : packageManager.trim().toLowerCase(Locale.ROOT);
        Objects.requireNonNull(appStore, "appStore");
    }

    public static ExecutionContext defaults() {
        return new ExecutionContext(DEFAULT_PACKAGE_MANAGER, AppStore.SNAP, false);
    }

    public ExecutionContext withPackageManager(String manager) {
        return new ExecutionContext(manager, appStore, wsl);
    }
}
