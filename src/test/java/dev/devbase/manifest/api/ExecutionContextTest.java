package dev.devbase.manifest.api;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class ExecutionContextTest {
    @Test
    void blankPackageManagerDefaultsToApt() {
        assertEquals("apt", new ExecutionContext(null, AppStore.SNAP, false).packageManager());
        assertEquals("apt", new ExecutionContext(" ", AppStore.SNAP, false).packageManager());
        assertEquals("dnf", new ExecutionContext("DNF", AppStore.FLATPAK, false).packageManager());
    }

    @Test
    void appStoreParsingIsLenient() {
        assertEquals(AppStore.SNAP, AppStore.from("snap"));
        assertEquals(AppStore.FLATPAK, AppStore.from(" Flatpak "));
        assertEquals(AppStore.NONE, AppStore.from("none"));
        assertEquals(AppStore.NONE, AppStore.from("appimage"));
        assertEquals(AppStore.NONE, AppStore.from(null));
    }
}
