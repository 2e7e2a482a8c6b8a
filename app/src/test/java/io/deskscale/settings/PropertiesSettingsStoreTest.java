package io.deskscale.settings;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PropertiesSettingsStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void testDefaultsWhenFileMissing() {
        var store = new PropertiesSettingsStore(tempDir.resolve("missing.properties"), "test");

        assertEquals(1.0, store.getDouble("scale-factor", 1.0));
        assertEquals(1, store.getInt("window-scale", 1));
        assertNull(store.getString("individual-scaling", null));
    }

    @Test
    void testWritesArePersistedAndReloaded() {
        var file = tempDir.resolve("nested").resolve("xsettings.properties");
        var store = new PropertiesSettingsStore(file, "test");
        store.setDouble("scale-factor", 1.25);
        store.setInt("window-scale", 2);
        store.setString("individual-scaling", "eDP-1=1.25");

        assertTrue(Files.exists(file));
        var reloaded = new PropertiesSettingsStore(file, "test");
        assertEquals(1.25, reloaded.getDouble("scale-factor", 1.0));
        assertEquals(2, reloaded.getInt("window-scale", 1));
        assertEquals("eDP-1=1.25", reloaded.getString("individual-scaling", null));
    }

    @Test
    void testUnparseableValuesFallBackToDefault() throws IOException {
        var file = tempDir.resolve("bad.properties");
        Files.writeString(file, "window-scale=two\nscale-factor=\n");
        var store = new PropertiesSettingsStore(file, "test");

        assertEquals(1, store.getInt("window-scale", 1));
        assertEquals(1.0, store.getDouble("scale-factor", 1.0));
    }

    @Test
    void testRemove() {
        var file = tempDir.resolve("remove.properties");
        var store = new PropertiesSettingsStore(file, "test");
        store.setInt("cursor-size", 36);

        store.remove("cursor-size");

        assertEquals(-1, new PropertiesSettingsStore(file, "test").getInt("cursor-size", -1));
    }

    @Test
    void testSaveFailureKeepsInMemoryValue() throws IOException {
        // a regular file where the parent directory should be makes every save fail
        var blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "");
        var store = new PropertiesSettingsStore(blocker.resolve("settings.properties"), "test");

        store.setInt("window-scale", 2);

        assertEquals(2, store.getInt("window-scale", 1));
    }
}
