package io.deskscale.util;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DeskscaleConfigPathsTest {

    private String originalUserHome;

    @BeforeEach
    void saveOriginalProperties() {
        originalUserHome = System.getProperty("user.home");
    }

    @AfterEach
    void cleanup() {
        if (originalUserHome != null) {
            System.setProperty("user.home", originalUserHome);
        }
    }

    @Test
    void testOverrideWins() {
        var result = DeskscaleConfigPaths.getConfigDir(Optional.of("/tmp/custom-deskscale"), "/xdg");

        assertEquals(Path.of("/tmp/custom-deskscale"), result);
    }

    @Test
    void testXdgConfigHome() {
        var result = DeskscaleConfigPaths.getConfigDir(Optional.empty(), "/home/u/.xdg");

        assertEquals(Path.of("/home/u/.xdg", "deskscale"), result);
    }

    @Test
    void testFallsBackToDotConfig() {
        System.setProperty("user.home", "/home/testuser");

        assertEquals(
                Path.of("/home/testuser", ".config", "deskscale"),
                DeskscaleConfigPaths.getConfigDir(Optional.empty(), null));
        assertEquals(
                Path.of("/home/testuser", ".config", "deskscale"),
                DeskscaleConfigPaths.getConfigDir(Optional.of("  "), ""));
    }
}
