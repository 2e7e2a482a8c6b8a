package io.deskscale.retheme;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PlymouthThemeProbeTest {

    private static final Map<String, Integer> THEMES = Map.of(
            "deepin-logo", 1,
            "uos-ssd-logo", 1,
            "deepin-hidpi-logo", 2,
            "uos-hidpi-ssd-logo", 2);

    @TempDir
    Path tempDir;

    private PlymouthThemeProbe probeFor(String content) throws IOException {
        var conf = tempDir.resolve("plymouthd.conf");
        Files.writeString(conf, content);
        return new PlymouthThemeProbe(conf, THEMES);
    }

    @Test
    void testMapsHidpiThemeToTwo() throws IOException {
        var probe = probeFor("""
                # Administrator customizations go in this file
                [Daemon]
                Theme=deepin-hidpi-logo
                ShowDelay=0
                """);

        assertEquals(2, probe.currentFactor());
    }

    @Test
    void testMapsRegularThemeToOne() throws IOException {
        var probe = probeFor("[Daemon]\nTheme = uos-ssd-logo\n");

        assertEquals(1, probe.currentFactor());
    }

    @Test
    void testUnknownThemeIsUnknown() throws IOException {
        var probe = probeFor("[Daemon]\nTheme=spinner\n");

        assertEquals(AppliedFactorProbe.UNKNOWN, probe.currentFactor());
    }

    @Test
    void testThemeOutsideDaemonSectionIsIgnored() throws IOException {
        var probe = probeFor("""
                [Other]
                Theme=deepin-hidpi-logo
                [Daemon]
                ShowDelay=5
                """);

        assertEquals(Optional.empty(), probe.readTheme());
        assertEquals(AppliedFactorProbe.UNKNOWN, probe.currentFactor());
    }

    @Test
    void testMissingFileIsUnknown() {
        var probe = new PlymouthThemeProbe(tempDir.resolve("absent.conf"), THEMES);

        assertEquals(AppliedFactorProbe.UNKNOWN, probe.currentFactor());
    }
}
