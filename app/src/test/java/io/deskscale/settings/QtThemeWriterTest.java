package io.deskscale.settings;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class QtThemeWriterTest {

    @TempDir
    Path tempDir;

    private Properties read(Path file) throws IOException {
        var props = new Properties();
        try (var reader = Files.newBufferedReader(file)) {
            props.load(reader);
        }
        return props;
    }

    @Test
    void testSingleMonitorWritesBareFactor() throws IOException {
        var file = tempDir.resolve("qt-theme.properties");
        new QtThemeWriter(file).write(Map.of("eDP-1", 1.5));

        var props = read(file);
        assertEquals("1.50", props.getProperty(QtThemeWriter.KEY_SCREEN_SCALE_FACTORS));
        assertEquals("-1,-1", props.getProperty(QtThemeWriter.KEY_SCALE_LOGICAL_DPI));
    }

    @Test
    void testSeveralMonitorsWriteQuotedJoinedValue() {
        var factors = new LinkedHashMap<String, Double>();
        factors.put("eDP-1", 2.0);
        factors.put("HDMI-1", 1.0);

        assertEquals("\"eDP-1=2.00;HDMI-1=1.00\"", QtThemeWriter.screenScaleFactorsValue(factors));
    }

    @Test
    void testKeepsUnrelatedKeysAndDropsLegacyScaleFactor() throws IOException {
        var file = tempDir.resolve("qt-theme.properties");
        Files.writeString(file, "Theme.IconThemeName=bloom\nTheme.ScaleFactor=2\n");

        new QtThemeWriter(file).write(Map.of("ALL", 1.25));

        var props = read(file);
        assertEquals("bloom", props.getProperty("Theme.IconThemeName"));
        assertNull(props.getProperty(QtThemeWriter.KEY_SCALE_FACTOR));
        assertEquals("1.25", props.getProperty(QtThemeWriter.KEY_SCREEN_SCALE_FACTORS));
    }

    @Test
    void testEmptyFactorsRejected() {
        var writer = new QtThemeWriter(tempDir.resolve("qt-theme.properties"));

        assertThrows(IllegalArgumentException.class, () -> writer.write(Map.of()));
    }
}
