package io.deskscale.settings;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class UserEnvironmentFileTest {

    @TempDir
    Path tempDir;

    @Test
    void testMissingFileIsNotAnError() throws IOException {
        var env = new UserEnvironmentFile(tempDir.resolve("user-env.properties"));

        assertFalse(env.removeScaleVariables());
        assertFalse(Files.exists(tempDir.resolve("user-env.properties")));
    }

    @Test
    void testRemovesOnlyScaleVariables() throws IOException {
        var file = tempDir.resolve("user-env.properties");
        Files.writeString(file, "QT_SCALE_FACTOR=2\nQT_FONT_DPI=192\nLANG=en_US.UTF-8\n");

        assertTrue(new UserEnvironmentFile(file).removeScaleVariables());

        var props = new Properties();
        try (var reader = Files.newBufferedReader(file)) {
            props.load(reader);
        }
        assertEquals("en_US.UTF-8", props.getProperty("LANG"));
        assertNull(props.getProperty("QT_SCALE_FACTOR"));
        assertNull(props.getProperty("QT_FONT_DPI"));
    }

    @Test
    void testUnchangedFileIsNotRewritten() throws IOException {
        var file = tempDir.resolve("user-env.properties");
        var content = "# hand written\nLANG=C\n";
        Files.writeString(file, content);

        assertFalse(new UserEnvironmentFile(file).removeScaleVariables());
        assertEquals(content, Files.readString(file));
    }
}
