package io.deskscale.settings;

import io.deskscale.util.AtomicWrites;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Environment variables exported to the user's session. Scale variables left there by older configurations
 * override the toolkit settings, so they are removed whenever the scale changes.
 */
public final class UserEnvironmentFile {
    private static final Logger logger = LogManager.getLogger(UserEnvironmentFile.class);

    public static final List<String> SCALE_VARIABLES = List.of(
            "QT_SCALE_FACTOR",
            "QT_SCREEN_SCALE_FACTORS",
            "QT_AUTO_SCREEN_SCALE_FACTOR",
            "QT_FONT_DPI",
            "DEEPIN_WINE_SCALE");

    private final Path file;

    public UserEnvironmentFile(Path file) {
        this.file = file;
    }

    /**
     * Removes {@link #SCALE_VARIABLES}. A missing file is not an error and the file is only rewritten when
     * something was removed.
     *
     * @return true if the file changed
     */
    public boolean removeScaleVariables() throws IOException {
        if (!Files.exists(file)) {
            return false;
        }
        var props = new Properties();
        try (var reader = Files.newBufferedReader(file)) {
            props.load(reader);
        }

        boolean changed = false;
        for (var key : SCALE_VARIABLES) {
            if (props.remove(key) != null) {
                changed = true;
            }
        }
        if (changed) {
            AtomicWrites.atomicSaveProperties(file, props, "User session environment");
            logger.debug("Removed stale scale variables from {}", file);
        }
        return changed;
    }
}
