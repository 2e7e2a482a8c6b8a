package io.deskscale.settings;

import io.deskscale.util.AtomicWrites;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Maintains the Qt theme settings that carry the per-screen scale factors for Qt applications. */
public final class QtThemeWriter {
    private static final Logger logger = LogManager.getLogger(QtThemeWriter.class);

    public static final String KEY_SCREEN_SCALE_FACTORS = "Theme.ScreenScaleFactors";
    public static final String KEY_SCALE_FACTOR = "Theme.ScaleFactor";
    public static final String KEY_SCALE_LOGICAL_DPI = "Theme.ScaleLogicalDpi";

    static final String LOGICAL_DPI_FROM_SCREEN = "-1,-1";

    private final Path file;

    public QtThemeWriter(Path file) {
        this.file = file;
    }

    public Path getFile() {
        return file;
    }

    /**
     * Rewrites the screen factors, keeping unrelated keys. An unreadable existing file is logged and replaced.
     *
     * @throws IllegalArgumentException if {@code factors} is empty
     * @throws IOException if the file cannot be written
     */
    public void write(Map<String, Double> factors) throws IOException {
        var props = new Properties();
        if (Files.exists(file)) {
            try (var reader = Files.newBufferedReader(file)) {
                props.load(reader);
            } catch (IOException | IllegalArgumentException e) {
                logger.warn("Failed to load {}, rewriting it: {}", file, e.getMessage());
                props.clear();
            }
        }

        props.setProperty(KEY_SCREEN_SCALE_FACTORS, screenScaleFactorsValue(factors));
        props.remove(KEY_SCALE_FACTOR);
        props.setProperty(KEY_SCALE_LOGICAL_DPI, LOGICAL_DPI_FROM_SCREEN);

        AtomicWrites.atomicSaveProperties(file, props, "Qt theme scale settings");
        logger.debug("Wrote Qt screen scale factors {} to {}", factors, file);
    }

    /** One monitor: the bare factor. Several: the joined map in double quotes. */
    static String screenScaleFactorsValue(Map<String, Double> factors) {
        if (factors.isEmpty()) {
            throw new IllegalArgumentException("factors is empty");
        }
        if (factors.size() == 1) {
            return ScreenFactors.format(factors.values().iterator().next());
        }
        return '"' + ScreenFactors.join(factors) + '"';
    }
}
