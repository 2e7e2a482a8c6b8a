package io.deskscale.retheme;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Reads the configured Plymouth theme ({@code Theme} in the {@code [Daemon]} section) and maps it to the factor
 * that theme was rendered for.
 */
public final class PlymouthThemeProbe implements AppliedFactorProbe {
    private static final Logger logger = LogManager.getLogger(PlymouthThemeProbe.class);

    private static final String SECTION = "Daemon";
    private static final String KEY = "Theme";

    private final Path configFile;
    private final Map<String, Integer> themeFactors;

    /**
     * @param configFile   plymouthd.conf
     * @param themeFactors theme name to factor; unlisted themes are {@link #UNKNOWN}
     */
    public PlymouthThemeProbe(Path configFile, Map<String, Integer> themeFactors) {
        this.configFile = configFile;
        this.themeFactors = Map.copyOf(themeFactors);
    }

    @Override
    public int currentFactor() {
        try {
            var theme = readTheme();
            if (theme.isEmpty()) {
                logger.warn("No {} key in [{}] of {}", KEY, SECTION, configFile);
                return UNKNOWN;
            }
            return themeFactors.getOrDefault(theme.get(), UNKNOWN);
        } catch (IOException e) {
            logger.warn("Failed to read Plymouth theme from {}: {}", configFile, e.getMessage());
            return UNKNOWN;
        }
    }

    Optional<String> readTheme() throws IOException {
        String section = null;
        for (var raw : Files.readAllLines(configFile, UTF_8)) {
            var line = raw.trim();
            if (line.isEmpty() || line.startsWith("#") || line.startsWith(";")) {
                continue;
            }
            if (line.startsWith("[") && line.endsWith("]")) {
                section = line.substring(1, line.length() - 1).trim();
                continue;
            }
            if (!SECTION.equals(section)) {
                continue;
            }
            int eq = line.indexOf('=');
            if (eq > 0 && line.substring(0, eq).trim().equals(KEY)) {
                return Optional.of(line.substring(eq + 1).trim());
            }
        }
        return Optional.empty();
    }
}
