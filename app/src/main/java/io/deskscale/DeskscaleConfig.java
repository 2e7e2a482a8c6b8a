package io.deskscale;

import com.google.common.base.Splitter;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Runtime configuration. Built-in defaults come from {@value #DEFAULTS_RESOURCE} on the classpath and are overlaid by
 * {@value #CONFIG_FILE_NAME} in the config directory when that file exists.
 *
 * @param minFactor      lowest boot-splash factor
 * @param maxFactor      highest boot-splash factor
 * @param rethemeCommand command template; {@code {factor}} is substituted
 * @param rethemeTimeout upper bound for one re-theme command
 * @param baseCursorSize cursor size at scale 1.0
 * @param plymouthConfig plymouthd.conf consulted to detect the applied factor
 * @param plymouthThemes theme name to the factor it was rendered for
 */
public record DeskscaleConfig(
        int minFactor,
        int maxFactor,
        String rethemeCommand,
        Duration rethemeTimeout,
        int baseCursorSize,
        Path plymouthConfig,
        Map<String, Integer> plymouthThemes) {
    private static final Logger logger = LogManager.getLogger(DeskscaleConfig.class);

    public static final String DEFAULTS_RESOURCE = "/deskscale-defaults.properties";
    public static final String CONFIG_FILE_NAME = "deskscale.properties";

    static final String KEY_MIN_FACTOR = "retheme.minFactor";
    static final String KEY_MAX_FACTOR = "retheme.maxFactor";
    static final String KEY_COMMAND = "retheme.command";
    static final String KEY_TIMEOUT_SECONDS = "retheme.timeoutSeconds";
    static final String KEY_BASE_CURSOR_SIZE = "cursor.baseSize";
    static final String KEY_PLYMOUTH_CONFIG = "plymouth.config";
    static final String PLYMOUTH_THEMES_PREFIX = "plymouth.themes.";

    public DeskscaleConfig {
        if (minFactor < 1) {
            throw new IllegalArgumentException(KEY_MIN_FACTOR + " must be >= 1, got " + minFactor);
        }
        if (maxFactor < minFactor) {
            throw new IllegalArgumentException(
                    "%s (%d) must be >= %s (%d)".formatted(KEY_MAX_FACTOR, maxFactor, KEY_MIN_FACTOR, minFactor));
        }
        if (rethemeCommand.isBlank()) {
            throw new IllegalArgumentException(KEY_COMMAND + " must not be blank");
        }
        plymouthThemes = Map.copyOf(plymouthThemes);
    }

    public static DeskscaleConfig load(Path configDir) {
        var props = loadDefaults();
        var file = configDir.resolve(CONFIG_FILE_NAME);
        if (Files.exists(file)) {
            try (var reader = Files.newBufferedReader(file)) {
                props.load(reader);
                logger.debug("Loaded configuration overrides from {}", file);
            } catch (IOException | IllegalArgumentException e) {
                logger.warn("Failed to load {}, using defaults: {}", file, e.getMessage());
            }
        }
        return fromProperties(props);
    }

    static Properties loadDefaults() {
        var props = new Properties();
        try (InputStream in = DeskscaleConfig.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                logger.warn("Missing classpath resource {}", DEFAULTS_RESOURCE);
            } else {
                props.load(in);
            }
        } catch (IOException e) {
            logger.warn("Failed to read {}: {}", DEFAULTS_RESOURCE, e.getMessage());
        }
        return props;
    }

    static DeskscaleConfig fromProperties(Properties props) {
        var themes = new LinkedHashMap<String, Integer>();
        for (var name : props.stringPropertyNames()) {
            if (!name.startsWith(PLYMOUTH_THEMES_PREFIX)) {
                continue;
            }
            var factorText = name.substring(PLYMOUTH_THEMES_PREFIX.length());
            try {
                int factor = Integer.parseInt(factorText);
                for (var theme : Splitter.on(',').trimResults().omitEmptyStrings().split(props.getProperty(name))) {
                    themes.put(theme, factor);
                }
            } catch (NumberFormatException e) {
                logger.warn("Ignoring {}: '{}' is not a factor", name, factorText);
            }
        }

        return new DeskscaleConfig(
                getInt(props, KEY_MIN_FACTOR, 1),
                getInt(props, KEY_MAX_FACTOR, 2),
                props.getProperty(KEY_COMMAND, "").trim(),
                Duration.ofSeconds(getInt(props, KEY_TIMEOUT_SECONDS, 300)),
                getInt(props, KEY_BASE_CURSOR_SIZE, 24),
                Path.of(props.getProperty(KEY_PLYMOUTH_CONFIG, "/etc/plymouth/plymouthd.conf").trim()),
                themes);
    }

    private static int getInt(Properties props, String key, int def) {
        var raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return def;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer for {}='{}', using {}", key, raw, def);
            return def;
        }
    }
}
