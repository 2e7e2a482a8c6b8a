package io.deskscale.util;

import java.nio.file.Path;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Resolves the directory holding deskscale's configuration and the settings files it maintains.
 *
 * <p>Order: explicit override, then {@code $XDG_CONFIG_HOME/deskscale}, then {@code ~/.config/deskscale}.
 */
public final class DeskscaleConfigPaths {
    private static final Logger logger = LogManager.getLogger(DeskscaleConfigPaths.class);

    static final String DIR_NAME = "deskscale";

    private DeskscaleConfigPaths() {}

    public static Path getConfigDir() {
        return getConfigDir(Optional.empty());
    }

    /**
     * @param configDirOverride optional override for the config directory (from the command line, or tests)
     * @return the config directory path; not created by this method
     */
    public static Path getConfigDir(Optional<String> configDirOverride) {
        return getConfigDir(configDirOverride, System.getenv("XDG_CONFIG_HOME"));
    }

    static Path getConfigDir(Optional<String> configDirOverride, @Nullable String xdgConfigHome) {
        return configDirOverride
                .filter(s -> !s.isBlank())
                .flatMap(override -> {
                    try {
                        return Optional.of(Path.of(override));
                    } catch (Exception e) {
                        logger.warn("Invalid override for config dir='{}': {}", override, e.getMessage());
                        return Optional.empty();
                    }
                })
                .orElseGet(() -> {
                    Path base = (xdgConfigHome != null && !xdgConfigHome.isBlank())
                            ? Path.of(xdgConfigHome)
                            : Path.of(System.getProperty("user.home"), ".config");
                    return base.resolve(DIR_NAME);
                });
    }
}
