package io.deskscale;

import io.deskscale.retheme.AppliedFactorProbe;
import io.deskscale.retheme.CommandRethemer;
import io.deskscale.retheme.PlymouthThemeProbe;
import io.deskscale.retheme.RethemeQueue;
import io.deskscale.retheme.Rethemer;
import io.deskscale.retheme.ScaleEventBus;
import io.deskscale.settings.PropertiesSettingsStore;
import io.deskscale.settings.QtThemeWriter;
import io.deskscale.settings.SettingsStore;
import io.deskscale.settings.UserEnvironmentFile;
import io.deskscale.util.ExecutorServiceUtil;
import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Owns everything a scale change needs for the lifetime of one desktop session: the settings stores, the re-theme
 * worker thread, the event bus, the queue and the {@link ScaleManager}. Closing the session stops the worker after
 * the running re-theme finishes or the configured timeout passes.
 */
public final class ScaleSession implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(ScaleSession.class);

    public static final String SETTINGS_FILE = "xsettings.properties";
    public static final String WM_SETTINGS_FILE = "wm-settings.properties";
    public static final String QT_THEME_FILE = "qt-theme.properties";
    public static final String USER_ENV_FILE = "user-env.properties";

    private final DeskscaleConfig config;
    private final Path configDir;
    private final ExecutorService rethemeExecutor;
    private final ScaleEventBus events;
    private final RethemeQueue rethemeQueue;
    private final ScaleManager scaleManager;

    ScaleSession(DeskscaleConfig config, Path configDir, Rethemer rethemer, AppliedFactorProbe probe) {
        this.config = config;
        this.configDir = configDir;
        this.rethemeExecutor = ExecutorServiceUtil.newFixedThreadExecutor(1, "retheme-");
        this.events = new ScaleEventBus();
        this.rethemeQueue = new RethemeQueue(
                rethemer, probe, events, rethemeExecutor, config.minFactor(), config.maxFactor());

        SettingsStore settings =
                new PropertiesSettingsStore(configDir.resolve(SETTINGS_FILE), "Desktop interface settings");
        SettingsStore wmSettings =
                new PropertiesSettingsStore(configDir.resolve(WM_SETTINGS_FILE), "Window manager settings");
        this.scaleManager = new ScaleManager(
                settings,
                wmSettings,
                new QtThemeWriter(configDir.resolve(QT_THEME_FILE)),
                new UserEnvironmentFile(configDir.resolve(USER_ENV_FILE)),
                rethemeQueue,
                config.baseCursorSize());
    }

    public static ScaleSession open(DeskscaleConfig config, Path configDir) {
        logger.info("Opening scale session in {}", configDir);
        return new ScaleSession(
                config,
                configDir,
                new CommandRethemer(config.rethemeCommand(), config.rethemeTimeout()),
                new PlymouthThemeProbe(config.plymouthConfig(), config.plymouthThemes()));
    }

    public DeskscaleConfig getConfig() {
        return config;
    }

    public Path getConfigDir() {
        return configDir;
    }

    public ScaleEventBus getEvents() {
        return events;
    }

    public RethemeQueue getRethemeQueue() {
        return rethemeQueue;
    }

    public ScaleManager getScaleManager() {
        return scaleManager;
    }

    @Override
    public void close() {
        var grace = config.rethemeTimeout().plusSeconds(5).toMillis();
        if (!ExecutorServiceUtil.shutdownAndAwait(rethemeExecutor, grace, "re-theme executor")) {
            logger.warn("Scale session closed with a re-theme still running");
        }
    }
}
