package io.deskscale;

import io.deskscale.exception.ScaleValidationException;
import io.deskscale.retheme.RethemeQueue;
import io.deskscale.settings.QtThemeWriter;
import io.deskscale.settings.ScreenFactors;
import io.deskscale.settings.SettingsStore;
import io.deskscale.settings.UserEnvironmentFile;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Applies a scale change to the desktop session: validates the per-monitor factors, persists them together with the
 * derived window scale and cursor sizes, updates the Qt theme, clears stale environment overrides and queues the
 * boot-splash re-theme.
 *
 * <p>Only the re-theme is asynchronous. Settings writes happen on the calling thread and do not wait for the queue.
 */
public final class ScaleManager {
    private static final Logger logger = LogManager.getLogger(ScaleManager.class);

    public static final String KEY_SCALE_FACTOR = "scale-factor";
    public static final String KEY_WINDOW_SCALE = "window-scale";
    public static final String KEY_GTK_CURSOR_THEME_SIZE = "gtk-cursor-theme-size";
    public static final String KEY_INDIVIDUAL_SCALING = "individual-scaling";
    public static final String KEY_WM_CURSOR_SIZE = "cursor-size";

    private final SettingsStore settings;
    private final SettingsStore wmSettings;
    private final QtThemeWriter qtTheme;
    private final UserEnvironmentFile userEnv;
    private final RethemeQueue rethemeQueue;
    private final int baseCursorSize;

    public ScaleManager(
            SettingsStore settings,
            SettingsStore wmSettings,
            QtThemeWriter qtTheme,
            UserEnvironmentFile userEnv,
            RethemeQueue rethemeQueue,
            int baseCursorSize) {
        this.settings = settings;
        this.wmSettings = wmSettings;
        this.qtTheme = qtTheme;
        this.userEnv = userEnv;
        this.rethemeQueue = rethemeQueue;
        this.baseCursorSize = baseCursorSize;
    }

    /**
     * Sets the scale of every monitor. {@code factors} must contain the primary monitor, or the {@link
     * ScreenFactors#ALL} entry when several monitors share one factor.
     *
     * @param notify whether the boot-splash re-theme should emit started/done
     * @throws ScaleValidationException if the map is null or empty, has a blank name, or a value that is not a
     *     positive finite number; nothing is written in that case
     */
    public void setScreenScaleFactors(@Nullable Map<String, Double> factors, boolean notify)
            throws ScaleValidationException {
        validate(factors);
        var copy = new LinkedHashMap<>(factors);
        logger.debug("setScreenScaleFactors {}", copy);

        applySingleFactor(ScreenFactors.representative(copy), notify);
        settings.setString(KEY_INDIVIDUAL_SCALING, ScreenFactors.join(copy));

        try {
            qtTheme.write(copy);
        } catch (IOException e) {
            logger.warn("Failed to update Qt theme {}: {}", qtTheme.getFile(), e.getMessage());
        }

        try {
            userEnv.removeScaleVariables();
        } catch (IOException e) {
            logger.warn("Failed to clean up scale variables in user environment: {}", e.getMessage());
        }
    }

    /** Sets one factor for all monitors. */
    public void setScaleFactor(double factor, boolean notify) throws ScaleValidationException {
        setScreenScaleFactors(Map.of(ScreenFactors.ALL, factor), notify);
    }

    /** Same as {@link #setScaleFactor(double, boolean)} without started/done signals. */
    public void setScaleFactorWithoutNotify(double factor) throws ScaleValidationException {
        setScaleFactor(factor, false);
    }

    private void applySingleFactor(double factor, boolean notify) {
        logger.debug("setScaleFactor {}", factor);
        settings.setDouble(KEY_SCALE_FACTOR, factor);

        int windowScale = windowScaleFor(factor);
        int oldWindowScale = settings.getInt(KEY_WINDOW_SCALE, 1);
        if (oldWindowScale != windowScale) {
            settings.setInt(KEY_WINDOW_SCALE, windowScale);
        }

        int cursorSize = (int) (baseCursorSize * factor);
        settings.setInt(KEY_GTK_CURSOR_THEME_SIZE, cursorSize);
        wmSettings.setInt(KEY_WM_CURSOR_SIZE, cursorSize);

        rethemeQueue.submit(windowScale, notify);
    }

    /** {@code trunc((factor + 0.3) * 10) / 10} as an integer, at least 1: 1.7 gives 2, 1.5 gives 1. */
    public static int windowScaleFor(double factor) {
        int windowScale = (int) (Math.floor((factor + 0.3) * 10) / 10);
        return Math.max(1, windowScale);
    }

    public Map<String, Double> getScreenScaleFactors() {
        var joined = settings.getString(KEY_INDIVIDUAL_SCALING, "");
        return ScreenFactors.parse(joined == null ? "" : joined);
    }

    public double getScaleFactor() {
        return settings.getDouble(KEY_SCALE_FACTOR, 1.0);
    }

    public int getWindowScale() {
        return settings.getInt(KEY_WINDOW_SCALE, 1);
    }

    public int getCursorSize() {
        return settings.getInt(KEY_GTK_CURSOR_THEME_SIZE, baseCursorSize);
    }

    public RethemeQueue getRethemeQueue() {
        return rethemeQueue;
    }

    private static void validate(@Nullable Map<String, Double> factors) throws ScaleValidationException {
        if (factors == null) {
            throw new ScaleValidationException("factors is null");
        }
        if (factors.isEmpty()) {
            throw new ScaleValidationException("factors is empty");
        }
        for (var entry : factors.entrySet()) {
            if (entry.getKey() == null || entry.getKey().isBlank()) {
                throw new ScaleValidationException("monitor name must not be blank");
            }
            var value = entry.getValue();
            if (value == null || !Double.isFinite(value) || value <= 0) {
                throw new ScaleValidationException("invalid value %s for %s".formatted(value, entry.getKey()));
            }
        }
    }
}
