package io.deskscale.settings;

import io.deskscale.util.AtomicWrites;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * {@link SettingsStore} backed by a properties file. The file is loaded on first access and every write is
 * persisted immediately with an atomic replace. Load and save failures are logged; the in-memory values stay
 * authoritative for the rest of the session.
 */
public final class PropertiesSettingsStore implements SettingsStore {
    private static final Logger logger = LogManager.getLogger(PropertiesSettingsStore.class);

    private final Path file;
    private final String comment;

    // guarded by 'this'
    private @Nullable Properties cachedProps;

    public PropertiesSettingsStore(Path file, String comment) {
        this.file = file;
        this.comment = comment;
    }

    public Path getFile() {
        return file;
    }

    private synchronized Properties loadProps() {
        if (cachedProps != null) {
            return cachedProps;
        }
        var props = new Properties();
        if (Files.exists(file)) {
            try (var reader = Files.newBufferedReader(file)) {
                props.load(reader);
            } catch (IOException | IllegalArgumentException e) {
                logger.warn("Failed to load settings from {}: {}", file, e.getMessage());
            }
        }
        cachedProps = props;
        return props;
    }

    private synchronized void saveProps(Properties props) {
        try {
            AtomicWrites.atomicSaveProperties(file, props, comment);
        } catch (IOException e) {
            logger.warn("Failed to save settings to {}: {}", file, e.getMessage());
        }
    }

    @Override
    public synchronized double getDouble(String key, double defaultValue) {
        var raw = loadProps().getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            logger.debug("Invalid double for {}='{}'", key, raw);
            return defaultValue;
        }
    }

    @Override
    public synchronized int getInt(String key, int defaultValue) {
        var raw = loadProps().getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            logger.debug("Invalid int for {}='{}'", key, raw);
            return defaultValue;
        }
    }

    @Override
    public synchronized @Nullable String getString(String key, @Nullable String defaultValue) {
        var raw = loadProps().getProperty(key);
        return raw == null ? defaultValue : raw;
    }

    @Override
    public synchronized void setDouble(String key, double value) {
        put(key, Double.toString(value));
    }

    @Override
    public synchronized void setInt(String key, int value) {
        put(key, Integer.toString(value));
    }

    @Override
    public synchronized void setString(String key, String value) {
        put(key, value);
    }

    @Override
    public synchronized void remove(String key) {
        var props = loadProps();
        if (props.remove(key) != null) {
            saveProps(props);
        }
    }

    private void put(String key, String value) {
        var props = loadProps();
        props.setProperty(key, value);
        saveProps(props);
    }
}
