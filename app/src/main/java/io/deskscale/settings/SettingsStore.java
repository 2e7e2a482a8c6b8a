package io.deskscale.settings;

import org.jetbrains.annotations.Nullable;

/** Scalar key-value settings. Reads return the supplied default when a key is absent or unparseable. */
public interface SettingsStore {
    double getDouble(String key, double defaultValue);

    int getInt(String key, int defaultValue);

    @Nullable
    String getString(String key, @Nullable String defaultValue);

    void setDouble(String key, double value);

    void setInt(String key, int value);

    void setString(String key, String value);

    void remove(String key);
}
