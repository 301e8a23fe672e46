package org.simpleweather.interfaces;

import org.simpleweather.settings.SettingKey;

/** Notified after a value has been written to a {@link SettingsStore}. */
@FunctionalInterface
public interface SettingsListener {

    void onSettingChanged(SettingKey<?> key);
}
