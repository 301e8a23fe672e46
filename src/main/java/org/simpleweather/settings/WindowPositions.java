package org.simpleweather.settings;

import org.simpleweather.exceptions.StoreReadException;
import org.simpleweather.exceptions.StoreWriteException;
import org.simpleweather.interfaces.SettingsStore;
import org.simpleweather.model.WindowPosition;

/** Remembers where the weather panel was last placed. */
public final class WindowPositions {

    private final SettingsStore settings;

    public WindowPositions(SettingsStore settings) {
        this.settings = settings;
    }

    public WindowPosition load() throws StoreReadException {
        WindowPosition saved = settings.get(SettingKey.WINDOW_POSITION);
        return saved != null ? saved : WindowPosition.defaultPosition();
    }

    public void save(WindowPosition position) throws StoreWriteException {
        settings.set(SettingKey.WINDOW_POSITION, position);
    }
}
