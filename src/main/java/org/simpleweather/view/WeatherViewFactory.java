package org.simpleweather.view;

import org.simpleweather.engine.WeatherEngine;
import org.simpleweather.exceptions.StoreReadException;
import org.simpleweather.interfaces.SettingsStore;
import org.simpleweather.model.TimeSnapshot;
import org.simpleweather.model.WeatherRecord;
import org.simpleweather.settings.SettingKey;
import org.simpleweather.settings.WindowPositions;

/** Builds a {@link WeatherView} from an engine's current state and the display settings. */
public final class WeatherViewFactory {

    private final SettingsStore settings;
    private final WindowPositions positions;

    public WeatherViewFactory(SettingsStore settings) {
        this.settings = settings;
        this.positions = new WindowPositions(settings);
    }

    public WeatherView build(WeatherEngine engine) throws StoreReadException {
        boolean gm = engine.isAuthoritative();
        TimeSnapshot time = engine.currentTime();
        WeatherRecord record = engine.currentRecord().orElse(null);
        boolean useCelsius = Boolean.TRUE.equals(settings.get(SettingKey.USE_CELSIUS));
        boolean dialogDisplay = Boolean.TRUE.equals(settings.get(SettingKey.DIALOG_DISPLAY));

        TimeSnapshot.Display display = time == null ? null : time.getDisplay();
        return new WeatherView(
                gm,
                display == null || display.getDate() == null ? "" : display.getDate(),
                formatDate(time),
                display == null || display.getTime() == null ? "" : display.getTime(),
                time == null ? "" : time.weekdayName(),
                record == null ? "" : record.getContent().temperature(useCelsius),
                record == null ? "" : record.getContent().getDescription(),
                !(gm || dialogDisplay),
                positions.load());
    }

    /** {@code day/month/year}, or empty when there is no reading. */
    static String formatDate(TimeSnapshot time) {
        if (time == null) {
            return "";
        }
        return time.getDay() + "/" + time.getMonth() + "/" + time.getYear();
    }
}
