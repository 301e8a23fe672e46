package org.simpleweather.engine;

import org.simpleweather.exceptions.StoreWriteException;
import org.simpleweather.interfaces.WeatherStore;
import org.simpleweather.model.TimeSnapshot;
import org.simpleweather.model.WeatherRecord;

/**
 * What one instance currently shows: the record it adopted (possibly with a
 * locally refreshed time) and the latest complete clock reading.
 * Only {@link #commit} writes to the store.
 */
final class LocalState {
    private WeatherRecord record;
    private WeatherRecord inFlight;
    private TimeSnapshot clock;

    WeatherRecord record() {
        return record;
    }

    void adopt(WeatherRecord record) {
        this.record = record;
    }

    /**
     * Writes {@code next} and adopts it once the store accepted it. On failure
     * the current record stays.
     */
    void commit(WeatherStore store, WeatherRecord next) throws StoreWriteException {
        inFlight = next;
        try {
            store.write(next);
        } finally {
            inFlight = null;
        }
        adopt(next);
    }

    /** @return whether {@code stored} is the record this instance holds or is writing right now. */
    boolean isOwnRecord(WeatherRecord stored) {
        return stored.equals(record) || stored.equals(inFlight);
    }

    TimeSnapshot clock() {
        return clock;
    }

    void tick(TimeSnapshot clock) {
        this.clock = clock;
    }

    /** Date the next update is compared against; {@code null} when nothing is known yet. */
    TimeSnapshot lastKnownDate() {
        return record == null ? null : record.getDate();
    }
}
