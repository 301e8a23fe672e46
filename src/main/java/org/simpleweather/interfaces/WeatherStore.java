package org.simpleweather.interfaces;

import org.simpleweather.exceptions.StoreReadException;
import org.simpleweather.exceptions.StoreWriteException;
import org.simpleweather.model.WeatherRecord;

import java.util.Optional;

/**
 * Narrow read/write contract against the shared persisted store.
 * <p>
 * Implementations do not retry. A record is written as one value; readers see
 * either the old or the new record, never a mix.
 */
public interface WeatherStore {

    /**
     * @return the stored record, or empty if none has been written yet
     * @throws StoreReadException if the store failed for any reason other than "not found"
     */
    Optional<WeatherRecord> read() throws StoreReadException;

    /**
     * Replaces the stored record. Returns only once the write has completed.
     *
     * @throws StoreWriteException if the store rejected the write
     */
    void write(WeatherRecord record) throws StoreWriteException;
}
