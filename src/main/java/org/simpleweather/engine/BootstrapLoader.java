package org.simpleweather.engine;

import org.simpleweather.exceptions.StoreReadException;
import org.simpleweather.exceptions.StoreWriteException;
import org.simpleweather.interfaces.AuthorityGate;
import org.simpleweather.interfaces.WeatherGenerator;
import org.simpleweather.interfaces.WeatherStore;
import org.simpleweather.model.ClimateParameters;
import org.simpleweather.model.WeatherContent;
import org.simpleweather.model.WeatherRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Loads the shared record once at startup, seeding it if this instance is
 * authoritative and the store is still empty.
 */
public final class BootstrapLoader {

    private static final Logger log = LoggerFactory.getLogger(BootstrapLoader.class);

    private final WeatherStore store;
    private final WeatherGenerator generator;
    private final AuthorityGate gate;
    private final LocalState state;

    BootstrapLoader(WeatherStore store, WeatherGenerator generator, AuthorityGate gate, LocalState state) {
        this.store = store;
        this.generator = generator;
        this.gate = gate;
        this.state = state;
    }

    /**
     * @return the adopted record, or empty when this observer has to wait for the authoritative side
     * @throws StoreReadException  if the store could not be read (a missing record is not an error)
     * @throws StoreWriteException if the seeded record could not be committed; nothing is adopted
     */
    public Optional<WeatherRecord> initialize() throws StoreReadException, StoreWriteException {
        Optional<WeatherRecord> stored = store.read();
        if (stored.isPresent()) {
            log.info("Using saved weather data, revision {}", stored.get().getRevision());
            state.adopt(stored.get());
            return stored;
        }

        if (!gate.isAuthoritative()) {
            log.info("No saved weather data; waiting for the authoritative instance");
            return Optional.empty();
        }

        log.info("No saved weather data - generating weather");
        ClimateParameters defaults = ClimateParameters.defaults();
        WeatherContent content = generator.generate(
                defaults.getClimate(), defaults.getHumidity(), defaults.getSeason(), null);
        WeatherRecord first = WeatherRecord.next(null, content, state.clock());
        state.commit(store, first);
        log.debug("Setting weather: {}", first);
        return Optional.of(first);
    }
}
