package org.simpleweather.engine;

import org.simpleweather.exceptions.IncompleteParametersException;
import org.simpleweather.exceptions.StoreReadException;
import org.simpleweather.exceptions.StoreWriteException;
import org.simpleweather.exceptions.UnauthorizedMutationException;
import org.simpleweather.interfaces.AuthorityGate;
import org.simpleweather.interfaces.ClimateSource;
import org.simpleweather.interfaces.RefreshListener;
import org.simpleweather.interfaces.SettingsListener;
import org.simpleweather.interfaces.WeatherGenerator;
import org.simpleweather.interfaces.WeatherStore;
import org.simpleweather.model.ClimateParameters;
import org.simpleweather.model.TimeSnapshot;
import org.simpleweather.model.WeatherRecord;
import org.simpleweather.settings.SettingKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * One instance's weather engine: owns the local view and routes time updates,
 * operator requests and store notifications to the bootstrap loader and the
 * regeneration controller.
 * <p>
 * Construct one per runtime instance and pass it to whatever needs it. All
 * entry points are expected on a single, serialized event stream. The
 * authority gate is asked again on every call.
 */
public final class WeatherEngine {

    private static final Logger log = LoggerFactory.getLogger(WeatherEngine.class);

    private final WeatherStore store;
    private final AuthorityGate gate;
    private final LocalState state = new LocalState();
    private final BootstrapLoader bootstrap;
    private final RegenerationController controller;
    private final List<RefreshListener> listeners = new CopyOnWriteArrayList<>();

    public WeatherEngine(WeatherStore store, WeatherGenerator generator, ClimateSource climate, AuthorityGate gate) {
        this.store = Objects.requireNonNull(store, "store");
        this.gate = Objects.requireNonNull(gate, "gate");
        Objects.requireNonNull(generator, "generator");
        Objects.requireNonNull(climate, "climate");
        this.bootstrap = new BootstrapLoader(store, generator, gate, state);
        this.controller = new RegenerationController(store, generator, climate, state);
    }

    /**
     * Loads (or, when authoritative and the store is empty, seeds) the shared record.
     * Call once after construction.
     */
    public Optional<WeatherRecord> start() throws StoreReadException, StoreWriteException {
        Optional<WeatherRecord> record;
        try {
            record = bootstrap.initialize();
        } catch (StoreWriteException e) {
            log.error("Could not save the initial weather", e);
            throw e;
        }
        notifyRefresh();
        return record;
    }

    /** Feeds one tick of the calendar; {@code null} means the feed has nothing this tick. */
    public UpdateOutcome onTimeUpdate(TimeSnapshot incoming) throws StoreReadException, StoreWriteException {
        UpdateOutcome outcome;
        try {
            outcome = controller.onTimeUpdate(incoming, gate.isAuthoritative());
        } catch (StoreWriteException e) {
            log.error("Weather commit failed for {}", incoming, e);
            throw e;
        }
        if (outcome != UpdateOutcome.IGNORED) {
            notifyRefresh();
        }
        return outcome;
    }

    /** Operator-requested regeneration with explicit selections. */
    public WeatherRecord manualRegenerate(ClimateParameters params)
            throws UnauthorizedMutationException, IncompleteParametersException, StoreWriteException {
        WeatherRecord committed;
        try {
            committed = controller.manualRegenerate(params, gate.isAuthoritative());
        } catch (StoreWriteException e) {
            log.error("Manual regeneration could not be saved", e);
            throw e;
        }
        notifyRefresh();
        return committed;
    }

    /**
     * Re-reads the shared record and adopts it. This is how observers pick up
     * the authoritative instance's commits. An empty store leaves the local
     * record in place.
     */
    public Optional<WeatherRecord> onStoreUpdated() throws StoreReadException {
        Optional<WeatherRecord> stored = store.read();
        stored.ifPresent(this::adoptStored);
        return stored;
    }

    /**
     * Listener to register on the shared settings store: reloads when the
     * weather key changes. A stored record equal to the one this instance holds
     * or is committing is its own write coming back and is ignored.
     */
    public SettingsListener storeListener() {
        return key -> {
            if (!SettingKey.LAST_WEATHER_DATA.equals(key)) {
                return;
            }
            try {
                Optional<WeatherRecord> stored = store.read();
                if (stored.isEmpty()) {
                    return;
                }
                if (state.isOwnRecord(stored.get())) {
                    log.debug("Ignoring store echo of revision {}", stored.get().getRevision());
                    return;
                }
                adoptStored(stored.get());
            } catch (StoreReadException e) {
                log.error("Could not reload weather after store update", e);
            }
        };
    }

    private void adoptStored(WeatherRecord incoming) {
        WeatherRecord local = state.record();
        if (local != null && incoming.getRevision() < local.getRevision()) {
            // Two writers, or a restored store; adopt anyway, the store is the reference
            log.warn("Stored weather revision went backwards: {} -> {}", local.getRevision(), incoming.getRevision());
        }
        state.adopt(incoming);
        log.debug("Adopted weather revision {} from store", incoming.getRevision());
        notifyRefresh();
    }

    public boolean isAuthoritative() {
        return gate.isAuthoritative();
    }

    public Optional<WeatherRecord> currentRecord() {
        return Optional.ofNullable(state.record());
    }

    /** Latest complete clock reading, falling back to the record's date. */
    public TimeSnapshot currentTime() {
        TimeSnapshot clock = state.clock();
        if (clock != null) {
            return clock;
        }
        WeatherRecord record = state.record();
        return record == null ? null : record.getDate();
    }

    public void subscribe(RefreshListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void unsubscribe(RefreshListener listener) {
        listeners.remove(listener);
    }

    private void notifyRefresh() {
        for (RefreshListener l : listeners) {
            l.refreshRequested();
        }
    }
}
