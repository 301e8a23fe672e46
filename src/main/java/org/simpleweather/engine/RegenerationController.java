package org.simpleweather.engine;

import org.simpleweather.exceptions.IncompleteParametersException;
import org.simpleweather.exceptions.StoreReadException;
import org.simpleweather.exceptions.StoreWriteException;
import org.simpleweather.exceptions.UnauthorizedMutationException;
import org.simpleweather.interfaces.ClimateSource;
import org.simpleweather.interfaces.WeatherGenerator;
import org.simpleweather.interfaces.WeatherStore;
import org.simpleweather.model.ClimateParameters;
import org.simpleweather.model.TimeReading;
import org.simpleweather.model.TimeSnapshot;
import org.simpleweather.model.Transition;
import org.simpleweather.model.WeatherContent;
import org.simpleweather.model.WeatherRecord;
import org.simpleweather.util.ChangeDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides, per time update or operator request, whether to generate and commit
 * a new weather record.
 * <p>
 * Notes:
 * <ul>
 *   <li>Only a material transition seen by the authoritative instance generates.
 *   Observers refresh their local time and wait for the store.</li>
 *   <li>A commit is adopted locally only after {@link WeatherStore#write} returned.
 *   On failure the previous record stays, so the next tick sees the same
 *   material transition again.</li>
 *   <li>Called from one serialized event stream; holds no locks.</li>
 * </ul>
 */
public final class RegenerationController {

    private static final Logger log = LoggerFactory.getLogger(RegenerationController.class);

    private final WeatherStore store;
    private final WeatherGenerator generator;
    private final ClimateSource climate;
    private final LocalState state;

    RegenerationController(WeatherStore store, WeatherGenerator generator, ClimateSource climate, LocalState state) {
        this.store = store;
        this.generator = generator;
        this.climate = climate;
        this.state = state;
    }

    /**
     * Handles one tick of the calendar feed.
     *
     * @param incoming        raw reading, possibly {@code null} or partial
     * @param isAuthoritative whether this instance may commit
     * @throws StoreReadException  if the configured climate could not be read
     * @throws StoreWriteException if a commit was rejected; nothing was adopted
     */
    public UpdateOutcome onTimeUpdate(TimeSnapshot incoming, boolean isAuthoritative)
            throws StoreReadException, StoreWriteException {
        TimeReading reading = TimeReading.of(incoming);
        if (!reading.isComplete()) {
            if (!reading.isAbsent()) {
                log.debug("Ignoring partial time reading {}", incoming);
            }
            return UpdateOutcome.IGNORED;
        }

        WeatherRecord previous = state.record();
        Transition transition = ChangeDetector.classify(state.lastKnownDate(), reading);
        state.tick(incoming);

        if (transition == Transition.MATERIAL) {
            log.debug("DateTime has changed: {} -> {}", state.lastKnownDate(), incoming);
            if (isAuthoritative) {
                return commitMaterial(previous, incoming);
            }
            log.debug("Material change seen by observer; waiting for the authoritative record");
        }

        if (previous != null) {
            state.adopt(previous.withDate(incoming));
        }
        return UpdateOutcome.REFRESHED;
    }

    /**
     * Regenerates from the operator's explicit selections, whatever the calendar did.
     *
     * @return the committed record
     * @throws UnauthorizedMutationException if {@code isAuthoritative} is false
     * @throws IncompleteParametersException if any of climate, humidity or season is missing
     * @throws StoreWriteException           if the store rejected the commit
     */
    public WeatherRecord manualRegenerate(ClimateParameters params, boolean isAuthoritative)
            throws UnauthorizedMutationException, IncompleteParametersException, StoreWriteException {
        if (!isAuthoritative) {
            log.warn("Rejected manual regeneration: instance is not authoritative");
            throw new UnauthorizedMutationException("manual regeneration");
        }
        if (params == null || !params.isComplete()) {
            log.warn("Rejected manual regeneration: incomplete parameters {}", params);
            throw new IncompleteParametersException(params);
        }
        WeatherRecord seed = state.record();
        TimeSnapshot date = (seed != null && seed.getDate() != null) ? seed.getDate() : state.clock();
        return generateAndCommit(params, seed, date);
    }

    private UpdateOutcome commitMaterial(WeatherRecord previous, TimeSnapshot incoming)
            throws StoreReadException, StoreWriteException {
        // First reading for an existing record: attach it, the weather itself is still current
        if (previous != null && previous.getDate() == null) {
            WeatherRecord dated = previous.withDate(incoming);
            state.commit(store, dated);
            log.info("Attached first date {} to weather revision {}", incoming, dated.getRevision());
            return UpdateOutcome.ADOPTED;
        }

        ClimateParameters params = climate.current();
        if (params == null || !params.isComplete()) {
            log.warn("Date changed but climate selection is incomplete ({}); keeping current weather", params);
            if (previous != null) {
                state.adopt(previous.withDate(incoming));
            }
            return UpdateOutcome.REFRESHED;
        }
        generateAndCommit(params, previous, incoming);
        return UpdateOutcome.REGENERATED;
    }

    private WeatherRecord generateAndCommit(ClimateParameters params, WeatherRecord seed, TimeSnapshot date)
            throws StoreWriteException {
        log.debug("Generate new weather with {}", params);
        WeatherContent content = generator.generate(params.getClimate(), params.getHumidity(), params.getSeason(), seed);
        WeatherRecord next = WeatherRecord.next(seed, content, date);
        state.commit(store, next);
        log.info("Committed weather revision {} for {}", next.getRevision(), date);
        return next;
    }
}
