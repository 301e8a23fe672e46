package org.simpleweather.engine;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.simpleweather.TestSupport.CountingGenerator;
import org.simpleweather.TestSupport.RecordingWeatherStore;
import org.simpleweather.exceptions.IncompleteParametersException;
import org.simpleweather.exceptions.StoreWriteException;
import org.simpleweather.exceptions.UnauthorizedMutationException;
import org.simpleweather.model.Climate;
import org.simpleweather.model.ClimateParameters;
import org.simpleweather.model.Humidity;
import org.simpleweather.model.Season;
import org.simpleweather.model.TimeSnapshot;
import org.simpleweather.model.WeatherRecord;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.simpleweather.TestSupport.at;
import static org.simpleweather.TestSupport.content;

class RegenerationControllerTest {

    private static final ClimateParameters SELECTED =
            new ClimateParameters(Climate.HOT, Humidity.LAVISH, Season.SUMMER);

    private final TimeSnapshot dayOne = at(1, 1, 1000, 10, 0, 0);
    private final WeatherRecord saved = new WeatherRecord(dayOne, content(60), 3);

    private RecordingWeatherStore store;
    private CountingGenerator generator;
    private AtomicBoolean gm;
    private ClimateParameters configured;
    private WeatherEngine engine;
    private AtomicInteger refreshes;

    @BeforeEach
    void setUp() throws Exception {
        store = new RecordingWeatherStore(saved);
        generator = new CountingGenerator();
        gm = new AtomicBoolean(true);
        configured = SELECTED;
        engine = new WeatherEngine(store, generator, () -> configured, gm::get);
        engine.start();
        refreshes = new AtomicInteger();
        engine.subscribe(refreshes::incrementAndGet);
    }

    @Test
    void timeOfDayChangeOnlyRefreshesTheClock() throws Exception {
        TimeSnapshot later = at(1, 1, 1000, 10, 30, 15);

        assertEquals(UpdateOutcome.REFRESHED, engine.onTimeUpdate(later));

        assertEquals(0, generator.count());
        assertTrue(store.writes.isEmpty());
        assertEquals(later, engine.currentTime());
        assertEquals(later, engine.currentRecord().orElseThrow().getDate());
        assertEquals(3, engine.currentRecord().orElseThrow().getRevision());
        assertEquals(1, refreshes.get());
    }

    @Test
    void newDayRegeneratesWithPreviousRecordAsSeed() throws Exception {
        TimeSnapshot dayTwo = at(2, 1, 1000, 0, 0, 0);

        assertEquals(UpdateOutcome.REGENERATED, engine.onTimeUpdate(dayTwo));

        assertEquals(1, generator.count());
        assertEquals(saved, generator.last().seed());
        assertEquals(Climate.HOT, generator.last().climate());
        assertEquals(Humidity.LAVISH, generator.last().humidity());
        assertEquals(Season.SUMMER, generator.last().season());

        assertEquals(1, store.writes.size());
        WeatherRecord committed = store.writes.get(0);
        assertEquals(dayTwo, committed.getDate());
        assertEquals(4, committed.getRevision());
        assertEquals(61, committed.getContent().getTemperature());
        assertEquals(committed, engine.currentRecord().orElseThrow());
        assertEquals(1, refreshes.get());
    }

    @Test
    void sameDayTwiceCommitsOnce() throws Exception {
        TimeSnapshot dayTwo = at(2, 1, 1000, 0, 0, 0);

        assertEquals(UpdateOutcome.REGENERATED, engine.onTimeUpdate(dayTwo));
        assertEquals(UpdateOutcome.REFRESHED, engine.onTimeUpdate(dayTwo));
        assertEquals(UpdateOutcome.REFRESHED, engine.onTimeUpdate(at(2, 1, 1000, 0, 5, 0)));

        assertEquals(1, generator.count());
        assertEquals(1, store.writes.size());
    }

    @Test
    void observerNeverGeneratesOrWrites() throws Exception {
        gm.set(false);

        assertEquals(UpdateOutcome.REFRESHED, engine.onTimeUpdate(at(2, 1, 1000)));
        assertEquals(UpdateOutcome.REFRESHED, engine.onTimeUpdate(at(5, 6, 1001)));

        assertEquals(0, generator.count());
        assertTrue(store.writes.isEmpty());
        assertEquals(at(5, 6, 1001), engine.currentTime());
        assertEquals(3, engine.currentRecord().orElseThrow().getRevision());
        assertEquals(2, refreshes.get());
    }

    @Test
    void authorityIsAskedOnEveryUpdate() throws Exception {
        gm.set(false);
        engine.onTimeUpdate(at(2, 1, 1000));
        assertTrue(store.writes.isEmpty());

        gm.set(true);
        assertEquals(UpdateOutcome.REGENERATED, engine.onTimeUpdate(at(3, 1, 1000)));
        assertEquals(1, store.writes.size());
    }

    @Test
    void failedCommitKeepsLastGoodRecordAndRetriesNextTick() throws Exception {
        store.failWrites = true;
        TimeSnapshot dayTwo = at(2, 1, 1000);

        assertThrows(StoreWriteException.class, () -> engine.onTimeUpdate(dayTwo));

        WeatherRecord current = engine.currentRecord().orElseThrow();
        assertEquals(saved, current);
        assertEquals(0, refreshes.get());

        store.failWrites = false;
        assertEquals(UpdateOutcome.REGENERATED, engine.onTimeUpdate(dayTwo));
        assertEquals(4, engine.currentRecord().orElseThrow().getRevision());
    }

    @Test
    void partialAndAbsentReadingsAreIgnored() throws Exception {
        TimeSnapshot partial = at(2, 1, 1000).toBuilder().minute(null).build();

        assertEquals(UpdateOutcome.IGNORED, engine.onTimeUpdate(partial));
        assertEquals(UpdateOutcome.IGNORED, engine.onTimeUpdate(null));

        assertEquals(0, generator.count());
        assertTrue(store.writes.isEmpty());
        assertEquals(dayOne, engine.currentTime());
        assertEquals(0, refreshes.get());
    }

    @Test
    void firstDateIsAttachedToUndatedRecordWithoutRegenerating() throws Exception {
        store = new RecordingWeatherStore(new WeatherRecord(null, content(40), 1));
        engine = new WeatherEngine(store, generator, () -> configured, gm::get);
        engine.start();

        assertEquals(UpdateOutcome.ADOPTED, engine.onTimeUpdate(dayOne));

        assertEquals(0, generator.count());
        assertEquals(1, store.writes.size());
        assertEquals(dayOne, store.stored.getDate());
        assertEquals(1, store.stored.getRevision());
        assertEquals(40, store.stored.getContent().getTemperature());
    }

    @Test
    void authoritativeInstanceWithoutRecordGeneratesOnFirstReading() throws Exception {
        store = new RecordingWeatherStore();
        gm.set(false);
        engine = new WeatherEngine(store, generator, () -> configured, gm::get);
        engine.start();
        gm.set(true);

        assertEquals(UpdateOutcome.REGENERATED, engine.onTimeUpdate(dayOne));

        assertNull(generator.last().seed());
        assertEquals(1, store.stored.getRevision());
        assertEquals(dayOne, store.stored.getDate());
    }

    @Test
    void incompleteConfiguredClimateKeepsCurrentWeather() throws Exception {
        configured = new ClimateParameters(Climate.COLD, null, Season.WINTER);

        assertEquals(UpdateOutcome.REFRESHED, engine.onTimeUpdate(at(2, 1, 1000)));

        assertEquals(0, generator.count());
        assertTrue(store.writes.isEmpty());
    }

    @Test
    void manualRegenerateCommitsWithSuppliedParameters() throws Exception {
        ClimateParameters chosen = new ClimateParameters(Climate.COLD, Humidity.BARREN, Season.WINTER);

        WeatherRecord committed = engine.manualRegenerate(chosen);

        assertEquals(1, generator.count());
        assertEquals(saved, generator.last().seed());
        assertEquals(Climate.COLD, committed.getContent().getClimate());
        assertEquals(Season.WINTER, committed.getContent().getSeason());
        assertEquals(dayOne, committed.getDate());
        assertEquals(4, committed.getRevision());
        assertEquals(committed, store.stored);
        assertEquals(1, refreshes.get());
    }

    @Test
    void manualRegenerateWithMissingParameterTouchesNothing() {
        int readsBefore = store.reads;
        ClimateParameters missingClimate = new ClimateParameters(null, Humidity.MODEST, Season.FALL);

        IncompleteParametersException e = assertThrows(IncompleteParametersException.class,
                () -> engine.manualRegenerate(missingClimate));

        assertEquals(missingClimate, e.getParameters());
        assertEquals(0, generator.count());
        assertTrue(store.writes.isEmpty());
        assertEquals(readsBefore, store.reads);
        assertEquals(0, refreshes.get());
    }

    @Test
    void manualRegenerateByObserverIsRejected() {
        gm.set(false);

        assertThrows(UnauthorizedMutationException.class, () -> engine.manualRegenerate(SELECTED));

        assertEquals(0, generator.count());
        assertTrue(store.writes.isEmpty());
    }

    @Test
    void controllerHonoursTheAuthorityFlagItIsGiven() throws Exception {
        LocalState state = new LocalState();
        state.adopt(saved);
        RegenerationController controller = new RegenerationController(store, generator, () -> SELECTED, state);

        assertEquals(UpdateOutcome.REFRESHED, controller.onTimeUpdate(at(9, 9, 1009), false));
        assertTrue(store.writes.isEmpty());
        assertThrows(UnauthorizedMutationException.class, () -> controller.manualRegenerate(SELECTED, false));
    }
}
