package org.simpleweather.util;

import org.junit.jupiter.api.Test;
import org.simpleweather.model.TimeReading;
import org.simpleweather.model.TimeSnapshot;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;
import static org.simpleweather.TestSupport.at;

class TimeSnapshotValidatorTest {

    @Test
    void completeSnapshotIsValid() {
        assertTrue(TimeSnapshotValidator.isValid(at(1, 1, 1000, 0, 0, 0)));
    }

    @Test
    void nullSnapshotIsInvalid() {
        assertFalse(TimeSnapshotValidator.isValid(null));
        assertTrue(TimeReading.of(null).isAbsent());
    }

    @Test
    void eachMissingTemporalFieldMakesItInvalid() {
        TimeSnapshot full = at(3, 4, 1200, 5, 6, 7);
        assertFalse(TimeSnapshotValidator.isValid(full.toBuilder().second(null).build()));
        assertFalse(TimeSnapshotValidator.isValid(full.toBuilder().minute(null).build()));
        assertFalse(TimeSnapshotValidator.isValid(full.toBuilder().day(null).build()));
        assertFalse(TimeSnapshotValidator.isValid(full.toBuilder().month(null).build()));
        assertFalse(TimeSnapshotValidator.isValid(full.toBuilder().year(null).build()));
        assertEquals(TimeReading.Kind.PARTIAL, TimeReading.of(full.toBuilder().year(null).build()).kind());
    }

    @Test
    void hourAndDisplayFieldsAreNotRequired() {
        TimeSnapshot noHour = at(3, 4, 1200, 5, 6, 7).toBuilder().hour(null).display(null).weekdays(null).build();
        assertTrue(TimeSnapshotValidator.isValid(noHour));
    }

    @Test
    void absentReadingHasNoSnapshot() {
        assertThrows(IllegalStateException.class, () -> TimeReading.absent().snapshot());
    }

    @Test
    void missingWeekdayNameIsCarriedThrough() {
        TimeSnapshot reading = at(3, 4, 1200).toBuilder()
                .weekdays(Arrays.asList("Moonday", null))
                .dayOfTheWeek(1)
                .build();

        assertTrue(TimeSnapshotValidator.isValid(reading));
        assertNull(reading.weekdayName());
        assertEquals(reading, reading.toBuilder().build());
    }
}
