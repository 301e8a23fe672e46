package org.simpleweather.util;

import org.simpleweather.model.TimeReading;
import org.simpleweather.model.TimeSnapshot;

/**
 * Decides whether a calendar reading is complete enough to reason about.
 * <p>
 * The feed may emit half-initialised values while it starts; such readings are
 * never allowed to trigger a regeneration.
 */
public final class TimeSnapshotValidator {

    private TimeSnapshotValidator() {}

    /**
     * @return {@code true} iff second, minute, day, month and year are all present
     */
    public static boolean isValid(TimeSnapshot snapshot) {
        return TimeReading.of(snapshot).isComplete();
    }
}
