package org.simpleweather.util;

import org.simpleweather.model.TimeReading;
import org.simpleweather.model.TimeSnapshot;
import org.simpleweather.model.Transition;

/**
 * Classifies a calendar update against the last known reading.
 * <p>
 * Only day, month and year gate regeneration; second and minute never do.
 * Rules, first match wins:
 * <ol>
 *   <li>incoming absent: {@link Transition#NONE}</li>
 *   <li>incoming partial: {@link Transition#NONE}, whatever {@code previous} is</li>
 *   <li>previous absent: {@link Transition#MATERIAL}</li>
 *   <li>any of day/month/year differ: {@link Transition#MATERIAL}, else {@link Transition#NONE}</li>
 * </ol>
 */
public final class ChangeDetector {

    private ChangeDetector() {}

    public static Transition classify(TimeSnapshot previous, TimeSnapshot incoming) {
        return classify(previous, TimeReading.of(incoming));
    }

    public static Transition classify(TimeSnapshot previous, TimeReading incoming) {
        switch (incoming.kind()) {
            case ABSENT:
            case PARTIAL:
                return Transition.NONE;
            case COMPLETE:
            default:
                break;
        }
        if (previous == null) {
            return Transition.MATERIAL;
        }
        return incoming.snapshot().sameDateAs(previous) ? Transition.NONE : Transition.MATERIAL;
    }
}
