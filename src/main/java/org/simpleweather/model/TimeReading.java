package org.simpleweather.model;

import java.util.Objects;

/**
 * Tagged view of one tick of the time feed: nothing, a partially populated
 * snapshot, or a snapshot carrying all five temporal fields.
 * <p>
 * Use {@link #of(TimeSnapshot)} to classify a raw (nullable) snapshot; only a
 * {@link Kind#COMPLETE} reading may influence change detection.
 */
public final class TimeReading {

    public enum Kind { ABSENT, PARTIAL, COMPLETE }

    private static final TimeReading ABSENT = new TimeReading(Kind.ABSENT, null);

    private final Kind kind;
    private final TimeSnapshot snapshot;

    private TimeReading(Kind kind, TimeSnapshot snapshot) {
        this.kind = kind;
        this.snapshot = snapshot;
    }

    public static TimeReading absent() {
        return ABSENT;
    }

    public static TimeReading of(TimeSnapshot snapshot) {
        if (snapshot == null) {
            return ABSENT;
        }
        boolean complete = isDefined(snapshot.getSecond())
                && isDefined(snapshot.getMinute())
                && isDefined(snapshot.getDay())
                && isDefined(snapshot.getMonth())
                && isDefined(snapshot.getYear());
        return new TimeReading(complete ? Kind.COMPLETE : Kind.PARTIAL, snapshot);
    }

    private static boolean isDefined(Integer value) {
        return value != null;
    }

    public Kind kind() {
        return kind;
    }

    public boolean isAbsent() {
        return kind == Kind.ABSENT;
    }

    public boolean isComplete() {
        return kind == Kind.COMPLETE;
    }

    /**
     * @return the underlying snapshot
     * @throws IllegalStateException when the reading is {@link Kind#ABSENT}
     */
    public TimeSnapshot snapshot() {
        if (kind == Kind.ABSENT) {
            throw new IllegalStateException("absent time reading has no snapshot");
        }
        return snapshot;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TimeReading)) {
            return false;
        }
        TimeReading that = (TimeReading) o;
        return kind == that.kind && Objects.equals(snapshot, that.snapshot);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, snapshot);
    }

    @Override
    public String toString() {
        return "TimeReading{" + kind + (snapshot == null ? "" : ", " + snapshot) + '}';
    }
}
