package org.simpleweather.model;

import java.util.Objects;

/**
 * The shared weather state: generated content plus the calendar reading it
 * was generated for.
 * <p>
 * Instances are immutable. A new commit produces a new value whose
 * {@code revision} is one higher than its seed's; observers use the revision
 * only to notice when the stored record goes backwards.
 */
public final class WeatherRecord {
    private final TimeSnapshot date;      // may be null (bootstrap before the feed is up)
    private final WeatherContent content;
    private final long revision;

    public WeatherRecord(TimeSnapshot date, WeatherContent content, long revision) {
        this.date = date;
        this.content = Objects.requireNonNull(content, "content");
        this.revision = revision;
    }

    /**
     * Builds the record that follows {@code seed}.
     *
     * @param seed previous record, or {@code null} for the first one
     */
    public static WeatherRecord next(WeatherRecord seed, WeatherContent content, TimeSnapshot date) {
        long revision = (seed == null) ? 1L : seed.revision + 1;
        return new WeatherRecord(date, content, revision);
    }

    public TimeSnapshot getDate() { return date; }
    public WeatherContent getContent() { return content; }
    public long getRevision() { return revision; }

    /** Same record with another calendar reading; revision and content unchanged. */
    public WeatherRecord withDate(TimeSnapshot newDate) {
        return new WeatherRecord(newDate, content, revision);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WeatherRecord)) {
            return false;
        }
        WeatherRecord that = (WeatherRecord) o;
        return revision == that.revision
                && Objects.equals(date, that.date)
                && Objects.equals(content, that.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(date, content, revision);
    }

    @Override
    public String toString() {
        return "WeatherRecord{" +
                "revision=" + revision +
                ", date=" + date +
                ", content=" + content +
                '}';
    }
}
