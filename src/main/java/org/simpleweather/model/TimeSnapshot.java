package org.simpleweather.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One reading of the external calendar feed.
 * <p>
 * Every field is nullable because the feed may deliver partially initialised
 * values while it starts up. Only {@code second}, {@code minute}, {@code day},
 * {@code month} and {@code year} are interpreted; {@code hour},
 * {@code dayOfTheWeek}, {@code weekdays} and {@code display} are carried through
 * for presentation.
 */
public final class TimeSnapshot {
    private final Integer second;
    private final Integer minute;
    private final Integer hour;
    private final Integer day;
    private final Integer month;
    private final Integer year;
    private final Integer dayOfTheWeek;
    private final List<String> weekdays;
    private final Display display;

    public TimeSnapshot(Integer second,
                        Integer minute,
                        Integer hour,
                        Integer day,
                        Integer month,
                        Integer year,
                        Integer dayOfTheWeek,
                        List<String> weekdays,
                        Display display) {
        this.second = second;
        this.minute = minute;
        this.hour = hour;
        this.day = day;
        this.month = month;
        this.year = year;
        this.dayOfTheWeek = dayOfTheWeek;
        this.weekdays = weekdays == null ? null : Collections.unmodifiableList(new ArrayList<>(weekdays));
        this.display = display;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Integer getSecond() { return second; }
    public Integer getMinute() { return minute; }
    public Integer getHour() { return hour; }
    public Integer getDay() { return day; }
    public Integer getMonth() { return month; }
    public Integer getYear() { return year; }
    public Integer getDayOfTheWeek() { return dayOfTheWeek; }
    public List<String> getWeekdays() { return weekdays == null ? Collections.emptyList() : weekdays; }
    public Display getDisplay() { return display; }

    /** Same calendar day, month and year (nulls compare equal to nulls). */
    public boolean sameDateAs(TimeSnapshot other) {
        return other != null
                && Objects.equals(day, other.day)
                && Objects.equals(month, other.month)
                && Objects.equals(year, other.year);
    }

    /** @return weekday name for {@code dayOfTheWeek}, or empty string when unknown. */
    public String weekdayName() {
        List<String> names = getWeekdays();
        if (dayOfTheWeek == null || dayOfTheWeek < 0 || dayOfTheWeek >= names.size()) {
            return "";
        }
        return names.get(dayOfTheWeek);
    }

    public Builder toBuilder() {
        return new Builder()
                .second(second).minute(minute).hour(hour)
                .day(day).month(month).year(year)
                .dayOfTheWeek(dayOfTheWeek).weekdays(weekdays).display(display);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TimeSnapshot)) {
            return false;
        }
        TimeSnapshot that = (TimeSnapshot) o;
        return Objects.equals(second, that.second)
                && Objects.equals(minute, that.minute)
                && Objects.equals(hour, that.hour)
                && Objects.equals(day, that.day)
                && Objects.equals(month, that.month)
                && Objects.equals(year, that.year)
                && Objects.equals(dayOfTheWeek, that.dayOfTheWeek)
                && Objects.equals(weekdays, that.weekdays)
                && Objects.equals(display, that.display);
    }

    @Override
    public int hashCode() {
        return Objects.hash(second, minute, hour, day, month, year, dayOfTheWeek, weekdays, display);
    }

    @Override
    public String toString() {
        return "TimeSnapshot{" +
                "day=" + day +
                ", month=" + month +
                ", year=" + year +
                ", hour=" + hour +
                ", minute=" + minute +
                ", second=" + second +
                '}';
    }

    /** Pre-formatted strings from the calendar feed. */
    public static final class Display {
        private final String date;
        private final String time;

        public Display(String date, String time) {
            this.date = date;
            this.time = time;
        }

        public String getDate() { return date; }
        public String getTime() { return time; }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Display)) {
                return false;
            }
            Display that = (Display) o;
            return Objects.equals(date, that.date) && Objects.equals(time, that.time);
        }

        @Override
        public int hashCode() {
            return Objects.hash(date, time);
        }
    }

    public static final class Builder {
        private Integer second;
        private Integer minute;
        private Integer hour;
        private Integer day;
        private Integer month;
        private Integer year;
        private Integer dayOfTheWeek;
        private List<String> weekdays;
        private Display display;

        public Builder second(Integer second) { this.second = second; return this; }
        public Builder minute(Integer minute) { this.minute = minute; return this; }
        public Builder hour(Integer hour) { this.hour = hour; return this; }
        public Builder day(Integer day) { this.day = day; return this; }
        public Builder month(Integer month) { this.month = month; return this; }
        public Builder year(Integer year) { this.year = year; return this; }
        public Builder dayOfTheWeek(Integer dayOfTheWeek) { this.dayOfTheWeek = dayOfTheWeek; return this; }
        public Builder weekdays(List<String> weekdays) { this.weekdays = weekdays; return this; }
        public Builder display(Display display) { this.display = display; return this; }

        /** Sets day, month and year in one call. */
        public Builder date(int day, int month, int year) {
            this.day = day;
            this.month = month;
            this.year = year;
            return this;
        }

        /** Sets hour, minute and second in one call. */
        public Builder time(int hour, int minute, int second) {
            this.hour = hour;
            this.minute = minute;
            this.second = second;
            return this;
        }

        public TimeSnapshot build() {
            return new TimeSnapshot(second, minute, hour, day, month, year, dayOfTheWeek, weekdays, display);
        }
    }
}
