package com.ratbv.scraper;

import java.time.LocalTime;

/**
 * A daily recurring arrival instant, hour and minute only.
 */
public record TimeEntry(int hour, int minute) {

    public TimeEntry {
        if (hour < 0 || hour > 23 || minute < 0 || minute > 59) {
            throw new IllegalArgumentException("Invalid time of day: " + hour + ":" + minute);
        }
    }

    /**
     * Parses a scraped {@code H:MM} value. Surrounding whitespace is ignored.
     * @throws IllegalArgumentException if the text is not a time of day
     */
    public static TimeEntry parse(String text) {
        if (text == null) throw new IllegalArgumentException("Time text is null");
        String[] parts = text.trim().split(":");
        if (parts.length != 2) throw new IllegalArgumentException("Not an H:MM value: " + text);
        try {
            return new TimeEntry(Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not an H:MM value: " + text, e);
        }
    }

    public LocalTime toLocalTime() {
        return LocalTime.of(hour, minute);
    }

    @Override
    public String toString() {
        return hour + ":" + (minute < 10 ? "0" + minute : Integer.toString(minute));
    }
}
