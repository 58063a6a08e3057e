package com.ratbv.scraper;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Most recently scraped timetable of a route together with its capture time.
 * Replaced wholesale on refresh, never edited in place.
 */
public record CacheSnapshot(List<String> times, Instant capturedAt) {

    public CacheSnapshot {
        times = List.copyOf(times);
        Objects.requireNonNull(capturedAt, "capturedAt");
    }

    public Duration ageAt(Instant now) {
        Duration age = Duration.between(capturedAt, now);
        return age.isNegative() ? Duration.ZERO : age;
    }

    /**
     * A snapshot is fresh while its age is strictly below the time-to-live. A capture time
     * later than {@code now} (clock set back) counts as stale.
     */
    public boolean freshAt(Instant now, Duration ttl) {
        if (capturedAt.isAfter(now)) return false;
        return ageAt(now).compareTo(ttl) < 0;
    }
}
