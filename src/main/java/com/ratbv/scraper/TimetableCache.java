package com.ratbv.scraper;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Freshness policy for per-route timetable snapshots.
 * <p>
 * A route is Fresh while its snapshot is younger than the time-to-live and Stale otherwise
 * (including when it has no snapshot). The current instant comes from the supplied
 * {@link Clock}; nothing here touches storage.
 */
public class TimetableCache {
    private final Clock clock;
    private final Duration ttl;

    public TimetableCache(Clock clock, Duration ttl) {
        if (ttl.isNegative() || ttl.isZero()) throw new IllegalArgumentException("TTL must be positive: " + ttl);
        this.clock = clock;
        this.ttl = ttl;
    }

    public TimetableCache(Clock clock) {
        this(clock, ScraperConfig.CACHE_TTL);
    }

    public boolean isFresh(Route route) {
        return route.cacheSnapshot().map(s -> s.freshAt(clock.instant(), ttl)).orElse(false);
    }

    /**
     * @return the route carrying a new snapshot captured now
     */
    public Route store(Route route, List<String> times) {
        return route.withCache(new CacheSnapshot(times, clock.instant()));
    }

    /**
     * Result for a route known to be fresh.
     * @throws IllegalStateException if the route has no snapshot
     */
    public TimetableResult cachedResult(Route route) {
        CacheSnapshot snapshot = route.cacheSnapshot()
            .orElseThrow(() -> new IllegalStateException("Route has no cached timetable: " + route.id()));
        return new TimetableResult(snapshot.times(), true, snapshot.ageAt(clock.instant()).toMillis());
    }
}
