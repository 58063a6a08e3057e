package com.ratbv.scraper;

import java.util.Optional;

/**
 * A (line, direction, station) triple with its own cached timetable.
 * <p>
 * {@code id} is the durable external key, normally {@code lineNumber-stationSlug-direction}.
 * The identity triple is the lookup key of the display path. Both must stay unique in the
 * registry. The only mutations are cache writes and invalidation, each returning a copy.
 *
 * @param firstStation first station of this direction, may be {@code null}
 * @param lastStation  last station of this direction, may be {@code null}
 * @param cache        snapshot of the last scrape, {@code null} when absent
 */
public record Route(
    String id,
    String name,
    String lineNumber,
    Direction direction,
    String stationSlug,
    String stationName,
    String url,
    String firstStation,
    String lastStation,
    CacheSnapshot cache
) {

    public Optional<CacheSnapshot> cacheSnapshot() {
        return Optional.ofNullable(cache);
    }

    public Route withCache(CacheSnapshot snapshot) {
        return new Route(id, name, lineNumber, direction, stationSlug, stationName, url, firstStation, lastStation, snapshot);
    }

    public Route withoutCache() {
        return withCache(null);
    }

    /**
     * True when this route is the one addressed by the given identity triple.
     * Line number and slug compare case-insensitively.
     */
    public boolean matches(String line, Direction dir, String slug) {
        return lineNumber != null && lineNumber.equalsIgnoreCase(line)
            && direction == dir
            && stationSlug != null && stationSlug.equalsIgnoreCase(slug);
    }
}
