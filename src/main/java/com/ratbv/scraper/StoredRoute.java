package com.ratbv.scraper;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * On-disk layout of a route. Cache state is kept inline as {@code cachedBusTimes} and
 * {@code cacheTimestamp} (epoch millis); both are omitted when there is no snapshot.
 * Records written before the identity fields existed still load.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record StoredRoute(
    String id,
    String name,
    String lineNumber,
    String direction,
    String stationSlug,
    String stationName,
    String url,
    String firstStation,
    String lastStation,
    List<String> cachedBusTimes,
    Long cacheTimestamp
) {

    static StoredRoute from(Route route) {
        CacheSnapshot snapshot = route.cache();
        return new StoredRoute(
            route.id(),
            route.name(),
            route.lineNumber(),
            route.direction() == null ? null : route.direction().code(),
            route.stationSlug(),
            route.stationName(),
            route.url(),
            route.firstStation(),
            route.lastStation(),
            snapshot == null ? null : snapshot.times(),
            snapshot == null ? null : snapshot.capturedAt().toEpochMilli()
        );
    }

    Route toRoute() {
        CacheSnapshot snapshot = cachedBusTimes != null && cacheTimestamp != null
            ? new CacheSnapshot(cachedBusTimes, Instant.ofEpochMilli(cacheTimestamp))
            : null;
        return new Route(
            id,
            name,
            lineNumber,
            direction == null ? null : Direction.fromCode(direction),
            stationSlug,
            stationName,
            url,
            firstStation,
            lastStation,
            snapshot
        );
    }
}
