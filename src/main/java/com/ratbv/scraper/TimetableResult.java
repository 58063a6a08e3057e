package com.ratbv.scraper;

import java.util.List;

/**
 * Timetable handed back to the presentation layer.
 *
 * @param times           arrival times in scraped order, possibly empty
 * @param servedFromCache whether the times came from the route's snapshot
 * @param ageMillis       age of the snapshot; 0 for a fresh scrape
 */
public record TimetableResult(List<String> times, boolean servedFromCache, long ageMillis) {

    public TimetableResult {
        times = List.copyOf(times);
    }
}
