package com.ratbv.scraper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered station sequence for one direction of a line. Produced fresh on every request.
 * <p>
 * {@code reversedFallback} is set when the stations were not scraped for this direction but
 * copied in reverse from the opposite one; station URLs then still point at the opposite
 * direction's timetables.
 */
public record LineTopology(String lineName, Direction direction, List<Station> stations, boolean reversedFallback) {

    public LineTopology {
        stations = List.copyOf(stations);
    }

    public LineTopology(String lineName, Direction direction, List<Station> stations) {
        this(lineName, direction, stations, false);
    }

    /**
     * Best-effort approximation of the opposite direction: same line, stations reversed.
     */
    public LineTopology reversedAs(Direction target) {
        List<Station> reversed = new ArrayList<>(stations);
        Collections.reverse(reversed);
        return new LineTopology(lineName, target, reversed, true);
    }

    public String firstStationName() {
        return stations.isEmpty() ? null : stations.get(0).name();
    }

    public String lastStationName() {
        return stations.isEmpty() ? null : stations.get(stations.size() - 1).name();
    }
}
