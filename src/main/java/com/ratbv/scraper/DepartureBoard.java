package com.ratbv.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;

/**
 * Text rendering of a route's timetable for the command line, with the next bus marked.
 * <p>
 * The next bus is the first entry, in scraped order, whose hour and minute fall strictly after
 * the current local time. There is no day rollover: after the last listed time of the day
 * nothing is marked, even when the list continues past midnight.
 */
public final class DepartureBoard {
    private static final Logger logger = LoggerFactory.getLogger(DepartureBoard.class);

    public static final ZoneId TRANSIT_ZONE = ZoneId.of("Europe/Bucharest");
    static final String EMPTY_STATE = "No buses scheduled at the moment.";

    private DepartureBoard() {}

    /**
     * @return index of the next departure in {@code times}, or -1 if none is later than {@code now}
     */
    public static int nextDepartureIndex(List<String> times, LocalTime now) {
        for (int i = 0; i < times.size(); i++) {
            try {
                if (TimeEntry.parse(times.get(i)).toLocalTime().isAfter(now)) return i;
            } catch (IllegalArgumentException e) {
                logger.debug("Skipping unparseable time '{}': {}", times.get(i), e.getMessage());
            }
        }
        return -1;
    }

    public static String render(Route route, TimetableResult result, LocalTime now) {
        StringBuilder out = new StringBuilder();
        out.append(route.name()).append(" - ").append(route.stationName());
        if (route.firstStation() != null && route.lastStation() != null) {
            out.append(" (").append(route.firstStation()).append(" -> ").append(route.lastStation()).append(')');
        }
        out.append('\n');
        if (result.servedFromCache()) {
            out.append("Cached ").append(result.ageMillis() / 1000).append("s ago\n");
        } else {
            out.append("Updated ").append(now.withNano(0)).append('\n');
        }
        List<String> times = result.times();
        if (times.isEmpty()) {
            return out.append(EMPTY_STATE).append('\n').toString();
        }
        int next = nextDepartureIndex(times, now);
        for (int i = 0; i < times.size(); i++) {
            String cell = i == next ? "[" + times.get(i) + "]" : " " + times.get(i) + " ";
            out.append(String.format("%-8s", cell));
            if ((i + 1) % 8 == 0 || i == times.size() - 1) out.append('\n');
        }
        return out.toString();
    }
}
