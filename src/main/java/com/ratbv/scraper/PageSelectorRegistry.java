package com.ratbv.scraper;

import java.util.*;

/**
 * Central registry of the selectors and frame positions used on the RATBV timetable pages.
 * <p>
 * The line page ({@code <line>-<dir>.html}) is a frameset: frame 1 holds the station list and
 * frame 2 the line header. A station page opened on its own carries the station header in
 * frame 2 as well; the timetable grid is read from the top document.
 */
public final class PageSelectorRegistry {
    private PageSelectorRegistry() {}

    public static final int STATION_LIST_FRAME = 1;
    public static final int LINE_HEADER_FRAME = 2;
    public static final int STATION_HEADER_FRAME = 2;

    public static final String LINE_NAME = "lineName";
    public static final String STATION_ENTRY = "stationEntry";
    public static final String STATION_NAME = "stationName";
    public static final String STATION_LINK = "stationLink";
    public static final String STATION_TITLE = "stationTitle";
    public static final String TIMETABLE = "timetable";
    public static final String HOUR = "hour";
    public static final String MINUTE_GROUP = "minuteGroup";
    public static final String MINUTE = "minute";

    private static final List<PageSelector> FIELDS = List.of(
        new PageSelector(LINE_NAME, List.of("#linia_web b")),
        // current, intermediate and terminal station markers
        new PageSelector(STATION_ENTRY, List.of(".list_sus_active", ".list_statie", ".list_statie_capat")),
        new PageSelector(STATION_NAME, List.of("b")),
        new PageSelector(STATION_LINK, List.of("a")),
        new PageSelector(STATION_TITLE, List.of("#statie_web b")),
        new PageSelector(TIMETABLE, List.of("#tabel2")),
        new PageSelector(HOUR, List.of("#web_class_hours")),
        new PageSelector(MINUTE_GROUP, List.of("#web_class_minutes")),
        new PageSelector(MINUTE, List.of("#web_min"))
    );

    /**
     * Returns the PageSelector for a given field name, or null if not found.
     */
    public static PageSelector getField(String name) {
        for (PageSelector f : FIELDS) if (f.fieldName.equals(name)) return f;
        return null;
    }

    /**
     * Shorthand for the combined CSS of a registered field.
     * @throws IllegalArgumentException for an unknown field name
     */
    public static String css(String name) {
        PageSelector field = getField(name);
        if (field == null) throw new IllegalArgumentException("Unknown selector field: " + name);
        return field.css();
    }
}
