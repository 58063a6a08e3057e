package com.ratbv.scraper;

import org.junit.jupiter.api.*;
import static org.junit.jupiter.api.Assertions.*;
import java.time.LocalTime;
import java.util.*;

public class DepartureBoardTest {
    private static final Route ROUTE = new Route("23b-2-dus", "Linia 23B", "23b", Direction.OUTBOUND, "2", "Gara",
        "https://www.ratbv.ro/afisaje/23b-dus/line_23b_2_cl1_ro.html", "Sala Sporturilor", "Gara", null);

    @Test
    void testNextDepartureIsFirstStrictlyLaterTime() {
        List<String> times = List.of("7:05", "7:20", "8:10");
        assertEquals(1, DepartureBoard.nextDepartureIndex(times, LocalTime.of(7, 5)));
        assertEquals(0, DepartureBoard.nextDepartureIndex(times, LocalTime.of(6, 59)));
        assertEquals(2, DepartureBoard.nextDepartureIndex(times, LocalTime.of(7, 20, 30)));
    }

    @Test
    void testNoNextDepartureAfterLastTime() {
        assertEquals(-1, DepartureBoard.nextDepartureIndex(List.of("22:40", "23:15"), LocalTime.of(23, 30)));
        assertEquals(-1, DepartureBoard.nextDepartureIndex(List.of(), LocalTime.NOON));
    }

    @Test
    void testUnparseableEntriesSkipped() {
        assertEquals(1, DepartureBoard.nextDepartureIndex(List.of("--", "9:00"), LocalTime.of(8, 0)));
    }

    @Test
    void testRenderMarksNextDeparture() {
        TimetableResult result = new TimetableResult(List.of("7:05", "7:20", "8:10"), false, 0L);

        String board = DepartureBoard.render(ROUTE, result, LocalTime.of(7, 10, 15));

        assertTrue(board.startsWith("Linia 23B - Gara (Sala Sporturilor -> Gara)\n"));
        assertTrue(board.contains("Updated 07:10:15"));
        assertTrue(board.contains("[7:20]"));
        assertFalse(board.contains("[7:05]"));
    }

    @Test
    void testRenderShowsCacheAgeAndEmptyState() {
        TimetableResult result = new TimetableResult(List.of(), true, 65_400L);

        String board = DepartureBoard.render(ROUTE, result, LocalTime.NOON);

        assertTrue(board.contains("Cached 65s ago"));
        assertTrue(board.contains(DepartureBoard.EMPTY_STATE));
    }

    @Test
    void testTimeEntryParsing() {
        assertEquals(new TimeEntry(7, 5), TimeEntry.parse(" 7:05 "));
        assertEquals("7:05", new TimeEntry(7, 5).toString());
        assertThrows(IllegalArgumentException.class, () -> TimeEntry.parse("24:00"));
        assertThrows(IllegalArgumentException.class, () -> TimeEntry.parse("7.05"));
    }
}
