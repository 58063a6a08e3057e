package com.ratbv.scraper;

import org.junit.jupiter.api.*;
import static org.junit.jupiter.api.Assertions.*;
import java.util.*;

/**
 * Tests for station timetable extraction and grid flattening.
 */
public class TimetableExtractorTest {
    private static final String STATION_URL = "https://www.ratbv.ro/afisaje/23b-dus/line_23b_12_cl1_ro.html";

    @Test
    void testFlattenPairsHoursWithMinuteGroupsInPageOrder() {
        List<String> times = TimetableExtractor.flatten(
            List.of("7", "8"),
            List.of(List.of("05", "20"), List.of("10")));
        assertEquals(List.of("7:05", "7:20", "8:10"), times);
    }

    @Test
    void testFlattenSkipsHoursWithoutMinuteGroup() {
        List<String> times = TimetableExtractor.flatten(List.of("6", "7", "8"), List.of(List.of("15")));
        assertEquals(List.of("6:15"), times);
    }

    @Test
    void testFlattenTrimsEveryValue() {
        List<String> times = TimetableExtractor.flatten(List.of(" 9 \n"), List.of(List.of(" 05 ", "35\t")));
        assertEquals(List.of("9:05", "9:35"), times);
    }

    @Test
    void testFlattenIgnoresExtraMinuteGroups() {
        List<String> times = TimetableExtractor.flatten(List.of("22"), List.of(List.of("40"), List.of("00")));
        assertEquals(List.of("22:40"), times);
    }

    @Test
    void testExtractReadsGridThroughBrowser() throws Exception {
        FakeBrowserDriver driver = new FakeBrowserDriver();
        driver.timetablePage(STATION_URL, List.of("5", "6", "23"),
            List.of(List.of("45"), List.of("10", "40"), List.of("15")));

        List<String> times = new TimetableExtractor(driver).extract(STATION_URL);

        assertEquals(List.of("5:45", "6:10", "6:40", "23:15"), times);
        assertEquals(1, driver.sessionsOpened);
        assertEquals(1, driver.sessionsClosed);
    }

    @Test
    void testExtractReturnsEmptyListWhenNoBusesListed() throws Exception {
        FakeBrowserDriver driver = new FakeBrowserDriver();
        driver.timetablePage(STATION_URL, List.of(), List.of());

        assertTrue(new TimetableExtractor(driver).extract(STATION_URL).isEmpty());
        assertEquals(1, driver.sessionsClosed);
    }

    @Test
    void testExtractFailsWhenTableMissingAndReleasesSession() {
        FakeBrowserDriver driver = new FakeBrowserDriver();
        driver.page(STATION_URL);

        ElementNotFoundException e = assertThrows(ElementNotFoundException.class,
            () -> new TimetableExtractor(driver).extract(STATION_URL));
        assertEquals(PageSelectorRegistry.css(PageSelectorRegistry.TIMETABLE), e.getSelector());
        assertEquals(1, driver.sessionsClosed);
    }

    @Test
    void testExtractFailsOnNavigationErrorAndReleasesSession() {
        FakeBrowserDriver driver = new FakeBrowserDriver();

        assertThrows(ScrapeFailureException.class, () -> new TimetableExtractor(driver).extract(STATION_URL));
        assertEquals(1, driver.sessionsOpened);
        assertEquals(1, driver.sessionsClosed);
    }

    @Test
    void testExtractPropagatesLaunchFailure() {
        FakeBrowserDriver driver = new FakeBrowserDriver();
        driver.launchFailure = new ScrapeFailureException("Failed to launch Chromium");

        ScrapeFailureException e = assertThrows(ScrapeFailureException.class,
            () -> new TimetableExtractor(driver).extract(STATION_URL));
        assertEquals("Failed to launch Chromium", e.getMessage());
        assertEquals(0, driver.sessionsClosed);
    }
}
