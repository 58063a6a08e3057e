package com.ratbv.scraper;

import org.junit.jupiter.api.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for reading a station's display name from its page header.
 */
public class StationNameExtractorTest {
    private static final String STATION_URL = "https://www.ratbv.ro/afisaje/4-intors/line_4_9_cl1_ro.html";

    @Test
    void testExtractReadsTrimmedTitle() throws Exception {
        FakeBrowserDriver driver = new FakeBrowserDriver();
        driver.stationPage(STATION_URL, "\n Livada Postei ");

        assertEquals("Livada Postei", new StationNameExtractor(driver).extract(STATION_URL));
        assertEquals(1, driver.sessionsOpened);
        assertEquals(1, driver.sessionsClosed);
    }

    @Test
    void testMissingTitleFailsAndReleasesSession() {
        FakeBrowserDriver driver = new FakeBrowserDriver();
        driver.page(STATION_URL).frame(PageSelectorRegistry.STATION_HEADER_FRAME, STATION_URL + "#header");

        ElementNotFoundException e = assertThrows(ElementNotFoundException.class,
            () -> new StationNameExtractor(driver).extract(STATION_URL));
        assertEquals("#statie_web b", e.getSelector());
        assertEquals(1, driver.sessionsClosed);
    }

    @Test
    void testMissingHeaderFrameFailsAndReleasesSession() {
        FakeBrowserDriver driver = new FakeBrowserDriver();
        driver.page(STATION_URL);

        assertThrows(ScrapeFailureException.class, () -> new StationNameExtractor(driver).extract(STATION_URL));
        assertEquals(1, driver.sessionsClosed);
    }
}
