package com.ratbv.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.ratbv.scraper.PageSelectorRegistry.*;

/**
 * Reads the display name of a station from its timetable page header.
 *
 * @author RATBV Scraper Team
 * @since 1.0
 */
public class StationNameExtractor {
    private static final Logger logger = LoggerFactory.getLogger(StationNameExtractor.class);

    private final BrowserDriver driver;

    public StationNameExtractor(BrowserDriver driver) {
        this.driver = driver;
    }

    /**
     * @param stationUrl timetable URL of one station
     * @return trimmed station name, possibly empty
     * @throws ScrapeFailureException if the header frame or title is missing; the session is still released
     */
    public String extract(String stationUrl) throws ScrapeFailureException {
        logger.info("Scraping station name from: {}", stationUrl);
        try (BrowserSession session = driver.openSession()) {
            session.navigate(stationUrl);
            session.switchToFrame(STATION_HEADER_FRAME);
            String name = Utils.clean(session.findElement(css(STATION_TITLE)).getText());
            logger.info("Station name at {}: '{}'", stationUrl, name);
            return name;
        }
    }
}
