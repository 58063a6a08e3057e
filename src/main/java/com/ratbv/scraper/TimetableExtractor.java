package com.ratbv.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static com.ratbv.scraper.PageSelectorRegistry.*;

/**
 * Reads a station's arrival-time grid and flattens it into {@code H:MM} strings.
 * <p>
 * The grid is a column of hour labels next to a column of minute groups, aligned by index.
 * Output order is page order (hour by hour, minutes in order within each hour) and is not
 * re-sorted across midnight. An empty result means no buses are listed and is not an error.
 *
 * @author RATBV Scraper Team
 * @since 1.0
 */
public class TimetableExtractor {
    private static final Logger logger = LoggerFactory.getLogger(TimetableExtractor.class);

    private final BrowserDriver driver;

    public TimetableExtractor(BrowserDriver driver) {
        this.driver = driver;
    }

    /**
     * @param stationUrl direct timetable URL of one station in one direction
     * @return arrival times in page order
     * @throws ScrapeFailureException if the grid cannot be read; the session is still released
     */
    public List<String> extract(String stationUrl) throws ScrapeFailureException {
        logger.info("Scraping bus times from: {}", stationUrl);
        try (BrowserSession session = driver.openSession()) {
            session.navigate(stationUrl);
            PageElement table = session.findElement(css(TIMETABLE));

            List<String> hours = new ArrayList<>();
            for (PageElement hour : table.findElements(css(HOUR))) {
                hours.add(hour.getText());
            }
            List<List<String>> minutesByHour = new ArrayList<>();
            for (PageElement group : table.findElements(css(MINUTE_GROUP))) {
                List<String> minutes = new ArrayList<>();
                for (PageElement minute : group.findElements(css(MINUTE))) {
                    minutes.add(minute.getText());
                }
                minutesByHour.add(minutes);
            }
            if (minutesByHour.size() < hours.size()) {
                logger.debug("{} hour labels but only {} minute groups at {}; unmatched hours skipped",
                    hours.size(), minutesByHour.size(), stationUrl);
            }

            List<String> times = flatten(hours, minutesByHour);
            logger.info("Scraped {} bus times from: {}", times.size(), stationUrl);
            return times;
        }
    }

    /**
     * Pairs each hour with the minute group at the same index. Hours without a group
     * contribute nothing. Every value is trimmed before formatting.
     */
    static List<String> flatten(List<String> hours, List<List<String>> minutesByHour) {
        List<String> times = new ArrayList<>();
        for (int i = 0; i < hours.size(); i++) {
            if (i >= minutesByHour.size()) break;
            String hour = Utils.clean(hours.get(i));
            for (String minute : minutesByHour.get(i)) {
                times.add(hour + ":" + Utils.clean(minute));
            }
        }
        return times;
    }
}
