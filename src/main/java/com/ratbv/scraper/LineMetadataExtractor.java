package com.ratbv.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

import static com.ratbv.scraper.PageSelectorRegistry.*;

/**
 * Reads a line's display name and ordered station list for one direction from the line's
 * master page.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Navigates to the master URL, which is a frameset.</li>
 *   <li>Enters the header frame and reads the bold line name.</li>
 *   <li>Returns to the top document, enters the station list frame and collects every station
 *   entry (current, intermediate and terminal markers) in document order.</li>
 *   <li>For each entry reads the bold station name and the timetable link, resolved against
 *   the frame URL.</li>
 * </ul>
 * The result is never cached. Any lookup failure aborts the whole extraction; the browser
 * session is closed either way.
 *
 * @author RATBV Scraper Team
 * @since 1.0
 */
public class LineMetadataExtractor {
    private static final Logger logger = LoggerFactory.getLogger(LineMetadataExtractor.class);

    private final BrowserDriver driver;

    public LineMetadataExtractor(BrowserDriver driver) {
        this.driver = driver;
    }

    /**
     * @param masterUrl  line page for one direction, e.g. {@code .../afisaje/23b-dus.html}
     * @param direction  direction the master URL belongs to
     * @return line name and stations in travel order
     * @throws ScrapeFailureException on launch, navigation, frame or element failure
     */
    public LineTopology extract(String masterUrl, Direction direction) throws ScrapeFailureException {
        logger.info("Scraping line topology from: {}", masterUrl);
        try (BrowserSession session = driver.openSession()) {
            session.navigate(masterUrl);

            session.switchToFrame(LINE_HEADER_FRAME);
            String lineName = Utils.clean(session.findElement(css(LINE_NAME)).getText());

            session.switchToDefaultContent();
            session.switchToFrame(STATION_LIST_FRAME);
            String frameUrl = session.currentUrl();
            List<PageElement> entries = session.findElements(css(STATION_ENTRY));

            List<Station> stations = new ArrayList<>(entries.size());
            for (PageElement entry : entries) {
                String name = Utils.clean(entry.findElement(css(STATION_NAME)).getText());
                String href = entry.findElement(css(STATION_LINK)).getAttribute("href").orElse("");
                stations.add(new Station(Utils.slugify(name), name, resolveLink(frameUrl, Utils.clean(href))));
            }
            if (stations.isEmpty()) {
                logger.warn("No station entries found for line '{}' at {}", lineName, masterUrl);
            }
            logger.info("Scraped line '{}' ({}) with {} stations", lineName, direction.code(), stations.size());
            return new LineTopology(lineName, direction, stations);
        }
    }

    // Station anchors are relative to the station list frame.
    static String resolveLink(String baseUrl, String href) {
        if (href.isEmpty() || baseUrl == null || baseUrl.isBlank()) return href;
        try {
            return URI.create(baseUrl).resolve(href.replace(" ", "%20")).toString();
        } catch (IllegalArgumentException e) {
            logger.debug("Leaving unresolvable link as-is: {} ({})", href, e.getMessage());
            return href;
        }
    }
}
