package com.ratbv.scraper;

/**
 * Launches headless browser sessions against the transit site.
 * <p>
 * Every session is a separate OS-level browser process. Callers must close it on every exit
 * path, normally with try-with-resources:
 * <pre>{@code
 * try (BrowserSession session = driver.openSession()) {
 *     session.navigate(url);
 *     ...
 * }
 * }</pre>
 *
 * @author RATBV Scraper Team
 * @since 1.0
 */
public interface BrowserDriver {
    /**
     * Starts a new browser session.
     * @return an open session positioned on a blank document
     * @throws ScrapeFailureException if the browser process cannot be launched
     */
    BrowserSession openSession() throws ScrapeFailureException;
}
