package com.ratbv.scraper;

import java.util.List;
import java.util.Optional;

/**
 * Handle to an element inside a {@link BrowserSession}. Valid only while the session is open.
 */
public interface PageElement {

    String getText() throws ScrapeFailureException;

    Optional<String> getAttribute(String name) throws ScrapeFailureException;

    /**
     * Finds the first descendant matching a CSS selector.
     * @throws ElementNotFoundException if nothing matches within the implicit wait
     */
    PageElement findElement(String selector) throws ScrapeFailureException;

    List<PageElement> findElements(String selector) throws ScrapeFailureException;
}
