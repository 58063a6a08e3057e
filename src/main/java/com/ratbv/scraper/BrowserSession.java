package com.ratbv.scraper;

import java.util.List;

/**
 * One live browser session. Element lookups run against the current document, which is the
 * top-level page after {@link #navigate} and {@link #switchToDefaultContent}, or a nested frame
 * after {@link #switchToFrame}.
 */
public interface BrowserSession extends AutoCloseable {

    /**
     * Loads a URL in the top-level document and makes it current.
     * @throws ScrapeFailureException on navigation error or timeout
     */
    void navigate(String url) throws ScrapeFailureException;

    /**
     * Enters the nested document at {@code index} among the frames of the current document.
     * @throws ScrapeFailureException if no frame exists at that index
     */
    void switchToFrame(int index) throws ScrapeFailureException;

    /**
     * Returns to the top-level document.
     */
    void switchToDefaultContent();

    /**
     * Finds the first element matching a CSS selector, waiting up to the implicit wait.
     * @throws ElementNotFoundException if nothing matches
     */
    PageElement findElement(String selector) throws ScrapeFailureException;

    /**
     * Finds all elements matching a CSS selector in document order. Never fails on no match.
     */
    List<PageElement> findElements(String selector) throws ScrapeFailureException;

    /**
     * URL of the current document, used to resolve relative links.
     */
    String currentUrl();

    /**
     * Terminates the browser process. Safe to call more than once; never throws.
     */
    @Override
    void close();
}
