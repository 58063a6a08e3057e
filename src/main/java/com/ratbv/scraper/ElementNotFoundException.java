package com.ratbv.scraper;

/**
 * An element lookup matched nothing within the implicit wait.
 */
public class ElementNotFoundException extends ScrapeFailureException {
    private final String selector;

    public ElementNotFoundException(String selector, Throwable cause) {
        super("Element not found: " + selector, cause);
        this.selector = selector;
    }

    public String getSelector() {
        return selector;
    }
}
