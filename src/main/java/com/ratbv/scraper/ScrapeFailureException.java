package com.ratbv.scraper;

/**
 * Raised when driving the browser against the transit site fails: the browser could not be
 * launched, navigation timed out, a frame was missing or an element lookup came back empty.
 * The message carries the diagnostic shown to operators.
 */
public class ScrapeFailureException extends Exception {

    public ScrapeFailureException(String message) {
        super(message);
    }

    public ScrapeFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
