package com.ratbv.scraper;

import com.microsoft.playwright.Locator;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.WaitForSelectorState;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link PageElement} wrapping a Playwright {@link Locator} that resolves to a single element.
 */
final class PlaywrightPageElement implements PageElement {
    private final Locator locator;
    private final double implicitWaitMs;

    PlaywrightPageElement(Locator locator, double implicitWaitMs) {
        this.locator = locator;
        this.implicitWaitMs = implicitWaitMs;
    }

    @Override
    public String getText() throws ScrapeFailureException {
        try {
            return locator.innerText();
        } catch (PlaywrightException e) {
            throw new ScrapeFailureException("Failed to read text: " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<String> getAttribute(String name) throws ScrapeFailureException {
        try {
            return Optional.ofNullable(locator.getAttribute(name));
        } catch (PlaywrightException e) {
            throw new ScrapeFailureException("Failed to read attribute '" + name + "': " + e.getMessage(), e);
        }
    }

    @Override
    public PageElement findElement(String selector) throws ScrapeFailureException {
        return first(locator.locator(selector), selector, implicitWaitMs);
    }

    @Override
    public List<PageElement> findElements(String selector) throws ScrapeFailureException {
        return all(locator.locator(selector), selector, implicitWaitMs);
    }

    static PageElement first(Locator matches, String selector, double waitMs) throws ScrapeFailureException {
        Locator first = matches.first();
        try {
            first.waitFor(new Locator.WaitForOptions()
                .setState(WaitForSelectorState.ATTACHED)
                .setTimeout(waitMs));
        } catch (TimeoutError e) {
            throw new ElementNotFoundException(selector, e);
        } catch (PlaywrightException e) {
            throw new ScrapeFailureException("Lookup of '" + selector + "' failed: " + e.getMessage(), e);
        }
        return new PlaywrightPageElement(first, waitMs);
    }

    static List<PageElement> all(Locator matches, String selector, double waitMs) throws ScrapeFailureException {
        try {
            List<PageElement> elements = new ArrayList<>();
            for (Locator each : matches.all()) {
                elements.add(new PlaywrightPageElement(each, waitMs));
            }
            return elements;
        } catch (PlaywrightException e) {
            throw new ScrapeFailureException("Lookup of '" + selector + "' failed: " + e.getMessage(), e);
        }
    }
}
