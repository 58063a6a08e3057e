package com.ratbv.scraper;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.Frame;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Playwright-backed session. The "current document" is a Playwright {@link Frame}: the page's
 * main frame after navigation, or one of its descendants after {@link #switchToFrame(int)}.
 */
final class PlaywrightBrowserSession implements BrowserSession {
    private static final Logger logger = LoggerFactory.getLogger(PlaywrightBrowserSession.class);

    private final Playwright playwright;
    private final Browser browser;
    private final Page page;
    private final double implicitWaitMs;
    private Frame current;
    private boolean closed;

    PlaywrightBrowserSession(Playwright playwright, Browser browser, Page page, double implicitWaitMs) {
        this.playwright = playwright;
        this.browser = browser;
        this.page = page;
        this.implicitWaitMs = implicitWaitMs;
    }

    @Override
    public void navigate(String url) throws ScrapeFailureException {
        logger.debug("Navigating to {}", url);
        try {
            Response response = page.navigate(url);
            if (response != null && !response.ok()) {
                logger.warn("Navigation to {} returned HTTP {}", url, response.status());
            }
        } catch (PlaywrightException e) {
            throw new ScrapeFailureException("Navigation to " + url + " failed: " + e.getMessage(), e);
        }
        current = page.mainFrame();
    }

    @Override
    public void switchToFrame(int index) throws ScrapeFailureException {
        Frame scope = currentFrame();
        List<Frame> children;
        try {
            children = scope.childFrames();
        } catch (PlaywrightException e) {
            throw new ScrapeFailureException("Failed to list frames of " + scope.url() + ": " + e.getMessage(), e);
        }
        if (index < 0 || index >= children.size()) {
            throw new ScrapeFailureException("No frame at index " + index + " in " + scope.url()
                + " (" + children.size() + " frames)");
        }
        current = children.get(index);
        logger.debug("Switched to frame {} ({})", index, current.url());
    }

    @Override
    public void switchToDefaultContent() {
        current = page.mainFrame();
    }

    @Override
    public PageElement findElement(String selector) throws ScrapeFailureException {
        return PlaywrightPageElement.first(currentFrame().locator(selector), selector, implicitWaitMs);
    }

    @Override
    public List<PageElement> findElements(String selector) throws ScrapeFailureException {
        return PlaywrightPageElement.all(currentFrame().locator(selector), selector, implicitWaitMs);
    }

    @Override
    public String currentUrl() {
        return currentFrame().url();
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        closeStep(page::close, "page");
        closeStep(browser::close, "browser");
        closeStep(playwright::close, "playwright");
        logger.debug("Browser session closed");
    }

    private Frame currentFrame() {
        return current != null ? current : page.mainFrame();
    }

    // One failing step must not keep the remaining processes alive.
    static void closeStep(Runnable step, String what) {
        try {
            step.run();
        } catch (RuntimeException e) {
            logger.warn("Failed to close {}: {}", what, e.getMessage());
        }
    }
}
