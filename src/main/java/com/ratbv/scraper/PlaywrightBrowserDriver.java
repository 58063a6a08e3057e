package com.ratbv.scraper;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.util.Arrays;

/**
 * {@link BrowserDriver} backed by Playwright's headless Chromium.
 * <p>
 * Each call to {@link #openSession()} starts its own Playwright driver and browser process;
 * nothing is pooled. If launching fails half way, whatever was already started is shut down
 * before the failure is reported.
 *
 * @author RATBV Scraper Team
 * @since 1.0
 */
public class PlaywrightBrowserDriver implements BrowserDriver {
    private static final Logger logger = LoggerFactory.getLogger(PlaywrightBrowserDriver.class);

    private final ScraperConfig config;

    public PlaywrightBrowserDriver(ScraperConfig config) {
        this.config = config;
    }

    @Override
    public BrowserSession openSession() throws ScrapeFailureException {
        Playwright playwright;
        try {
            playwright = Playwright.create();
        } catch (RuntimeException e) {
            throw new ScrapeFailureException("Playwright initialization error: " + e.getMessage(), e);
        }
        Browser browser = null;
        try {
            browser = playwright.chromium().launch(getDefaultLaunchOptions());
            Page page = browser.newPage();
            page.setDefaultTimeout(config.implicitWaitMs());
            page.setDefaultNavigationTimeout(config.navigationTimeoutMs());
            logger.debug("Opened browser session (chromium {})", browser.version());
            return new PlaywrightBrowserSession(playwright, browser, page, config.implicitWaitMs());
        } catch (RuntimeException e) {
            if (browser != null) {
                PlaywrightBrowserSession.closeStep(browser::close, "browser");
            }
            PlaywrightBrowserSession.closeStep(playwright::close, "playwright");
            throw new ScrapeFailureException("Error launching browser: " + e.getMessage(), e);
        }
    }

    // --- Browser setup ---
    BrowserType.LaunchOptions getDefaultLaunchOptions() {
        BrowserType.LaunchOptions options = new BrowserType.LaunchOptions();
        options.setHeadless(true);
        options.setChromiumSandbox(false);
        options.setTimeout(config.navigationTimeoutMs());
        options.setArgs(Arrays.asList(
            "--no-sandbox",
            "--disable-dev-shm-usage",
            "--disable-gpu",
            "--lang=ro-RO"
        ));
        if (config.browserExecutablePath() != null) {
            options.setExecutablePath(Paths.get(config.browserExecutablePath()));
        }
        return options;
    }
}
