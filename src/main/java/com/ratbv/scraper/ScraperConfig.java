package com.ratbv.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Runtime settings for the scraper, resolved from environment variables first,
 * then Java system properties, then built-in defaults.
 * <p>
 * Headless mode, the sandbox flags and the cache time-to-live are fixed and cannot be
 * overridden from the environment.
 *
 * @author RATBV Scraper Team
 * @since 1.0
 */
public final class ScraperConfig {
    private static final Logger logger = LoggerFactory.getLogger(ScraperConfig.class);

    public static final String DEFAULT_BASE_URL = "https://www.ratbv.ro/afisaje/";
    public static final String DEFAULT_ROUTES_FILE = "scraped-data/routes.json";
    public static final String DEFAULT_EXPORT_DIR = "scraped-data";
    public static final int DEFAULT_IMPLICIT_WAIT_MS = 10_000;
    public static final int DEFAULT_NAVIGATION_TIMEOUT_MS = 30_000;
    public static final Duration CACHE_TTL = Duration.ofMinutes(5);

    private final String browserExecutablePath;
    private final String baseUrl;
    private final Path routesFile;
    private final Path exportDir;
    private final int implicitWaitMs;
    private final int navigationTimeoutMs;

    public ScraperConfig(String browserExecutablePath, String baseUrl, Path routesFile, Path exportDir,
                         int implicitWaitMs, int navigationTimeoutMs) {
        this.browserExecutablePath = browserExecutablePath == null || browserExecutablePath.isBlank() ? null : browserExecutablePath;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
        this.routesFile = routesFile;
        this.exportDir = exportDir;
        this.implicitWaitMs = implicitWaitMs;
        this.navigationTimeoutMs = navigationTimeoutMs;
    }

    /**
     * Builds the configuration from the process environment and system properties.
     */
    public static ScraperConfig fromEnvironment() {
        ScraperConfig config = new ScraperConfig(
            envOrProp("CHROMIUM_EXECUTABLE_PATH", ""),
            envOrProp("RATBV_BASE_URL", DEFAULT_BASE_URL),
            Paths.get(envOrProp("RATBV_ROUTES_FILE", DEFAULT_ROUTES_FILE)),
            Paths.get(envOrProp("SCRAPER_EXPORT_DIR", DEFAULT_EXPORT_DIR)),
            intEnvOrProp("SCRAPER_IMPLICIT_WAIT_MS", DEFAULT_IMPLICIT_WAIT_MS),
            intEnvOrProp("SCRAPER_NAVIGATION_TIMEOUT_MS", DEFAULT_NAVIGATION_TIMEOUT_MS)
        );
        logger.debug("Loaded configuration: {}", config);
        return config;
    }

    static String envOrProp(String key, String defaultVal) {
        String ev = System.getenv(key);
        if (ev != null && !ev.isBlank()) return ev;
        String prop = System.getProperty(key);
        return prop != null && !prop.isBlank() ? prop : defaultVal;
    }

    private static int intEnvOrProp(String key, int defaultVal) {
        String raw = envOrProp(key, Integer.toString(defaultVal));
        try {
            int value = Integer.parseInt(raw.trim());
            if (value > 0) return value;
            logger.warn("Ignoring non-positive value '{}' for {}; using {}", raw, key, defaultVal);
        } catch (NumberFormatException e) {
            logger.warn("Ignoring invalid value '{}' for {}; using {}", raw, key, defaultVal);
        }
        return defaultVal;
    }

    /** Optional path to a Chromium binary; {@code null} means the browser bundled with Playwright. */
    public String browserExecutablePath() {
        return browserExecutablePath;
    }

    public String baseUrl() {
        return baseUrl;
    }

    public Path routesFile() {
        return routesFile;
    }

    public Path exportDir() {
        return exportDir;
    }

    public int implicitWaitMs() {
        return implicitWaitMs;
    }

    public int navigationTimeoutMs() {
        return navigationTimeoutMs;
    }

    @Override
    public String toString() {
        return "ScraperConfig{browserExecutablePath=" + browserExecutablePath
            + ", baseUrl=" + baseUrl
            + ", routesFile=" + routesFile
            + ", exportDir=" + exportDir
            + ", implicitWaitMs=" + implicitWaitMs
            + ", navigationTimeoutMs=" + navigationTimeoutMs + "}";
    }
}
