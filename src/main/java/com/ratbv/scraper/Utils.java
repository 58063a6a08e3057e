package com.ratbv.scraper;

import java.util.Locale;

/**
 * Text helpers shared by the extractors and the exporters.
 *
 * @author RATBV Scraper Team
 * @since 1.0
 */
public final class Utils {
    private Utils() {}

    /**
     * Sanitizes a filename by replacing each special character and whitespace with an underscore.
     * @param name Input filename
     * @return Sanitized filename
     */
    public static String sanitizeFilename(String name) {
        return name == null ? "" : name.replaceAll("[*?\"<>|/:\\s]", "_");
    }

    /**
     * Derives a station slug from a display name: lowercase, periods stripped, whitespace
     * runs collapsed to one hyphen. Not collision-free.
     * @param name station name as shown on the site
     * @return slug such as {@code sala-sporturilor}
     */
    public static String slugify(String name) {
        if (name == null) return "";
        return name.trim()
            .toLowerCase(Locale.ROOT)
            .replace(".", "")
            .replaceAll("\\s+", "-");
    }

    /**
     * Trims scraped text, mapping {@code null} to the empty string.
     */
    public static String clean(String text) {
        return text == null ? "" : text.trim();
    }
}
