package com.ratbv.scraper;

import java.util.List;

/**
 * A named group of CSS selectors for one piece of the transit site's markup.
 * Alternatives are combined into a single selector list, so matches come back in document order.
 */
public class PageSelector {
    public final String fieldName;
    public final List<String> selectors;

    public PageSelector(String fieldName, List<String> selectors) {
        this.fieldName = fieldName;
        this.selectors = List.copyOf(selectors);
    }

    /**
     * @return the alternatives joined as a CSS selector list, e.g. {@code .a, .b}
     */
    public String css() {
        return String.join(", ", selectors);
    }
}
