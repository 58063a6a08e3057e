package com.ratbv.scraper;

import java.util.Locale;

/**
 * Travel direction of a line, keyed by the code the transit site uses in its URLs.
 */
public enum Direction {
    OUTBOUND("dus"),
    INBOUND("intors");

    private final String code;

    Direction(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public Direction opposite() {
        return this == OUTBOUND ? INBOUND : OUTBOUND;
    }

    /**
     * Parses a site code ("dus"/"intors") or an enum name.
     * @throws InvalidRequestException if the value names no direction
     */
    public static Direction fromCode(String value) {
        if (value != null) {
            String v = value.trim().toLowerCase(Locale.ROOT);
            for (Direction d : values()) {
                if (d.code.equals(v) || d.name().toLowerCase(Locale.ROOT).equals(v)) return d;
            }
        }
        throw new InvalidRequestException("Unknown direction: " + value);
    }
}
