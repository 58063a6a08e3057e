package com.ratbv.scraper;

/**
 * One stop on a line's topology, as scraped from the station list frame.
 *
 * @param slug human-readable token derived from the name
 * @param name display name
 * @param url  direct timetable URL for this station in this direction
 */
public record Station(String slug, String name, String url) {}
