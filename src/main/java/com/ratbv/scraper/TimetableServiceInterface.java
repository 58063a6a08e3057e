package com.ratbv.scraper;

import java.util.List;
import java.util.Map;

/**
 * Entry point the presentation layer calls into: line topology scraping, cached timetables
 * and route management.
 * <p>
 * Registry read/write failures surface as {@link java.io.UncheckedIOException}.
 */
public interface TimetableServiceInterface {

    /**
     * Scrapes the station sequence of one direction of a line. Never cached.
     * @param masterUrl line page, e.g. {@code https://www.ratbv.ro/afisaje/23b-dus.html}
     * @throws InvalidRequestException if the URL is blank or names no direction
     */
    LineTopology fetchLineTopology(String masterUrl) throws ScrapeFailureException;

    /**
     * Scrapes both directions of a line. If the inbound page cannot be scraped, the outbound
     * sequence reversed is returned in its place, flagged {@link LineTopology#reversedFallback()}.
     */
    Map<Direction, LineTopology> fetchLineTopologies(String lineNumber) throws ScrapeFailureException;

    /**
     * Scrapes a station's display name from its timetable page header. Never cached.
     * @throws InvalidRequestException if the URL is blank
     */
    String fetchStationName(String stationUrl) throws ScrapeFailureException;

    /**
     * Returns the route's timetable, from its snapshot while fresh, otherwise by scraping once
     * and storing the result.
     */
    TimetableResult fetchTimetable(Route route) throws ScrapeFailureException;

    /**
     * @throws RouteNotFoundException if no route has this id
     */
    TimetableResult fetchTimetable(String routeId) throws ScrapeFailureException;

    /**
     * Display-path lookup by identity triple.
     * @throws InvalidRequestException if an argument is missing
     * @throws RouteNotFoundException if no route matches
     */
    TimetableResult fetchTimetable(String lineNumber, Direction direction, String stationSlug) throws ScrapeFailureException;

    /**
     * Clears the route's snapshot regardless of its age.
     * @throws RouteNotFoundException if no route has this id
     */
    void invalidateCache(String routeId);

    List<Route> listRoutes();

    /**
     * @throws DuplicateRouteIdException if the id or identity triple is taken
     * @throws InvalidRequestException if a required field is missing
     */
    void addRoute(Route route);

    /**
     * Registers the station at {@code stationIndex} (0-based) of a scraped topology.
     * @throws InvalidRequestException if the topology was approximated from the opposite direction
     * @return the route that was added
     */
    Route addRouteFromTopology(String lineNumber, LineTopology topology, int stationIndex);

    /**
     * Scrapes the line page and registers its station at {@code stationIndex} (0-based).
     * The line number is taken from the master URL.
     * @return the route that was added
     */
    Route addRouteFromLine(String masterUrl, int stationIndex) throws ScrapeFailureException;

    /**
     * Registers a route entered by hand; identity is parsed from the station URL.
     * @return the route that was added
     */
    Route addManualRoute(String id, String name, String stationName, String url);

    /**
     * @throws RouteNotFoundException if no route has this id
     */
    void deleteRoute(String routeId);
}
