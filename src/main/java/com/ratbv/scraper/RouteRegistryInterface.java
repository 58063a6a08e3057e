package com.ratbv.scraper;

import java.io.IOException;
import java.util.List;

/**
 * Whole-collection persistence for routes. There is no per-record update: callers load the
 * full list, change it and save it back. Concurrent writers are not coordinated; the last
 * save wins.
 */
public interface RouteRegistryInterface {
    /**
     * Loads every stored route.
     * @return routes in stored order; empty when nothing has been saved yet
     * @throws IOException if the store exists but cannot be read
     */
    List<Route> loadRoutes() throws IOException;

    /**
     * Replaces the stored collection with {@code routes}.
     * @throws IOException if writing fails
     */
    void saveRoutes(List<Route> routes) throws IOException;
}
