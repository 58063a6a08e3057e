package com.ratbv.scraper;

/**
 * A route could not be added because its id, or its line/direction/station triple, is
 * already registered. The registry is left unchanged.
 */
public class DuplicateRouteIdException extends RuntimeException {
    private final String routeId;

    public DuplicateRouteIdException(String routeId) {
        this(routeId, "Route id already exists: " + routeId);
    }

    public DuplicateRouteIdException(String routeId, String message) {
        super(message);
        this.routeId = routeId;
    }

    public String getRouteId() {
        return routeId;
    }
}
