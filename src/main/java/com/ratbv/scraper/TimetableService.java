package com.ratbv.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Composes the extractors, the identity resolver, the cache policy and the route registry.
 * <p>
 * Workflow for a timetable request:
 * <ul>
 *   <li>Fresh snapshot: returned as-is, no browser session is opened.</li>
 *   <li>Stale or absent snapshot: the station page is scraped once, the result is attached to
 *   the route and the whole registry is written back.</li>
 * </ul>
 * Concurrent requests are not coordinated. Two stale requests for the same route both scrape
 * and both write; the last write wins. Registry updates are read-modify-write of the full
 * collection with no locking.
 *
 * @author RATBV Scraper Team
 * @since 1.0
 */
public class TimetableService implements TimetableServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(TimetableService.class);

    private final RouteRegistryInterface registry;
    private final LineMetadataExtractor lineExtractor;
    private final TimetableExtractor timetableExtractor;
    private final StationNameExtractor stationNameExtractor;
    private final RouteIdentityResolver identityResolver;
    private final TimetableCache cache;

    public TimetableService(RouteRegistryInterface registry, BrowserDriver driver,
                            RouteIdentityResolver identityResolver, TimetableCache cache) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.lineExtractor = new LineMetadataExtractor(driver);
        this.timetableExtractor = new TimetableExtractor(driver);
        this.stationNameExtractor = new StationNameExtractor(driver);
        this.identityResolver = Objects.requireNonNull(identityResolver, "identityResolver");
        this.cache = Objects.requireNonNull(cache, "cache");
    }

    public TimetableService(ScraperConfig config) {
        this(new JsonRouteRegistry(config.routesFile()),
            new PlaywrightBrowserDriver(config),
            new RouteIdentityResolver(config.baseUrl()),
            new TimetableCache(Clock.systemUTC()));
    }

    // --- Topology ---
    @Override
    public LineTopology fetchLineTopology(String masterUrl) throws ScrapeFailureException {
        if (masterUrl == null || masterUrl.isBlank()) {
            throw new InvalidRequestException("Master URL is required");
        }
        String url = masterUrl.trim();
        Direction direction = identityResolver.direction(url)
            .orElseThrow(() -> new InvalidRequestException("Cannot determine direction from URL: " + url));
        return lineExtractor.extract(url, direction);
    }

    @Override
    public Map<Direction, LineTopology> fetchLineTopologies(String lineNumber) throws ScrapeFailureException {
        LineTopology outbound = fetchLineTopology(identityResolver.masterUrl(lineNumber, Direction.OUTBOUND));
        LineTopology inbound;
        try {
            inbound = fetchLineTopology(identityResolver.masterUrl(lineNumber, Direction.INBOUND));
        } catch (ScrapeFailureException e) {
            logger.warn("Inbound topology of line {} unavailable ({}); using reversed outbound stations",
                lineNumber, e.getMessage());
            inbound = outbound.reversedAs(Direction.INBOUND);
        }
        Map<Direction, LineTopology> topologies = new EnumMap<>(Direction.class);
        topologies.put(Direction.OUTBOUND, outbound);
        topologies.put(Direction.INBOUND, inbound);
        return topologies;
    }

    @Override
    public String fetchStationName(String stationUrl) throws ScrapeFailureException {
        requireText(stationUrl, "url");
        return stationNameExtractor.extract(stationUrl.trim());
    }

    // --- Timetables ---
    @Override
    public TimetableResult fetchTimetable(Route route) throws ScrapeFailureException {
        if (route == null) {
            throw new InvalidRequestException("Route is required");
        }
        if (cache.isFresh(route)) {
            TimetableResult cached = cache.cachedResult(route);
            logger.info("Serving {} bus times for {} from cache (age {} ms)", cached.times().size(), route.id(), cached.ageMillis());
            return cached;
        }
        if (route.url() == null || route.url().isBlank()) {
            throw new InvalidRequestException("Route " + route.id() + " has no timetable URL");
        }
        List<String> times = timetableExtractor.extract(route.url());
        writeBack(cache.store(route, times));
        return new TimetableResult(times, false, 0L);
    }

    @Override
    public TimetableResult fetchTimetable(String routeId) throws ScrapeFailureException {
        return fetchTimetable(findById(load(), routeId));
    }

    @Override
    public TimetableResult fetchTimetable(String lineNumber, Direction direction, String stationSlug) throws ScrapeFailureException {
        requireText(lineNumber, "lineNumber");
        requireText(stationSlug, "stationSlug");
        if (direction == null) throw new InvalidRequestException("Missing required field: direction");
        for (Route r : load()) {
            if (r.matches(lineNumber, direction, stationSlug)) return fetchTimetable(r);
        }
        throw new RouteNotFoundException("No route for line " + lineNumber + " (" + direction.code() + ") at station " + stationSlug);
    }

    @Override
    public void invalidateCache(String routeId) {
        List<Route> routes = load();
        int idx = indexOf(routes, routeId);
        if (idx < 0) throw new RouteNotFoundException("Route not found: " + routeId);
        routes.set(idx, routes.get(idx).withoutCache());
        save(routes);
        logger.info("Invalidated cached bus times for {}", routeId);
    }

    // --- Route management ---
    @Override
    public List<Route> listRoutes() {
        return load();
    }

    @Override
    public void addRoute(Route route) {
        validate(route);
        List<Route> routes = load();
        for (Route existing : routes) {
            if (Objects.equals(existing.id(), route.id())) {
                throw new DuplicateRouteIdException(route.id());
            }
            if (existing.matches(route.lineNumber(), route.direction(), route.stationSlug())) {
                throw new DuplicateRouteIdException(existing.id(),
                    "Route " + existing.id() + " already covers line " + route.lineNumber()
                        + " (" + route.direction().code() + ") at station " + route.stationSlug());
            }
        }
        routes.add(route);
        save(routes);
        logger.info("Added route {} ({} - {})", route.id(), route.name(), route.stationName());
    }

    @Override
    public Route addRouteFromTopology(String lineNumber, LineTopology topology, int stationIndex) {
        if (lineNumber == null || lineNumber.isBlank()) {
            throw new InvalidRequestException("Line number is required");
        }
        if (topology == null || stationIndex < 0 || stationIndex >= topology.stations().size()) {
            throw new InvalidRequestException("Station index " + stationIndex + " is out of range");
        }
        if (topology.reversedFallback()) {
            throw new InvalidRequestException("The " + topology.direction().code()
                + " stations of line " + lineNumber.trim() + " were approximated from the opposite direction"
                + " and cannot be registered");
        }
        Route route = identityResolver.fromTopology(lineNumber.trim(), topology, topology.stations().get(stationIndex));
        addRoute(route);
        return route;
    }

    @Override
    public Route addRouteFromLine(String masterUrl, int stationIndex) throws ScrapeFailureException {
        LineTopology topology = fetchLineTopology(masterUrl);
        String line = identityResolver.lineNumber(masterUrl.trim())
            .orElseThrow(() -> new InvalidRequestException("Cannot determine line number from URL: " + masterUrl));
        return addRouteFromTopology(line, topology, stationIndex);
    }

    @Override
    public Route addManualRoute(String id, String name, String stationName, String url) {
        Route route = identityResolver.manual(id, name, stationName, url);
        addRoute(route);
        return route;
    }

    @Override
    public void deleteRoute(String routeId) {
        List<Route> routes = load();
        if (!routes.removeIf(r -> Objects.equals(r.id(), routeId))) {
            throw new RouteNotFoundException("Route not found: " + routeId);
        }
        save(routes);
        logger.info("Deleted route {}", routeId);
    }

    // Reloads before writing so that routes added meanwhile are kept.
    private void writeBack(Route refreshed) {
        List<Route> routes = load();
        int idx = indexOf(routes, refreshed.id());
        if (idx < 0) {
            logger.warn("Route {} disappeared while its timetable was scraped; result not cached", refreshed.id());
            return;
        }
        routes.set(idx, refreshed);
        save(routes);
    }

    private static void validate(Route route) {
        if (route == null) throw new InvalidRequestException("Route is required");
        requireText(route.id(), "id");
        requireText(route.url(), "url");
        requireText(route.lineNumber(), "lineNumber");
        requireText(route.stationSlug(), "stationSlug");
        if (route.direction() == null) throw new InvalidRequestException("Missing required field: direction");
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new InvalidRequestException("Missing required field: " + field);
        }
    }

    private static Route findById(List<Route> routes, String routeId) {
        int idx = indexOf(routes, routeId);
        if (idx < 0) throw new RouteNotFoundException("Route not found: " + routeId);
        return routes.get(idx);
    }

    private static int indexOf(List<Route> routes, String routeId) {
        for (int i = 0; i < routes.size(); i++) {
            if (Objects.equals(routes.get(i).id(), routeId)) return i;
        }
        return -1;
    }

    private List<Route> load() {
        try {
            return registry.loadRoutes();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load routes: " + e.getMessage(), e);
        }
    }

    private void save(List<Route> routes) {
        try {
            registry.saveRoutes(routes);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save routes: " + e.getMessage(), e);
        }
    }
}
