package com.ratbv.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives route identities from the URLs and text scraped off the transit site.
 * <p>
 * Master URLs look like {@code .../afisaje/23b-dus.html} and station links like
 * {@code .../afisaje/23b-dus/line_23b_12_cl1_ro.html}. The line token is the segment in front
 * of the {@code -dus}/{@code -intors} suffix; the station slug is the token after the line in
 * the {@code line_} filename, or the name slug when the link does not follow that pattern.
 * <p>
 * Route ids built here are persisted and used as external keys. Changing the derivation
 * orphans every route saved under the old scheme; there is no migration.
 *
 * @author RATBV Scraper Team
 * @since 1.0
 */
public class RouteIdentityResolver {
    private static final Logger logger = LoggerFactory.getLogger(RouteIdentityResolver.class);

    private static final Pattern LINE_DIRECTION = Pattern.compile(
        "/([0-9a-z]+)-(dus|intors)(?:\\.html?|/|$)", Pattern.CASE_INSENSITIVE);
    private static final Pattern STATION_FILE = Pattern.compile(
        "/line_[0-9a-z]+_([0-9a-z]+)_[^/]*$", Pattern.CASE_INSENSITIVE);

    private final String baseUrl;

    public RouteIdentityResolver(String baseUrl) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
    }

    /**
     * Master page of one direction of a line, e.g. {@code https://www.ratbv.ro/afisaje/23b-dus.html}.
     */
    public String masterUrl(String lineNumber, Direction direction) {
        if (lineNumber == null || lineNumber.isBlank()) {
            throw new InvalidRequestException("Line number is required");
        }
        return baseUrl + lineNumber.trim().toLowerCase(Locale.ROOT) + "-" + direction.code() + ".html";
    }

    public Optional<String> lineNumber(String url) {
        Matcher m = matchLineDirection(url);
        return m == null ? Optional.empty() : Optional.of(m.group(1).toLowerCase(Locale.ROOT));
    }

    public Optional<Direction> direction(String url) {
        Matcher m = matchLineDirection(url);
        return m == null ? Optional.empty() : Optional.of(Direction.fromCode(m.group(2)));
    }

    /**
     * Slug parsed from the station link's filename, falling back to the slug derived from the
     * station name.
     */
    public String stationSlug(Station station) {
        if (station.url() != null) {
            Matcher m = STATION_FILE.matcher(stripQuery(station.url()));
            if (m.find()) return m.group(1).toLowerCase(Locale.ROOT);
        }
        logger.debug("Station link '{}' has no slug token; using name slug '{}'", station.url(), station.slug());
        return station.slug();
    }

    public static String routeId(String lineNumber, String stationSlug, Direction direction) {
        return lineNumber + "-" + stationSlug + "-" + direction.code();
    }

    /**
     * Builds a new route for a station picked from a scraped topology.
     * @param lineNumber line token, e.g. {@code 23b}
     */
    public Route fromTopology(String lineNumber, LineTopology topology, Station station) {
        String line = lineNumber.toLowerCase(Locale.ROOT);
        String slug = stationSlug(station);
        return new Route(
            routeId(line, slug, topology.direction()),
            topology.lineName(),
            line,
            topology.direction(),
            slug,
            station.name(),
            station.url(),
            topology.firstStationName(),
            topology.lastStationName(),
            null
        );
    }

    /**
     * Builds a route from operator input. The identity triple is parsed from the station URL;
     * the slug falls back to the station name when the URL carries no token.
     * @throws InvalidRequestException if a field is blank or the URL names no line/direction
     */
    public Route manual(String id, String name, String stationName, String url) {
        requireText(id, "id");
        requireText(name, "name");
        requireText(stationName, "stationName");
        requireText(url, "url");
        String line = lineNumber(url).orElseThrow(
            () -> new InvalidRequestException("Cannot determine line and direction from URL: " + url));
        Direction direction = direction(url).orElseThrow();
        String slug = stationSlug(new Station(Utils.slugify(stationName), stationName.trim(), url.trim()));
        return new Route(id.trim(), name.trim(), line, direction, slug, stationName.trim(), url.trim(), null, null, null);
    }

    private static Matcher matchLineDirection(String url) {
        if (url == null) return null;
        Matcher m = LINE_DIRECTION.matcher(stripQuery(url));
        return m.find() ? m : null;
    }

    private static String stripQuery(String url) {
        int q = url.indexOf('?');
        return q >= 0 ? url.substring(0, q) : url;
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new InvalidRequestException("Missing required field: " + field);
        }
    }
}
