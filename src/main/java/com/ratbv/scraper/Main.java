package com.ratbv.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.LocalTime;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Command-line front end for the RATBV bus scraper.
 * Lists and manages the registered routes, shows their timetables through the cache and
 * scrapes line topologies for picking new stations.
 *
 * @author RATBV Scraper Team
 * @since 1.0
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final String USAGE = String.join("\n",
        "Usage: <command> [arguments]",
        "  routes                                   list registered routes",
        "  topology <line|masterUrl>                show the stations of a line",
        "  add <masterUrl> <stationNumber>          register a station from a line page",
        "  add-manual <id> <name> [stationName] <url>  station name is scraped when omitted",
        "  delete <routeId>                         remove a route",
        "  times <routeId>                          show bus times (cached for 5 minutes)",
        "  invalidate <routeId>                     drop the cached bus times of a route",
        "  export <routeId>                         write bus times to CSV");

    /**
     * Main application entry point.
     * @param args Command-line arguments
     */
    public static void main(String[] args) {
        String[] effective = args;
        if (effective == null || effective.length == 0) {
            System.out.println(USAGE);
            System.out.print("Enter command (or press Enter for 'routes'): ");
            try {
                BufferedReader br = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
                String input = br.readLine();
                effective = input == null || input.isBlank() ? new String[]{"routes"} : input.trim().split("\\s+");
            } catch (IOException e) {
                logger.warn("Failed to read command from stdin: {}", e.getMessage());
                effective = new String[]{"routes"};
            }
        }
        ScraperConfig config = ScraperConfig.fromEnvironment();
        int status = run(effective, new TimetableService(config), new CsvService(config.exportDir()), System.out);
        if (status != 0) System.exit(status);
    }

    /**
     * Executes one command.
     * @return process exit status: 0 on success, 1 when data is unavailable, 2 on bad input
     */
    static int run(String[] args, TimetableServiceInterface service, CsvServiceInterface csvService, PrintStream out) {
        if (args.length == 0) {
            out.println(USAGE);
            return 2;
        }
        String command = args[0].trim().toLowerCase(Locale.ROOT);
        String[] rest = Arrays.copyOfRange(args, 1, args.length);
        try {
            switch (command) {
                case "routes":
                    printRoutes(service.listRoutes(), out);
                    return 0;
                case "topology":
                    requireArgs(rest, 1, "topology <line|masterUrl>");
                    printTopology(service, rest[0], out);
                    return 0;
                case "add": {
                    requireArgs(rest, 2, "add <masterUrl> <stationNumber>");
                    Route route = service.addRouteFromLine(rest[0], parseStationNumber(rest[1]) - 1);
                    out.println("Added route " + route.id() + " (" + route.stationName() + ")");
                    return 0;
                }
                case "add-manual": {
                    requireArgs(rest, 3, "add-manual <id> <name> [stationName] <url>");
                    String url = rest.length >= 4 ? rest[3] : rest[2];
                    String stationName = rest.length >= 4 ? rest[2] : service.fetchStationName(url);
                    Route route = service.addManualRoute(rest[0], rest[1], stationName, url);
                    out.println("Added route " + route.id() + " (" + route.stationName() + ")");
                    return 0;
                }
                case "delete":
                    requireArgs(rest, 1, "delete <routeId>");
                    service.deleteRoute(rest[0]);
                    out.println("Deleted route " + rest[0]);
                    return 0;
                case "times": {
                    requireArgs(rest, 1, "times <routeId>");
                    Route route = findRoute(service, rest[0]);
                    TimetableResult result = service.fetchTimetable(route);
                    out.print(DepartureBoard.render(route, result, LocalTime.now(DepartureBoard.TRANSIT_ZONE)));
                    return 0;
                }
                case "invalidate":
                    requireArgs(rest, 1, "invalidate <routeId>");
                    service.invalidateCache(rest[0]);
                    out.println("Cache cleared for " + rest[0]);
                    return 0;
                case "export": {
                    requireArgs(rest, 1, "export <routeId>");
                    Route route = findRoute(service, rest[0]);
                    Path file = csvService.writeTimetableToCSV(route, service.fetchTimetable(route));
                    out.println("Wrote " + file);
                    return 0;
                }
                default:
                    out.println("Unknown command: " + command);
                    out.println(USAGE);
                    return 2;
            }
        } catch (ScrapeFailureException e) {
            logger.error("Scrape failed for command '{}': {}", command, e.getMessage());
            out.println("Data unavailable: " + e.getMessage());
            return 1;
        } catch (RouteNotFoundException | DuplicateRouteIdException | InvalidRequestException e) {
            out.println(e.getMessage());
            return 2;
        } catch (IOException | UncheckedIOException e) {
            logger.error("I/O failure for command '{}': {}", command, e.getMessage());
            out.println("Data unavailable: " + e.getMessage());
            return 1;
        }
    }

    private static void printRoutes(List<Route> routes, PrintStream out) {
        if (routes.isEmpty()) {
            out.println("No routes configured yet. Use 'add' or 'add-manual' to register one.");
            return;
        }
        for (Route r : routes) {
            String cached = r.cacheSnapshot().map(s -> ", cached " + s.times().size() + " times").orElse("");
            out.println(r.id() + "  " + r.name() + " - " + r.stationName() + cached);
        }
    }

    private static void printTopology(TimetableServiceInterface service, String lineOrUrl, PrintStream out) throws ScrapeFailureException {
        if (lineOrUrl.contains("/")) {
            printTopology(service.fetchLineTopology(lineOrUrl), out);
            return;
        }
        Map<Direction, LineTopology> both = service.fetchLineTopologies(lineOrUrl);
        for (LineTopology topology : both.values()) {
            printTopology(topology, out);
        }
    }

    private static void printTopology(LineTopology topology, PrintStream out) {
        out.println(topology.lineName() + " (" + topology.direction().code() + ")"
            + (topology.reversedFallback() ? " [approximated from the opposite direction]" : ""));
        List<Station> stations = topology.stations();
        for (int i = 0; i < stations.size(); i++) {
            Station s = stations.get(i);
            out.printf("  %2d. %-30s %s%n", i + 1, s.name(), s.url());
        }
    }

    private static Route findRoute(TimetableServiceInterface service, String routeId) {
        for (Route r : service.listRoutes()) {
            if (routeId.equals(r.id())) return r;
        }
        throw new RouteNotFoundException("Route not found: " + routeId);
    }

    private static int parseStationNumber(String raw) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new InvalidRequestException("Station number must be an integer: " + raw);
        }
    }

    private static void requireArgs(String[] rest, int count, String usage) {
        if (rest.length < count) throw new InvalidRequestException("Usage: " + usage);
    }
}
