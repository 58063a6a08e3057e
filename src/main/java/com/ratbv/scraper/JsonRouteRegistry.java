package com.ratbv.scraper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Route registry stored as a pretty-printed JSON array in a single file.
 * <p>
 * A missing file reads as an empty registry. A file that exists but does not parse is
 * reported as an {@link IOException} instead of being treated as empty, so that the next save
 * does not silently wipe it.
 *
 * @author RATBV Scraper Team
 * @since 1.0
 */
public class JsonRouteRegistry implements RouteRegistryInterface {
    private static final Logger logger = LoggerFactory.getLogger(JsonRouteRegistry.class);
    private static final TypeReference<List<StoredRoute>> ROUTE_LIST = new TypeReference<>() {};

    private final Path file;
    private final ObjectMapper mapper = new ObjectMapper();

    public JsonRouteRegistry(Path file) {
        this.file = file;
    }

    @Override
    public List<Route> loadRoutes() throws IOException {
        if (!Files.exists(file)) {
            logger.debug("Route registry {} does not exist yet; starting empty", file);
            return new ArrayList<>();
        }
        List<StoredRoute> stored;
        try {
            stored = mapper.readValue(file.toFile(), ROUTE_LIST);
        } catch (JsonProcessingException e) {
            logger.error("Route registry {} is not valid JSON: {}", file, e.getOriginalMessage());
            throw e;
        }
        List<Route> routes = new ArrayList<>();
        if (stored == null) return routes;
        for (StoredRoute s : stored) {
            try {
                routes.add(s.toRoute());
            } catch (InvalidRequestException e) {
                throw new IOException("Invalid route record '" + s.id() + "' in " + file + ": " + e.getMessage(), e);
            }
        }
        return routes;
    }

    @Override
    public void saveRoutes(List<Route> routes) throws IOException {
        if (routes == null) {
            throw new IllegalArgumentException("Route list cannot be null");
        }
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        List<StoredRoute> stored = new ArrayList<>(routes.size());
        for (Route r : routes) stored.add(StoredRoute.from(r));
        mapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), stored);
        logger.debug("Saved {} routes to {}", routes.size(), file);
    }
}
