package com.ratbv.scraper;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;
import static org.junit.jupiter.api.Assertions.*;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.*;

/**
 * Tests for the JSON file route registry.
 */
public class JsonRouteRegistryTest {
    @TempDir
    Path tempDir;

    private static Route route(CacheSnapshot cache) {
        return new Route("23b-2-dus", "Linia 23B", "23b", Direction.OUTBOUND, "2", "Gara",
            "https://www.ratbv.ro/afisaje/23b-dus/line_23b_2_cl1_ro.html", "Sala Sporturilor", "Gara", cache);
    }

    @Test
    void testMissingFileReadsAsEmptyRegistry() throws IOException {
        JsonRouteRegistry registry = new JsonRouteRegistry(tempDir.resolve("routes.json"));
        List<Route> routes = registry.loadRoutes();
        assertTrue(routes.isEmpty());
        routes.add(route(null));
    }

    @Test
    void testSaveCreatesParentDirectoriesAndReloads() throws IOException {
        Path file = tempDir.resolve("scraped-data").resolve("routes.json");
        JsonRouteRegistry registry = new JsonRouteRegistry(file);
        CacheSnapshot snapshot = new CacheSnapshot(List.of("7:05", "7:20"), Instant.ofEpochMilli(1_709_280_000_000L));
        Route cached = route(snapshot);
        Route plain = new Route("home", "Linia 4", "4", Direction.INBOUND, "9", "Livada Postei",
            "https://www.ratbv.ro/afisaje/4-intors/line_4_9_cl1_ro.html", null, null, null);

        registry.saveRoutes(List.of(cached, plain));

        assertTrue(Files.exists(file));
        assertEquals(List.of(cached, plain), registry.loadRoutes());
    }

    @Test
    void testCacheStoredInlineAndOmittedWhenAbsent() throws IOException {
        Path file = tempDir.resolve("routes.json");
        new JsonRouteRegistry(file).saveRoutes(List.of(
            route(new CacheSnapshot(List.of("7:05"), Instant.ofEpochMilli(1000L))),
            route(null).withCache(null)));

        JsonNode json = new ObjectMapper().readTree(file.toFile());
        assertTrue(json.isArray());
        assertEquals("dus", json.get(0).get("direction").asText());
        assertEquals("7:05", json.get(0).get("cachedBusTimes").get(0).asText());
        assertEquals(1000L, json.get(0).get("cacheTimestamp").asLong());
        assertFalse(json.get(1).has("cachedBusTimes"));
        assertFalse(json.get(1).has("cacheTimestamp"));
    }

    @Test
    void testLegacyRecordWithoutIdentityFieldsLoads() throws IOException {
        Path file = tempDir.resolve("routes.json");
        Files.writeString(file, "[{\"id\":\"old\",\"name\":\"Linia 5\",\"stationName\":\"Roman\","
            + "\"url\":\"https://www.ratbv.ro/afisaje/5-dus/line_5_3_cl1_ro.html\",\"extra\":true}]",
            StandardCharsets.UTF_8);

        Route route = new JsonRouteRegistry(file).loadRoutes().get(0);

        assertEquals("old", route.id());
        assertEquals("Roman", route.stationName());
        assertNull(route.direction());
        assertTrue(route.cacheSnapshot().isEmpty());
    }

    @Test
    void testCorruptFileRaisesInsteadOfReadingEmpty() throws IOException {
        Path file = tempDir.resolve("routes.json");
        Files.writeString(file, "[{\"id\": ", StandardCharsets.UTF_8);

        assertThrows(IOException.class, () -> new JsonRouteRegistry(file).loadRoutes());
        assertEquals("[{\"id\": ", Files.readString(file, StandardCharsets.UTF_8));
    }

    @Test
    void testUnknownDirectionRaises() throws IOException {
        Path file = tempDir.resolve("routes.json");
        Files.writeString(file, "[{\"id\":\"x\",\"direction\":\"sideways\"}]", StandardCharsets.UTF_8);

        assertThrows(IOException.class, () -> new JsonRouteRegistry(file).loadRoutes());
    }
}
