package com.ratbv.scraper;

import com.opencsv.CSVWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Exports timetables to CSV files using OpenCSV, one row per arrival time.
 *
 * @author RATBV Scraper Team
 * @since 1.0
 */
public class CsvService implements CsvServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(CsvService.class);

    static final List<String> CSV_FIELDS = List.of("RouteId", "Line", "Direction", "Station", "Position", "Time");

    private final Path outDir;

    public CsvService(Path outDir) {
        this.outDir = outDir;
    }

    @Override
    public Path writeTimetableToCSV(Route route, TimetableResult result) throws IOException {
        if (route == null || result == null) {
            throw new IllegalArgumentException("Route and timetable cannot be null");
        }
        if (route.id() == null || route.id().isBlank()) {
            throw new IllegalArgumentException("Route id cannot be null or empty");
        }
        Files.createDirectories(outDir);
        Path file = outDir.resolve(Utils.sanitizeFilename(route.id()) + ".csv");
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             CSVWriter writer = new CSVWriter(out)) {
            writer.writeNext(CSV_FIELDS.toArray(String[]::new));
            int position = 1;
            for (String time : result.times()) {
                writer.writeNext(new String[]{
                    route.id(),
                    safe(route.lineNumber()),
                    route.direction() == null ? "" : route.direction().code(),
                    safe(route.stationName()),
                    Integer.toString(position++),
                    time
                });
            }
        }
        logger.info("Wrote {} bus times for {} to CSV file: {}", result.times().size(), route.id(), file);
        return file;
    }

    private static String safe(String s) {
        return s == null ? "" : s.replaceAll("[\\r\\n]+", " ").trim();
    }
}
