package com.ratbv.scraper;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Interface for CSV export of scraped timetables.
 */
public interface CsvServiceInterface {
    /**
     * Writes a route's timetable to a CSV file named after the route id.
     * @param route route the times belong to
     * @param result timetable to export
     * @return path of the written file
     * @throws IOException if file writing fails
     */
    Path writeTimetableToCSV(Route route, TimetableResult result) throws IOException;
}
