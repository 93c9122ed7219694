package com.openrangelabs.donpetre.mobility.report;

import com.openrangelabs.donpetre.mobility.model.DateWindow;

import java.time.LocalDate;
import java.util.List;

/**
 * Which dates of a range are missing from the destination bucket, per AOI location
 */
public record CoverageReport(String bucket, String endpoint, String schemaType, DateWindow dateRange,
                             List<LocationCoverage> locations) {

    public long incompleteLocations() {
        return locations.stream().filter(location -> !location.isComplete()).count();
    }

    public record LocationCoverage(String label, String prefix, int presentDays,
                                   List<LocalDate> missingDates, List<DateWindow> missingRanges) {

        public boolean isComplete() {
            return missingDates.isEmpty();
        }
    }
}
