package com.openrangelabs.donpetre.mobility.partition;

import com.openrangelabs.donpetre.mobility.config.MobilitySyncProperties;
import com.openrangelabs.donpetre.mobility.exception.ConfigurationException;
import com.openrangelabs.donpetre.mobility.model.Aoi;
import com.openrangelabs.donpetre.mobility.model.Chunk;
import com.openrangelabs.donpetre.mobility.model.ChunkKey;
import com.openrangelabs.donpetre.mobility.model.Coordinate;
import com.openrangelabs.donpetre.mobility.model.DateWindow;
import com.openrangelabs.donpetre.mobility.model.SyncSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Splits an AOI list and a date range into chunks the vendor will accept.
 *
 * <p>For N AOIs, D days and P selections the result holds ceil(N/batch) x ceil(D/window) x P
 * chunks. AOIs are ordered by {@code poi_id} before batching so the same snapshot always
 * yields the same chunk keys.
 */
@Component
public class RequestPartitioner {

    private static final Logger logger = LoggerFactory.getLogger(RequestPartitioner.class);

    private final int maxAoisPerChunk;
    private final int maxDaysPerChunk;

    @Autowired
    public RequestPartitioner(MobilitySyncProperties properties) {
        this(properties.getVendor().getMaxAoisPerRequest(), properties.getVendor().getMaxDaysPerRequest());
    }

    public RequestPartitioner(int maxAoisPerChunk, int maxDaysPerChunk) {
        this.maxAoisPerChunk = Math.min(maxAoisPerChunk, MobilitySyncProperties.VENDOR_MAX_AOIS_PER_REQUEST);
        this.maxDaysPerChunk = Math.min(maxDaysPerChunk, MobilitySyncProperties.VENDOR_MAX_DAYS_PER_REQUEST);
    }

    public List<Chunk> partition(List<Aoi> aois, DateWindow range, List<SyncSpec> specs) {
        if (aois == null || aois.isEmpty()) {
            throw new ConfigurationException("No AOIs to synchronise");
        }
        if (range == null) {
            throw new ConfigurationException("Date range is required");
        }
        if (specs == null || specs.isEmpty()) {
            throw new ConfigurationException("At least one endpoint/schema selection is required");
        }
        validate(aois);

        List<List<Aoi>> batches = batches(aois);
        List<DateWindow> windows = windows(range);

        List<Chunk> chunks = new ArrayList<>(batches.size() * windows.size() * specs.size());
        for (SyncSpec spec : specs) {
            for (int b = 0; b < batches.size(); b++) {
                for (int w = 0; w < windows.size(); w++) {
                    chunks.add(new Chunk(ChunkKey.of(b, w, spec), batches.get(b), windows.get(w), spec));
                }
            }
        }

        logger.info("Partitioned {} AOIs over {} ({} days) into {} batches x {} windows x {} selections = {} chunks",
                aois.size(), range, range.days(), batches.size(), windows.size(), specs.size(), chunks.size());
        return chunks;
    }

    /**
     * AOI batches of at most {@code maxAoisPerChunk}, ordered by poi_id
     */
    public List<List<Aoi>> batches(List<Aoi> aois) {
        List<Aoi> ordered = new ArrayList<>(aois);
        ordered.sort(Comparator.comparing(Aoi::getPoiId));

        List<List<Aoi>> batches = new ArrayList<>();
        for (int i = 0; i < ordered.size(); i += maxAoisPerChunk) {
            batches.add(List.copyOf(ordered.subList(i, Math.min(i + maxAoisPerChunk, ordered.size()))));
        }
        return batches;
    }

    /**
     * Contiguous, non-overlapping windows of at most {@code maxDaysPerChunk} days tiling the range
     */
    public List<DateWindow> windows(DateWindow range) {
        List<DateWindow> windows = new ArrayList<>();
        LocalDate start = range.from();
        while (!start.isAfter(range.to())) {
            LocalDate end = start.plusDays(maxDaysPerChunk - 1L);
            if (end.isAfter(range.to())) {
                end = range.to();
            }
            windows.add(DateWindow.of(start, end));
            start = end.plusDays(1);
        }
        return windows;
    }

    private void validate(List<Aoi> aois) {
        Set<String> poiIds = new HashSet<>();
        for (Aoi aoi : aois) {
            if (aoi == null) {
                throw new ConfigurationException("AOI list contains an empty entry");
            }
            String poiId = aoi.getPoiId();
            if (poiId == null || poiId.isBlank()) {
                throw new ConfigurationException("AOI for " + aoi.getCity() + " has no poi_id");
            }
            if (!poiIds.add(poiId)) {
                throw new ConfigurationException("Duplicate poi_id: " + poiId);
            }
            if (isBlank(aoi.getCountry()) || isBlank(aoi.getCity())) {
                throw new ConfigurationException("AOI " + poiId + " is missing country or city");
            }
            if (aoi.getKind() == null) {
                throw new ConfigurationException("AOI " + poiId + " has no geometry kind");
            }
            switch (aoi.getKind()) {
                case RADIUS -> validateRadius(aoi);
                case POLYGON -> validatePolygon(aoi);
            }
        }
    }

    private void validateRadius(Aoi aoi) {
        if (aoi.getLatitude() == null || aoi.getLongitude() == null) {
            throw new ConfigurationException("AOI " + aoi.getPoiId() + " is missing coordinates");
        }
        if (Math.abs(aoi.getLatitude()) > 90 || Math.abs(aoi.getLongitude()) > 180) {
            throw new ConfigurationException("AOI " + aoi.getPoiId() + " has coordinates out of range");
        }
        if (aoi.getRadiusMeters() == null || aoi.getRadiusMeters() <= 0) {
            throw new ConfigurationException("AOI " + aoi.getPoiId() + " needs a positive radius");
        }
        if (aoi.getPolygon() != null && !aoi.getPolygon().isEmpty()) {
            throw new ConfigurationException("AOI " + aoi.getPoiId() + " sets both radius and polygon");
        }
    }

    private void validatePolygon(Aoi aoi) {
        List<Coordinate> ring = aoi.getPolygon();
        if (ring == null || ring.isEmpty()) {
            throw new ConfigurationException("AOI " + aoi.getPoiId() + " has an empty polygon ring");
        }
        if (new HashSet<>(ring).size() < 3) {
            throw new ConfigurationException("AOI " + aoi.getPoiId() + " polygon needs at least 3 distinct vertices");
        }
        if (aoi.getRadiusMeters() != null) {
            throw new ConfigurationException("AOI " + aoi.getPoiId() + " sets both radius and polygon");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
