package com.openrangelabs.donpetre.mobility.transfer;

import com.openrangelabs.donpetre.mobility.config.MobilitySyncProperties;
import com.openrangelabs.donpetre.mobility.model.Aoi;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Canonical key layout of the destination bucket:
 * {@code {root}/{country}/{state_or_province}/{city}/date={YYYY-MM-DD}/...}.
 * The state/province segment is left out when the AOI has none.
 */
@Component
public class DestinationLayout {

    private static final String DATE_SEGMENT = "date=";
    private static final String POI_SEGMENT = "poi_id=";

    private final String root;

    @Autowired
    public DestinationLayout(MobilitySyncProperties properties) {
        this(properties.getTransfer().getDestinationRoot());
    }

    public DestinationLayout(String root) {
        this.root = stripSlashes(root);
    }

    /**
     * Trimmed, lower-cased, spaces as underscores
     */
    public static String normalise(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT).replace(' ', '_');
    }

    /**
     * Prefix under which all partitions of an AOI live, with a trailing slash
     */
    public String aoiPrefix(Aoi aoi) {
        StringBuilder prefix = new StringBuilder(root).append('/').append(normalise(aoi.getCountry())).append('/');
        if (aoi.hasStateProvince()) {
            prefix.append(normalise(aoi.getStateProvince())).append('/');
        }
        return prefix.append(normalise(aoi.getCity())).append('/').toString();
    }

    public String destinationKey(Aoi aoi, LocalDate date, String rest) {
        return aoiPrefix(aoi) + DATE_SEGMENT + date + "/" + rest;
    }

    /**
     * Destination keys a vendor object is copied to. An object tagged with a
     * {@code poi_id=} segment belongs to that AOI only. An untagged object can only be
     * attributed when the chunk holds a single AOI; the rows of a multi-AOI job are not
     * split by city, so such an object has no destination.
     *
     * @return the keys, or empty if the object has no usable {@code date=} segment,
     *         names an AOI that is not in the chunk, or is untagged in a multi-AOI chunk
     */
    public List<String> route(String sourceKey, List<Aoi> aois) {
        Optional<LocalDate> date = dateOf(sourceKey);
        if (date.isEmpty()) {
            return List.of();
        }
        String rest = restAfterDate(sourceKey);
        Optional<String> poiId = poiIdOf(sourceKey);
        if (poiId.isPresent()) {
            return aois.stream()
                    .filter(aoi -> aoi.getPoiId().equals(poiId.get()))
                    .map(aoi -> destinationKey(aoi, date.get(), rest))
                    .toList();
        }
        if (aois.size() != 1) {
            return List.of();
        }
        return List.of(destinationKey(aois.get(0), date.get(), rest));
    }

    public static Optional<LocalDate> dateOf(String key) {
        return segmentValue(key, DATE_SEGMENT).flatMap(value -> {
            try {
                return Optional.of(LocalDate.parse(value.length() > 10 ? value.substring(0, 10) : value));
            } catch (DateTimeParseException e) {
                return Optional.empty();
            }
        });
    }

    public static Optional<String> poiIdOf(String key) {
        return segmentValue(key, POI_SEGMENT);
    }

    /**
     * Part of the key after its {@code date=} segment, with any {@code poi_id=}
     * segment removed since the destination path already names the AOI.
     */
    static String restAfterDate(String key) {
        String[] segments = key.split("/");
        StringBuilder rest = new StringBuilder();
        boolean afterDate = false;
        for (String segment : segments) {
            if (afterDate) {
                if (segment.isEmpty() || segment.startsWith(POI_SEGMENT)) {
                    continue;
                }
                if (rest.length() > 0) {
                    rest.append('/');
                }
                rest.append(segment);
            } else if (segment.startsWith(DATE_SEGMENT)) {
                afterDate = true;
            }
        }
        return rest.toString();
    }

    private static Optional<String> segmentValue(String key, String marker) {
        for (String segment : key.split("/")) {
            if (segment.startsWith(marker) && segment.length() > marker.length()) {
                return Optional.of(segment.substring(marker.length()));
            }
        }
        return Optional.empty();
    }

    private static String stripSlashes(String value) {
        String result = value == null ? "" : value.trim();
        while (result.startsWith("/")) {
            result = result.substring(1);
        }
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
