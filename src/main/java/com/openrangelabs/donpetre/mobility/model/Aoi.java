package com.openrangelabs.donpetre.mobility.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Area of interest read from the city registry snapshot.
 *
 * <p>Exactly one of {@code radiusMeters} and {@code polygon} is expected to be set,
 * matching {@code kind}. The registry does not enforce this; the partitioner rejects
 * malformed records before any vendor call is made.
 */
@Value
@Builder(toBuilder = true)
public class Aoi {

    String poiId;
    String country;
    String stateProvince;
    String city;
    Double latitude;
    Double longitude;
    GeometryKind kind;
    Double radiusMeters;
    List<Coordinate> polygon;

    public boolean hasStateProvince() {
        return stateProvince != null && !stateProvince.trim().isEmpty();
    }

    /**
     * Human readable label used in logs and reports
     */
    public String label() {
        return hasStateProvince()
                ? country + " / " + stateProvince + " / " + city
                : country + " / " + city;
    }
}
