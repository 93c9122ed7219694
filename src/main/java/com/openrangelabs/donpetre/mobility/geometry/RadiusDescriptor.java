package com.openrangelabs.donpetre.mobility.geometry;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Circular AOI as the vendor expects it in {@code geo_radius}
 */
public record RadiusDescriptor(
        @JsonProperty("poi_id") String poiId,
        @JsonProperty("latitude") double latitude,
        @JsonProperty("longitude") double longitude,
        @JsonProperty("distance_in_meters") double distanceInMeters) {
}
