package com.openrangelabs.donpetre.mobility.geometry;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Polygon AOI as the vendor expects it in {@code geo_json}
 */
public record PolygonDescriptor(
        @JsonProperty("poi_id") String poiId,
        @JsonProperty("geo_json") Geometry geoJson) {

    /**
     * GeoJSON Polygon geometry with a single outer ring of [lon, lat] pairs
     */
    public record Geometry(
            @JsonProperty("type") String type,
            @JsonProperty("coordinates") List<List<List<Double>>> coordinates) {

        public static Geometry polygon(List<List<Double>> ring) {
            return new Geometry("Polygon", List.of(ring));
        }
    }
}
