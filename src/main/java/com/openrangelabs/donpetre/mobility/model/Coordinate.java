package com.openrangelabs.donpetre.mobility.model;

/**
 * A single polygon vertex, in GeoJSON axis order (longitude first)
 */
public record Coordinate(double longitude, double latitude) {

    public static Coordinate of(double longitude, double latitude) {
        return new Coordinate(longitude, latitude);
    }
}
