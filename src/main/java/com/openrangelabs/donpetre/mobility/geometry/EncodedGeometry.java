package com.openrangelabs.donpetre.mobility.geometry;

import java.util.List;

/**
 * Geo descriptors for one vendor request, split the way the request body splits them
 */
public record EncodedGeometry(List<RadiusDescriptor> radii, List<PolygonDescriptor> polygons) {

    public EncodedGeometry {
        radii = List.copyOf(radii);
        polygons = List.copyOf(polygons);
    }

    public int size() {
        return radii.size() + polygons.size();
    }
}
