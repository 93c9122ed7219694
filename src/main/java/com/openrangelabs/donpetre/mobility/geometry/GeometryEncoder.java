package com.openrangelabs.donpetre.mobility.geometry;

import com.openrangelabs.donpetre.mobility.exception.ConfigurationException;
import com.openrangelabs.donpetre.mobility.model.Aoi;
import com.openrangelabs.donpetre.mobility.model.Coordinate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Converts AOIs into the vendor's geo descriptors.
 *
 * <p>Radius AOIs become {@code geo_radius} entries, polygon AOIs become {@code geo_json}
 * entries. No I/O.
 */
@Component
public class GeometryEncoder {

    public EncodedGeometry encode(List<Aoi> aois) {
        List<RadiusDescriptor> radii = new ArrayList<>();
        List<PolygonDescriptor> polygons = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        for (Aoi aoi : aois) {
            if (!seen.add(aoi.getPoiId())) {
                throw new ConfigurationException("Duplicate poi_id in request: " + aoi.getPoiId());
            }
            if (aoi.getKind() == null) {
                throw new ConfigurationException("AOI " + aoi.getPoiId() + " has no geometry kind");
            }
            switch (aoi.getKind()) {
                case RADIUS -> radii.add(encodeRadius(aoi));
                case POLYGON -> polygons.add(encodePolygon(aoi));
            }
        }
        return new EncodedGeometry(radii, polygons);
    }

    public RadiusDescriptor encodeRadius(Aoi aoi) {
        if (aoi.getRadiusMeters() == null || aoi.getLatitude() == null || aoi.getLongitude() == null) {
            throw new ConfigurationException("Radius AOI " + aoi.getPoiId() + " is missing centre or radius");
        }
        return new RadiusDescriptor(aoi.getPoiId(), aoi.getLatitude(), aoi.getLongitude(), aoi.getRadiusMeters());
    }

    public PolygonDescriptor encodePolygon(Aoi aoi) {
        List<Coordinate> vertices = aoi.getPolygon();
        if (vertices == null || vertices.isEmpty()) {
            throw new ConfigurationException("Polygon AOI " + aoi.getPoiId() + " has an empty boundary");
        }
        List<List<Double>> ring = new ArrayList<>(vertices.size() + 1);
        for (Coordinate c : vertices) {
            ring.add(List.of(c.longitude(), c.latitude()));
        }
        // GeoJSON rings repeat the first vertex at the end
        if (!vertices.get(0).equals(vertices.get(vertices.size() - 1))) {
            ring.add(ring.get(0));
        }
        return new PolygonDescriptor(aoi.getPoiId(), PolygonDescriptor.Geometry.polygon(ring));
    }
}
