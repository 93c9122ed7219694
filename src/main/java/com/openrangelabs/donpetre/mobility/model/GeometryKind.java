package com.openrangelabs.donpetre.mobility.model;

/**
 * How an area of interest is bounded
 */
public enum GeometryKind {
    RADIUS,
    POLYGON
}
