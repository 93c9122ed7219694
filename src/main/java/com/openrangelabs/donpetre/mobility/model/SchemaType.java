package com.openrangelabs.donpetre.mobility.model;

import java.util.Locale;

/**
 * Vendor-defined column sets a job can be requested with
 */
public enum SchemaType {
    BASIC,
    FULL,
    TRIPS;

    public static SchemaType fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Schema type is required");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
