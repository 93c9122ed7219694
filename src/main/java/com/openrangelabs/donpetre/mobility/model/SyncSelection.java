package com.openrangelabs.donpetre.mobility.model;

import java.util.Objects;

/**
 * An (endpoint, schema) pair requested for a run, before its destination bucket is resolved
 */
public record SyncSelection(String endpoint, SchemaType schemaType) {

    public SyncSelection {
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(schemaType, "schemaType");
    }

    public static SyncSelection of(String endpoint, SchemaType schemaType) {
        return new SyncSelection(endpoint, schemaType);
    }

    @Override
    public String toString() {
        return endpoint + "/" + schemaType;
    }
}
