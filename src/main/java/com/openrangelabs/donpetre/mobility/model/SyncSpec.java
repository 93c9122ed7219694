package com.openrangelabs.donpetre.mobility.model;

import java.util.Objects;

/**
 * One (endpoint, schema) selection for a run together with the bucket its data lands in.
 * The date range is carried by the run and by each chunk's window.
 */
public record SyncSpec(String endpoint, SchemaType schemaType, String destinationBucket) {

    public SyncSpec {
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(schemaType, "schemaType");
    }

    /**
     * Endpoint flattened into a form usable inside chunk keys
     */
    public String endpointSlug() {
        return slugOf(endpoint);
    }

    public static String slugOf(String endpoint) {
        return endpoint.replaceAll("[^A-Za-z0-9]+", "-").replaceAll("(^-|-$)", "").toLowerCase();
    }

    public String pairLabel() {
        return endpoint + "/" + schemaType;
    }
}
