package com.openrangelabs.donpetre.mobility.model;

/**
 * Deterministic identity of a chunk within a run. The same AOI snapshot, date range and
 * selections always produce the same keys, which is what lets a re-run address work that
 * already succeeded.
 */
public record ChunkKey(int batchIndex, int windowIndex, String endpoint, SchemaType schemaType) {

    public static ChunkKey of(int batchIndex, int windowIndex, SyncSpec spec) {
        return new ChunkKey(batchIndex, windowIndex, spec.endpointSlug(), spec.schemaType());
    }

    public String asString() {
        return String.format("%s:%s:b%03d:w%03d", endpoint, schemaType, batchIndex, windowIndex);
    }

    @Override
    public String toString() {
        return asString();
    }
}
