package com.openrangelabs.donpetre.mobility.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * One unit of work: an AOI batch, a date window and one (endpoint, schema) selection,
 * submitted to the vendor as a single job.
 */
public record Chunk(ChunkKey key, List<Aoi> aois, DateWindow window, SyncSpec spec) {

    public Chunk {
        aois = List.copyOf(aois);
    }

    public int size() {
        return aois.size();
    }

    /**
     * SHA-256 over the batch's poi_ids in order. Chunk keys are positional, so this is
     * what tells whether a key still covers the same AOIs after the registry changed.
     */
    public String aoiFingerprint() {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            for (Aoi aoi : aois) {
                digest.update(aoi.getPoiId().getBytes(StandardCharsets.UTF_8));
                digest.update((byte) '\n');
            }
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    @Override
    public String toString() {
        return "Chunk{" + key.asString() + ", aois=" + aois.size() + ", window=" + window + '}';
    }
}
