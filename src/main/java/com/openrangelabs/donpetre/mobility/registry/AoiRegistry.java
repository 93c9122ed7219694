package com.openrangelabs.donpetre.mobility.registry;

import com.openrangelabs.donpetre.mobility.model.Aoi;
import reactor.core.publisher.Flux;

/**
 * Read-only source of the areas of interest to synchronise
 */
public interface AoiRegistry {

    /**
     * Current AOI list. Each call reads a fresh snapshot; a run reads it once at start.
     */
    Flux<Aoi> snapshot();
}
