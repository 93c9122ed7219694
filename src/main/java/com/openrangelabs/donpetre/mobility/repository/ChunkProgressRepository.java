package com.openrangelabs.donpetre.mobility.repository;

import com.openrangelabs.donpetre.mobility.entity.ChunkProgress;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.r2dbc.repository.R2dbcRepository;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

/**
 * Repository for chunk progress rows
 */
@Repository
public interface ChunkProgressRepository extends R2dbcRepository<ChunkProgress, String> {

    /**
     * Find all chunks of a run
     */
    Flux<ChunkProgress> findByRunIdOrderByChunkKey(String runId);

    /**
     * Remove finished chunk rows last touched before the threshold
     */
    @Modifying
    @Query("""
        DELETE FROM chunk_progress
        WHERE outcome IN ('SUCCEEDED', 'FAILED')
        AND updated_at < :threshold
        """)
    Mono<Integer> deleteFinishedBefore(@Param("threshold") LocalDateTime threshold);
}
