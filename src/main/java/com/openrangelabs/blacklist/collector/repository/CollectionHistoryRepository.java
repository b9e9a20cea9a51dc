package com.openrangelabs.blacklist.collector.repository;

import com.openrangelabs.blacklist.collector.entity.CollectionHistory;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.r2dbc.repository.R2dbcRepository;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

/**
 * Repository for collection run history
 */
@Repository
public interface CollectionHistoryRepository extends R2dbcRepository<CollectionHistory, Long> {

    /**
     * Most recent runs of a source
     */
    @Query("""
        SELECT * FROM collection_history
        WHERE service_name = :serviceName
        ORDER BY started_at DESC, id DESC
        LIMIT :limit
        """)
    Flux<CollectionHistory> findRecentByServiceName(
            @Param("serviceName") String serviceName,
            @Param("limit") int limit);

    /**
     * Latest finalized run of a source
     */
    @Query("""
        SELECT * FROM collection_history
        WHERE service_name = :serviceName
        AND finished_at IS NOT NULL
        ORDER BY finished_at DESC, id DESC
        LIMIT 1
        """)
    Mono<CollectionHistory> findLatestFinishedByServiceName(@Param("serviceName") String serviceName);

    /**
     * Count runs of a source by outcome
     */
    @Query("SELECT COUNT(*) FROM collection_history WHERE service_name = :serviceName AND outcome = :outcome")
    Mono<Long> countByServiceNameAndOutcome(
            @Param("serviceName") String serviceName,
            @Param("outcome") String outcome);

    /**
     * Clean up old finalized runs
     */
    @Modifying
    @Query("""
        DELETE FROM collection_history
        WHERE finished_at IS NOT NULL
        AND finished_at < :threshold
        """)
    Mono<Integer> deleteFinishedBefore(@Param("threshold") LocalDateTime threshold);
}
