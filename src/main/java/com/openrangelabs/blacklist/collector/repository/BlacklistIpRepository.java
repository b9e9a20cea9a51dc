package com.openrangelabs.blacklist.collector.repository;

import com.openrangelabs.blacklist.collector.entity.BlacklistIp;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.r2dbc.repository.R2dbcRepository;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.LocalDate;

/**
 * Repository for stored blacklist entries
 */
@Repository
public interface BlacklistIpRepository extends R2dbcRepository<BlacklistIp, Long> {

    /**
     * Find entry by natural key
     */
    Mono<BlacklistIp> findByIpAddressAndSource(String ipAddress, String source);

    /**
     * Deactivate entries whose removal date has passed
     */
    @Modifying
    @Query("""
        UPDATE blacklist_ips
        SET is_active = false, updated_at = CURRENT_TIMESTAMP
        WHERE is_active = true
        AND removal_date IS NOT NULL
        AND removal_date < :today
        """)
    Mono<Integer> deactivateExpired(@Param("today") LocalDate today);
}
