package com.openrangelabs.blacklist.collector.repository;

import com.openrangelabs.blacklist.collector.entity.SourceConfig;
import org.springframework.data.r2dbc.repository.R2dbcRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

/**
 * Repository for per-source scheduling configuration
 */
@Repository
public interface SourceConfigRepository extends R2dbcRepository<SourceConfig, Long> {

    Mono<SourceConfig> findBySourceName(String sourceName);
}
