package com.openrangelabs.blacklist.collector.repository;

import com.openrangelabs.blacklist.collector.entity.ProcessedReport;
import org.springframework.data.r2dbc.repository.R2dbcRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

/**
 * Repository for processed export markers
 */
@Repository
public interface ProcessedReportRepository extends R2dbcRepository<ProcessedReport, Long> {

    Mono<Boolean> existsBySourceAndReportId(String source, String reportId);

    Mono<ProcessedReport> findBySourceAndReportId(String source, String reportId);
}
