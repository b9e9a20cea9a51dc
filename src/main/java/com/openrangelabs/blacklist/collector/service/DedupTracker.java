package com.openrangelabs.blacklist.collector.service;

import com.openrangelabs.blacklist.collector.entity.ProcessedReport;
import com.openrangelabs.blacklist.collector.repository.ProcessedReportRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Service remembering which export batches were already ingested
 */
@Service
public class DedupTracker {

    private static final Logger logger = LoggerFactory.getLogger(DedupTracker.class);

    private final ProcessedReportRepository repository;
    private final Clock clock;

    @Autowired
    public DedupTracker(ProcessedReportRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * Whether the batch was fully ingested by an earlier run
     */
    public Mono<Boolean> isProcessed(String sourceName, String batchIdentifier) {
        return repository.existsBySourceAndReportId(sourceName, batchIdentifier)
                .defaultIfEmpty(false);
    }

    /**
     * Record a batch as ingested. Marking the same batch twice is a no-op.
     */
    public Mono<Void> markProcessed(String sourceName, String batchIdentifier, int recordCount) {
        ProcessedReport report = new ProcessedReport(sourceName, batchIdentifier, recordCount,
                LocalDateTime.now(clock));
        return repository.save(report)
                .doOnSuccess(saved -> logger.debug("Marked batch {} processed ({} records)",
                        batchIdentifier, recordCount))
                .then()
                .onErrorResume(DataIntegrityViolationException.class, e -> {
                    logger.debug("Batch {} was already marked processed", batchIdentifier);
                    return Mono.empty();
                });
    }
}
