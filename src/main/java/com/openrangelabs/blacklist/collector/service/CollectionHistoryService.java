package com.openrangelabs.blacklist.collector.service;

import com.openrangelabs.blacklist.collector.entity.CollectionHistory;
import com.openrangelabs.blacklist.collector.model.DateWindow;
import com.openrangelabs.blacklist.collector.model.TriggerType;
import com.openrangelabs.blacklist.collector.repository.CollectionHistoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Service for managing collection history records
 */
@Service
public class CollectionHistoryService {

    private static final Logger logger = LoggerFactory.getLogger(CollectionHistoryService.class);

    private final CollectionHistoryRepository repository;
    private final Clock clock;

    @Autowired
    public CollectionHistoryService(CollectionHistoryRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * Create the history record of a run that is starting now
     */
    public Mono<CollectionHistory> start(String sourceName, TriggerType triggerType, DateWindow window,
                                         String batchIdentifier) {
        CollectionHistory history = new CollectionHistory(sourceName, triggerType, window, batchIdentifier);
        history.start(LocalDateTime.now(clock));
        return repository.save(history)
                .doOnSuccess(saved -> logger.debug("Created collection history {} for {}",
                        saved.getId(), batchIdentifier));
    }

    /**
     * Save history state
     */
    public Mono<CollectionHistory> save(CollectionHistory history) {
        return repository.save(history);
    }

    /**
     * Most recent runs of a source, newest first
     */
    public Flux<CollectionHistory> recent(String sourceName, int limit) {
        return repository.findRecentByServiceName(sourceName, limit);
    }

    /**
     * Latest finalized run of a source
     */
    public Mono<CollectionHistory> latestFinished(String sourceName) {
        return repository.findLatestFinishedByServiceName(sourceName);
    }

    /**
     * Delete finalized runs older than the retention period
     */
    public Mono<Integer> cleanup(int retentionDays) {
        LocalDateTime threshold = LocalDateTime.now(clock).minusDays(retentionDays);
        return repository.deleteFinishedBefore(threshold)
                .doOnSuccess(count -> logger.info("Cleaned up {} collection history records older than {} days",
                        count, retentionDays));
    }
}
