package com.openrangelabs.blacklist.collector.service;

import com.openrangelabs.blacklist.collector.connector.CollectorSession;
import com.openrangelabs.blacklist.collector.connector.SourceCollector;
import com.openrangelabs.blacklist.collector.entity.CollectionHistory;
import com.openrangelabs.blacklist.collector.exception.CollectionException;
import com.openrangelabs.blacklist.collector.exception.SinkException;
import com.openrangelabs.blacklist.collector.model.CollectionResult;
import com.openrangelabs.blacklist.collector.model.DateWindow;
import com.openrangelabs.blacklist.collector.model.ErrorKind;
import com.openrangelabs.blacklist.collector.model.TriggerType;
import com.openrangelabs.blacklist.collector.model.UpsertResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Service executing one collection run for one source and window.
 *
 * <p>A run resolves a fresh credential, authenticates, skips batches that were
 * already ingested, fetches and parses the export and upserts the records. Every
 * outcome, including every failure, ends in exactly one finalized history record.
 */
@Service
public class CollectionRunService {

    private static final Logger logger = LoggerFactory.getLogger(CollectionRunService.class);

    private final CredentialProvider credentialProvider;
    private final DedupTracker dedupTracker;
    private final RecordSink recordSink;
    private final CollectionHistoryService historyService;
    private final Clock clock;

    @Autowired
    public CollectionRunService(CredentialProvider credentialProvider,
                                DedupTracker dedupTracker,
                                RecordSink recordSink,
                                CollectionHistoryService historyService,
                                Clock clock) {
        this.credentialProvider = credentialProvider;
        this.dedupTracker = dedupTracker;
        this.recordSink = recordSink;
        this.historyService = historyService;
        this.clock = clock;
    }

    /**
     * Execute a run. The returned Mono never errors.
     */
    public Mono<CollectionHistory> execute(SourceCollector collector, DateWindow window, TriggerType triggerType) {
        String sourceName = collector.getSourceName();
        String batchId = collector.batchIdentifier(window);
        logger.info("Starting {} collection run {}", triggerType, batchId);

        return historyService.start(sourceName, triggerType, window, batchId)
                .flatMap(history -> run(collector, window, batchId, history)
                        .onErrorResume(error -> Mono.fromCallable(() -> recordFailure(history, error)))
                        .flatMap(historyService::save))
                .doOnNext(this::logOutcome)
                .onErrorResume(error -> {
                    logger.error("Could not record collection run {}: {}", batchId, error.getMessage(), error);
                    CollectionHistory unsaved = new CollectionHistory(sourceName, triggerType, window, batchId);
                    unsaved.start(LocalDateTime.now(clock));
                    unsaved.fail(ErrorKind.SINK_ERROR, "History could not be written: " + error.getMessage(),
                            LocalDateTime.now(clock));
                    return Mono.just(unsaved);
                });
    }

    private Mono<CollectionHistory> run(SourceCollector collector, DateWindow window, String batchId,
                                        CollectionHistory history) {
        String sourceName = collector.getSourceName();
        return credentialProvider.resolveForRun(sourceName)
                .flatMap(collector::authenticate)
                .flatMap(session -> dedupTracker.isProcessed(sourceName, batchId)
                        .flatMap(processed -> {
                            if (processed) {
                                logger.info("Batch {} already processed, skipping fetch", batchId);
                                history.skipAlreadyProcessed(LocalDateTime.now(clock));
                                return Mono.just(history);
                            }
                            return fetchAndStore(collector, session, window, history);
                        }));
    }

    private Mono<CollectionHistory> fetchAndStore(SourceCollector collector, CollectorSession session,
                                                  DateWindow window, CollectionHistory history) {
        String sourceName = collector.getSourceName();
        return collector.fetch(session, window)
                .flatMap(result -> {
                    if (result.getRecords().isEmpty()) {
                        // Not marked processed: the portal may publish data for this window later.
                        history.succeed(0, UpsertResult.empty(), result.getDroppedCount(), LocalDateTime.now(clock));
                        return Mono.just(history);
                    }
                    return recordSink.upsertBatch(result.getRecords())
                            .flatMap(upserted -> dedupTracker
                                    .markProcessed(sourceName, result.getBatchIdentifier(), upserted.getPersisted())
                                    .then(Mono.fromCallable(() -> {
                                        history.succeed(result.size(), upserted, result.getDroppedCount(),
                                                LocalDateTime.now(clock));
                                        return history;
                                    }))
                                    .onErrorResume(error -> Mono.fromCallable(() -> recordStoreFailure(history, result,
                                            upserted, "Batch stored but not marked processed: " + error.getMessage()))))
                            .onErrorResume(SinkException.class, e -> Mono.fromCallable(
                                    () -> recordStoreFailure(history, result, e.getPartialResult(), e.getMessage())));
                });
    }

    /**
     * Records that reached storage make the run partial, otherwise it failed.
     */
    private CollectionHistory recordStoreFailure(CollectionHistory history, CollectionResult result,
                                                 UpsertResult achieved, String detail) {
        if (achieved.getPersisted() > 0) {
            history.partial(achieved, result.getDroppedCount(), ErrorKind.SINK_ERROR, detail,
                    LocalDateTime.now(clock));
        } else {
            history.fail(ErrorKind.SINK_ERROR, detail, LocalDateTime.now(clock));
        }
        return history;
    }

    private CollectionHistory recordFailure(CollectionHistory history, Throwable error) {
        if (error instanceof CollectionException collectionError) {
            history.fail(collectionError.getErrorKind(), error.getMessage(), LocalDateTime.now(clock));
        } else {
            logger.error("Unexpected error in collection run {}", history.getBatchIdentifier(), error);
            history.fail(ErrorKind.INTERNAL, error.getClass().getSimpleName() + ": " + error.getMessage(),
                    LocalDateTime.now(clock));
        }
        return history;
    }

    private void logOutcome(CollectionHistory history) {
        if (history.isSuccessful()) {
            logger.info("Collection run {} succeeded: fetched={}, new={}, duplicate={}, rejected={} in {} ms",
                    history.getBatchIdentifier(), history.getItemsFetched(), history.getItemsNew(),
                    history.getItemsDuplicate(), history.getItemsRejected(), history.getExecutionTimeMs());
        } else {
            logger.warn("Collection run {} ended {}: {} ({})",
                    history.getBatchIdentifier(), history.getOutcome(), history.getErrorKind(),
                    history.getErrorDetail());
        }
    }
}
