package com.openrangelabs.blacklist.collector.scheduler;

import com.openrangelabs.blacklist.collector.service.CollectionHistoryService;
import com.openrangelabs.blacklist.collector.service.CollectionOrchestrator;
import com.openrangelabs.blacklist.collector.service.RecordSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Scheduler for housekeeping tasks around collection
 */
@Component
public class MaintenanceScheduler {

    private static final Logger logger = LoggerFactory.getLogger(MaintenanceScheduler.class);

    private final CollectionOrchestrator orchestrator;
    private final CollectionHistoryService historyService;
    private final RecordSink recordSink;
    private final Clock clock;

    @Value("${collector.scheduling.enabled:true}")
    private boolean schedulingEnabled;

    @Value("${collector.history.cleanup.enabled:true}")
    private boolean cleanupEnabled;

    @Value("${collector.history.retention-days:90}")
    private int retentionDays;

    @Value("${collector.expiry.enabled:true}")
    private boolean expiryEnabled;

    @Autowired
    public MaintenanceScheduler(CollectionOrchestrator orchestrator,
                                CollectionHistoryService historyService,
                                RecordSink recordSink,
                                Clock clock) {
        this.orchestrator = orchestrator;
        this.historyService = historyService;
        this.recordSink = recordSink;
        this.clock = clock;
    }

    /**
     * Pick up source configuration changes
     */
    @Scheduled(fixedDelayString = "${collector.scheduling.config-refresh-interval-ms:60000}",
            initialDelayString = "${collector.scheduling.config-refresh-interval-ms:60000}")
    public void refreshSourceConfiguration() {
        if (!schedulingEnabled) {
            logger.debug("Scheduled collection is disabled, skipping configuration refresh");
            return;
        }

        orchestrator.refreshConfiguration()
                .subscribe(
                        unused -> { },
                        error -> logger.error("Error refreshing source configuration: {}", error.getMessage()));
    }

    /**
     * Clean up old collection history
     * Runs daily at 2 AM
     */
    @Scheduled(cron = "${collector.history.cleanup.cron:0 0 2 * * ?}")
    public void cleanupHistory() {
        if (!cleanupEnabled) {
            logger.debug("History cleanup is disabled");
            return;
        }

        logger.info("Starting cleanup of collection history older than {} days", retentionDays);

        historyService.cleanup(retentionDays)
                .subscribe(
                        deleted -> logger.debug("History cleanup removed {} records", deleted),
                        error -> logger.error("Error during history cleanup: {}", error.getMessage()));
    }

    /**
     * Deactivate blacklist entries past their removal date
     * Runs daily at 3 AM
     */
    @Scheduled(cron = "${collector.expiry.cron:0 0 3 * * ?}")
    public void deactivateExpiredEntries() {
        if (!expiryEnabled) {
            logger.debug("Expiry sweep is disabled");
            return;
        }

        LocalDate today = LocalDate.now(clock);
        logger.info("Deactivating blacklist entries removed before {}", today);

        recordSink.deactivateExpired(today)
                .subscribe(
                        count -> logger.debug("Expiry sweep deactivated {} entries", count),
                        error -> logger.error("Error during expiry sweep: {}", error.getMessage()));
    }
}
