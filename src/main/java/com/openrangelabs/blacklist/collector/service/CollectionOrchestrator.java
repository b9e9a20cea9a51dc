package com.openrangelabs.blacklist.collector.service;

import com.openrangelabs.blacklist.collector.config.CollectorProperties;
import com.openrangelabs.blacklist.collector.connector.SourceCollector;
import com.openrangelabs.blacklist.collector.entity.CollectionHistory;
import com.openrangelabs.blacklist.collector.exception.UnknownSourceException;
import com.openrangelabs.blacklist.collector.model.DateWindow;
import com.openrangelabs.blacklist.collector.model.SchedulePhase;
import com.openrangelabs.blacklist.collector.model.SourceSettings;
import com.openrangelabs.blacklist.collector.model.SourceStatus;
import com.openrangelabs.blacklist.collector.model.TriggerResult;
import com.openrangelabs.blacklist.collector.ratelimit.SourceRateLimiter;
import com.openrangelabs.blacklist.collector.scheduler.BackoffPolicy;
import com.openrangelabs.blacklist.collector.scheduler.SourceScheduler;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Service for orchestrating collection across all configured sources
 *
 * <p>Owns one {@link SourceScheduler} per source collector and is the single entry
 * point for status queries, manual triggers and lifecycle control.
 */
@Service
public class CollectionOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(CollectionOrchestrator.class);

    static final int MAX_HISTORY_LIMIT = 100;

    private final Map<String, SourceCollector> collectors;
    private final Map<String, SourceScheduler> schedulers = new ConcurrentHashMap<>();
    private final CollectionRunService runService;
    private final CollectionHistoryService historyService;
    private final SourceConfigService configService;
    private final SourceRateLimiter rateLimiter;
    private final TaskScheduler taskScheduler;
    private final CollectorProperties properties;
    private final BackoffPolicy backoffPolicy = new BackoffPolicy();
    private final Clock clock;

    private volatile boolean started;

    @Autowired
    public CollectionOrchestrator(List<SourceCollector> collectorList,
                                  CollectionRunService runService,
                                  CollectionHistoryService historyService,
                                  SourceConfigService configService,
                                  SourceRateLimiter rateLimiter,
                                  TaskScheduler taskScheduler,
                                  CollectorProperties properties,
                                  Clock clock) {
        this.collectors = collectorList.stream()
                .collect(Collectors.toMap(collector -> key(collector.getSourceName()), Function.identity()));
        this.runService = runService;
        this.historyService = historyService;
        this.configService = configService;
        this.rateLimiter = rateLimiter;
        this.taskScheduler = taskScheduler;
        this.properties = properties;
        this.clock = clock;

        logger.info("Initialized collection orchestrator with sources: {}", collectors.keySet());
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!properties.getScheduling().isEnabled()) {
            logger.info("Scheduled collection is disabled, sources only run on manual trigger");
            return;
        }
        startAll().subscribe(
                unused -> { },
                error -> logger.error("Failed to start source schedulers: {}", error.getMessage(), error));
    }

    /**
     * Load settings for every source and start its scheduler
     */
    public Mono<Void> startAll() {
        return configService.loadAll(collectors.keySet())
                .doOnNext(settings -> {
                    SourceScheduler scheduler = register(settings);
                    scheduler.applySettings(settings);
                    scheduler.start(properties.getScheduling().isRunOnStartup());
                })
                .then(Mono.fromRunnable(() -> {
                    started = true;
                    logger.info("Started schedulers for {} sources", schedulers.size());
                }));
    }

    /**
     * Stop all schedulers, waiting a bounded time for in-flight runs.
     *
     * @return names of the sources whose run was still in flight when the wait ended
     */
    @PreDestroy
    public List<String> stopAll() {
        started = false;
        schedulers.values().forEach(SourceScheduler::halt);

        Instant deadline = clock.instant().plus(properties.getScheduling().getShutdownTimeout());
        List<String> stragglers = new ArrayList<>();
        for (SourceScheduler scheduler : schedulers.values()) {
            Duration remaining = Duration.between(clock.instant(), deadline);
            if (!scheduler.awaitIdle(remaining.isNegative() ? Duration.ZERO : remaining)) {
                stragglers.add(scheduler.getSourceName());
            }
        }
        if (stragglers.isEmpty()) {
            logger.info("All source schedulers stopped");
        } else {
            logger.warn("Stopped schedulers with runs still in flight: {}", stragglers);
        }
        return stragglers;
    }

    /**
     * Status of every known source, ordered by name
     */
    public List<SourceStatus> status() {
        return collectors.keySet().stream()
                .sorted()
                .map(name -> {
                    SourceScheduler scheduler = schedulers.get(name);
                    return scheduler != null ? scheduler.status() : unscheduledStatus(name);
                })
                .collect(Collectors.toList());
    }

    /**
     * Start a manual run for a source.
     *
     * @param window the range to fetch, or empty for the source's backfill window
     */
    public Mono<TriggerResult> trigger(String sourceName, Optional<DateWindow> window) {
        return Mono.defer(() -> {
            String key = key(sourceName);
            if (!collectors.containsKey(key)) {
                return Mono.error(new UnknownSourceException(sourceName));
            }
            window.ifPresent(this::validateWindow);
            return schedulerFor(key)
                    .map(scheduler -> scheduler.triggerNow(window))
                    .doOnNext(result -> logger.info("Manual trigger for {} ({}): {}",
                            key, window.map(DateWindow::toString).orElse("backfill"), result));
        });
    }

    /**
     * Recent collection runs of a source
     */
    public Flux<CollectionHistory> history(String sourceName, int limit) {
        return Flux.defer(() -> {
            String key = key(sourceName);
            if (!collectors.containsKey(key)) {
                return Flux.error(new UnknownSourceException(sourceName));
            }
            int effectiveLimit = Math.max(1, Math.min(limit, MAX_HISTORY_LIMIT));
            return historyService.recent(key, effectiveLimit);
        });
    }

    /**
     * Re-read source settings and apply changes to the running schedulers
     */
    public Mono<Void> refreshConfiguration() {
        return configService.loadAll(collectors.keySet())
                .doOnNext(settings -> {
                    SourceScheduler existing = schedulers.get(settings.getSourceName());
                    if (existing != null) {
                        existing.applySettings(settings);
                    } else {
                        SourceScheduler scheduler = register(settings);
                        if (started) {
                            scheduler.start(properties.getScheduling().isRunOnStartup());
                        }
                    }
                })
                .then()
                .doOnSuccess(unused -> logger.debug("Refreshed configuration of {} sources", schedulers.size()));
    }

    private Mono<SourceScheduler> schedulerFor(String key) {
        SourceScheduler existing = schedulers.get(key);
        if (existing != null) {
            return Mono.just(existing);
        }
        return configService.settingsFor(key).map(this::register);
    }

    private SourceScheduler register(SourceSettings settings) {
        String key = key(settings.getSourceName());
        return schedulers.computeIfAbsent(key, name -> new SourceScheduler(
                collectors.get(name),
                settings.toBuilder().sourceName(name).build(),
                runService,
                rateLimiter,
                taskScheduler,
                backoffPolicy,
                clock,
                properties.getScheduling().getTickInterval()));
    }

    private void validateWindow(DateWindow window) {
        int maxDays = properties.getDefaults().getMaxWindowDays();
        if (window.lengthInDays() > maxDays) {
            throw new IllegalArgumentException(
                    "Requested range " + window + " spans more than " + maxDays + " days");
        }
    }

    private SourceStatus unscheduledStatus(String name) {
        return SourceStatus.builder()
                .sourceName(name)
                .enabled(true)
                .running(false)
                .phase(SchedulePhase.IDLE)
                .intervalSeconds(properties.getDefaults().getInterval().toSeconds())
                .rateLimit(rateLimiter.getStatus(name))
                .build();
    }

    private static String key(String sourceName) {
        return sourceName.toUpperCase(Locale.ROOT);
    }
}
