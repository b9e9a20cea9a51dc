package com.openrangelabs.blacklist.collector.scheduler;

import com.openrangelabs.blacklist.collector.connector.SourceCollector;
import com.openrangelabs.blacklist.collector.entity.CollectionHistory;
import com.openrangelabs.blacklist.collector.model.DateWindow;
import com.openrangelabs.blacklist.collector.model.ErrorKind;
import com.openrangelabs.blacklist.collector.model.RunOutcome;
import com.openrangelabs.blacklist.collector.model.SchedulePhase;
import com.openrangelabs.blacklist.collector.model.SourceSettings;
import com.openrangelabs.blacklist.collector.model.SourceStatus;
import com.openrangelabs.blacklist.collector.model.TriggerResult;
import com.openrangelabs.blacklist.collector.model.TriggerType;
import com.openrangelabs.blacklist.collector.ratelimit.SourceRateLimiter;
import com.openrangelabs.blacklist.collector.service.CollectionRunService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives the collection runs of one source.
 *
 * <p>A periodic tick starts a scheduled run when the source is enabled and due.
 * At most one run of the source is in flight at any time, whether started by a
 * tick or by a manual trigger. After a failure the next run is pushed back by the
 * {@link BackoffPolicy}; a success resets the failure count and returns to the
 * regular interval.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
public class SourceScheduler {

    private static final Logger logger = LoggerFactory.getLogger(SourceScheduler.class);

    private final SourceCollector collector;
    private final CollectionRunService runService;
    private final SourceRateLimiter rateLimiter;
    private final TaskScheduler taskScheduler;
    private final BackoffPolicy backoffPolicy;
    private final Clock clock;
    private final Duration tickInterval;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile SourceSettings settings;
    private volatile boolean stopped = true;
    private volatile ScheduledFuture<?> tickTask;
    private volatile CompletableFuture<CollectionHistory> inFlight = CompletableFuture.completedFuture(null);

    // Guarded by this
    private Instant nextRunAt;
    private Instant lastRunAt;
    private Instant lastFinishedAt;
    private RunOutcome lastOutcome;
    private ErrorKind lastErrorKind;
    private int consecutiveFailures;
    private boolean attentionRequired;
    private boolean backingOff;

    public SourceScheduler(SourceCollector collector,
                           SourceSettings settings,
                           CollectionRunService runService,
                           SourceRateLimiter rateLimiter,
                           TaskScheduler taskScheduler,
                           BackoffPolicy backoffPolicy,
                           Clock clock,
                           Duration tickInterval) {
        this.collector = collector;
        this.settings = settings;
        this.runService = runService;
        this.rateLimiter = rateLimiter;
        this.taskScheduler = taskScheduler;
        this.backoffPolicy = backoffPolicy;
        this.clock = clock;
        this.tickInterval = tickInterval;
    }

    /**
     * Start periodic ticking. With {@code runImmediately} the first tick is due at once,
     * otherwise one interval from now.
     */
    public synchronized void start(boolean runImmediately) {
        if (!stopped) {
            return;
        }
        stopped = false;
        Instant now = clock.instant();
        nextRunAt = runImmediately ? now : now.plus(settings.getInterval());
        tickTask = taskScheduler.scheduleWithFixedDelay(this::tick, tickInterval);
        logger.info("Scheduler for {} started: interval={}, next run at {}",
                getSourceName(), settings.getInterval(), nextRunAt);
    }

    /**
     * Start a scheduled run if the source is enabled, due and idle. Never blocks.
     */
    public void tick() {
        try {
            if (stopped || !settings.isEnabled()) {
                logger.debug("Tick for {} skipped: {}", getSourceName(), stopped ? "stopped" : "disabled");
                return;
            }
            Instant due = nextRunAt();
            if (due != null && clock.instant().isBefore(due)) {
                logger.debug("Tick for {} skipped: next run at {}", getSourceName(), due);
                return;
            }
            DateWindow window = DateWindow.endingOn(today(), settings.getScheduledWindowDays());
            if (!launch(window, TriggerType.SCHEDULED)) {
                logger.debug("Tick for {} skipped: a run is in progress", getSourceName());
            }
        } catch (RuntimeException e) {
            logger.error("Scheduler tick for {} failed", getSourceName(), e);
        }
    }

    /**
     * Start a manual run now, regardless of the schedule.
     *
     * @param window the range to fetch, or empty for the backfill window ending today
     * @return whether the run was started
     */
    public TriggerResult triggerNow(Optional<DateWindow> window) {
        if (!settings.isEnabled()) {
            return TriggerResult.DISABLED;
        }
        DateWindow effective = window.orElseGet(
                () -> DateWindow.endingOn(today(), settings.getBackfillWindowDays()));
        return launch(effective, TriggerType.MANUAL) ? TriggerResult.ACCEPTED : TriggerResult.ALREADY_RUNNING;
    }

    private boolean launch(DateWindow window, TriggerType triggerType) {
        if (!running.compareAndSet(false, true)) {
            return false;
        }
        synchronized (this) {
            lastRunAt = clock.instant();
        }
        inFlight = Mono.defer(() -> runService.execute(collector, window, triggerType))
                .doOnNext(this::recordOutcome)
                .doOnError(this::recordError)
                .doOnCancel(() -> running.set(false))
                .doOnSuccess(history -> {
                    if (history == null) {
                        running.set(false);
                    }
                })
                .toFuture();
        return true;
    }

    private void recordOutcome(CollectionHistory history) {
        synchronized (this) {
            Instant now = clock.instant();
            lastFinishedAt = now;
            lastOutcome = history.getRunOutcome();
            lastErrorKind = history.getErrorKindEnum();
            if (history.isSuccessful()) {
                consecutiveFailures = 0;
                attentionRequired = false;
                backingOff = false;
                nextRunAt = now.plus(settings.getInterval());
            } else {
                consecutiveFailures++;
                Duration delay = backoffPolicy.delayAfter(lastErrorKind, consecutiveFailures,
                        settings.getInterval(), settings.getMaxBackoff());
                attentionRequired = lastErrorKind != null && lastErrorKind.requiresOperator();
                backingOff = true;
                nextRunAt = now.plus(delay);
                logger.warn("{} failed {} time(s) in a row ({}), retrying in {}{}",
                        getSourceName(), consecutiveFailures, history.getErrorKind(), delay,
                        attentionRequired ? ", operator attention required" : "");
            }
        }
        running.set(false);
    }

    private void recordError(Throwable error) {
        logger.error("Collection run for {} terminated unexpectedly", getSourceName(), error);
        synchronized (this) {
            lastFinishedAt = clock.instant();
            lastOutcome = RunOutcome.FAILURE;
            lastErrorKind = ErrorKind.INTERNAL;
            consecutiveFailures++;
            backingOff = true;
            nextRunAt = lastFinishedAt.plus(
                    backoffPolicy.delayFor(consecutiveFailures, settings.getInterval(), settings.getMaxBackoff()));
        }
        running.set(false);
    }

    /**
     * Stop ticking and wait up to {@code timeout} for the in-flight run.
     *
     * @return true if no run was left in flight
     */
    public boolean stop(Duration timeout) {
        halt();
        return awaitIdle(timeout);
    }

    /**
     * Stop ticking without waiting. A run in flight keeps going.
     */
    public synchronized void halt() {
        stopped = true;
        ScheduledFuture<?> task = tickTask;
        if (task != null) {
            task.cancel(false);
            tickTask = null;
        }
    }

    /**
     * Wait up to {@code timeout} for the in-flight run to finish.
     */
    public boolean awaitIdle(Duration timeout) {
        CompletableFuture<CollectionHistory> current = inFlight;
        try {
            current.get(Math.max(timeout.toMillis(), 0), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            logger.warn("Run for {} still in flight after {}", getSourceName(), timeout);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return !running.get();
        } catch (ExecutionException e) {
            logger.warn("Run for {} ended with an error during shutdown", getSourceName(), e.getCause());
            return true;
        }
    }

    /**
     * Enable or disable scheduled runs. Re-enabling clears the failure state and
     * makes the source due immediately.
     */
    public synchronized void setEnabled(boolean enabled) {
        boolean wasEnabled = settings.isEnabled();
        settings = settings.toBuilder().enabled(enabled).build();
        if (enabled && !wasEnabled) {
            consecutiveFailures = 0;
            attentionRequired = false;
            backingOff = false;
            nextRunAt = clock.instant();
            logger.info("Source {} enabled", getSourceName());
        } else if (!enabled && wasEnabled) {
            logger.info("Source {} disabled", getSourceName());
        }
    }

    /**
     * Apply changed settings. A new interval moves the next regular run; a pending
     * backoff retry keeps its time.
     */
    public synchronized void applySettings(SourceSettings updated) {
        SourceSettings previous = settings;
        settings = updated.toBuilder().enabled(previous.isEnabled()).build();
        if (!updated.getInterval().equals(previous.getInterval()) && !backingOff) {
            Instant base = lastFinishedAt != null ? lastFinishedAt : clock.instant();
            nextRunAt = base.plus(updated.getInterval());
            logger.info("Interval of {} changed from {} to {}, next run at {}",
                    getSourceName(), previous.getInterval(), updated.getInterval(), nextRunAt);
        }
        if (updated.isEnabled() != previous.isEnabled()) {
            setEnabled(updated.isEnabled());
        }
    }

    public synchronized SourceStatus status() {
        return SourceStatus.builder()
                .sourceName(getSourceName())
                .enabled(settings.isEnabled())
                .running(running.get())
                .phase(phase())
                .lastOutcome(lastOutcome)
                .lastErrorKind(lastErrorKind != null ? lastErrorKind.getCode() : null)
                .lastRunAt(lastRunAt)
                .nextRunAt(settings.isEnabled() ? nextRunAt : null)
                .consecutiveFailures(consecutiveFailures)
                .attentionRequired(attentionRequired)
                .intervalSeconds(settings.getInterval().toSeconds())
                .rateLimit(rateLimiter.getStatus(getSourceName()))
                .build();
    }

    private SchedulePhase phase() {
        if (!settings.isEnabled()) {
            return SchedulePhase.DISABLED;
        }
        if (running.get()) {
            return SchedulePhase.RUNNING;
        }
        return backingOff ? SchedulePhase.BACKOFF : SchedulePhase.IDLE;
    }

    private synchronized Instant nextRunAt() {
        return nextRunAt;
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }

    public boolean isRunning() {
        return running.get();
    }

    public boolean isStopped() {
        return stopped;
    }

    public String getSourceName() {
        return collector.getSourceName();
    }

    public SourceSettings getSettings() {
        return settings;
    }

    CompletableFuture<CollectionHistory> getInFlight() {
        return inFlight;
    }
}
