package com.openrangelabs.blacklist.collector.scheduler;

import com.openrangelabs.blacklist.collector.config.CollectorProperties;
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
import com.openrangelabs.blacklist.collector.model.UpsertResult;
import com.openrangelabs.blacklist.collector.ratelimit.SourceRateLimiter;
import com.openrangelabs.blacklist.collector.service.CollectionRunService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SourceSchedulerTest {

    private static final Instant START = Instant.parse("2025-02-01T09:00:00Z");
    private static final Duration INTERVAL = Duration.ofSeconds(60);
    private static final Duration CAP = Duration.ofHours(1);

    @Mock
    private SourceCollector collector;

    @Mock
    private CollectionRunService runService;

    @Mock
    private TaskScheduler taskScheduler;

    @Mock
    private ScheduledFuture<Object> tickFuture;

    private MutableClock clock;
    private SourceScheduler scheduler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        lenient().when(collector.getSourceName()).thenReturn("REGTECH");

        SourceSettings settings = SourceSettings.builder()
                .sourceName("REGTECH")
                .enabled(true)
                .interval(INTERVAL)
                .maxBackoff(CAP)
                .scheduledWindowDays(1)
                .backfillWindowDays(90)
                .build();

        scheduler = new SourceScheduler(collector, settings, runService,
                new SourceRateLimiter(new CollectorProperties()), taskScheduler,
                new BackoffPolicy(), clock, Duration.ofSeconds(30));
    }

    @Test
    void triggerNow_SecondTriggerWhileRunningIsRejected() {
        // Arrange
        Sinks.One<CollectionHistory> pending = Sinks.one();
        when(runService.execute(eq(collector), any(DateWindow.class), eq(TriggerType.MANUAL)))
                .thenReturn(pending.asMono());

        // Act
        TriggerResult first = scheduler.triggerNow(Optional.empty());
        TriggerResult second = scheduler.triggerNow(Optional.empty());

        // Assert
        assertThat(first).isEqualTo(TriggerResult.ACCEPTED);
        assertThat(second).isEqualTo(TriggerResult.ALREADY_RUNNING);
        assertThat(scheduler.status().getPhase()).isEqualTo(SchedulePhase.RUNNING);
        verify(runService, times(1)).execute(any(), any(), any());

        pending.tryEmitValue(succeeded());
        assertThat(scheduler.isRunning()).isFalse();
        assertThat(scheduler.getInFlight()).isDone();
    }

    @Test
    void triggerNow_DefaultsToBackfillWindowEndingToday() {
        // Arrange
        ArgumentCaptor<DateWindow> window = ArgumentCaptor.forClass(DateWindow.class);
        when(runService.execute(eq(collector), window.capture(), eq(TriggerType.MANUAL)))
                .thenReturn(Mono.just(succeeded()));

        // Act
        scheduler.triggerNow(Optional.empty());

        // Assert
        assertThat(window.getValue().end()).isEqualTo(LocalDate.of(2025, 2, 1));
        assertThat(window.getValue().lengthInDays()).isEqualTo(90);
    }

    @Test
    void triggerNow_UsesRequestedWindow() {
        // Arrange
        DateWindow requested = new DateWindow(LocalDate.of(2024, 12, 1), LocalDate.of(2024, 12, 31));
        when(runService.execute(collector, requested, TriggerType.MANUAL)).thenReturn(Mono.just(succeeded()));

        // Act & Assert
        assertThat(scheduler.triggerNow(Optional.of(requested))).isEqualTo(TriggerResult.ACCEPTED);
        verify(runService).execute(collector, requested, TriggerType.MANUAL);
    }

    @Test
    void triggerNow_DisabledSourceIsNotRun() {
        // Arrange
        scheduler.setEnabled(false);

        // Act & Assert
        assertThat(scheduler.triggerNow(Optional.empty())).isEqualTo(TriggerResult.DISABLED);
        verifyNoInteractions(runService);
    }

    @Test
    void recordOutcome_ConsecutiveFailuresBackOffExponentially() {
        // Arrange
        when(runService.execute(any(), any(), any())).thenReturn(Mono.just(failed(ErrorKind.NETWORK_TIMEOUT)));

        // Act
        scheduler.triggerNow(Optional.empty());
        SourceStatus afterFirst = scheduler.status();
        scheduler.triggerNow(Optional.empty());
        SourceStatus afterSecond = scheduler.status();
        scheduler.triggerNow(Optional.empty());
        SourceStatus afterThird = scheduler.status();

        // Assert
        assertThat(afterFirst.getPhase()).isEqualTo(SchedulePhase.BACKOFF);
        assertThat(afterFirst.getConsecutiveFailures()).isEqualTo(1);
        assertThat(afterFirst.getNextRunAt()).isEqualTo(START.plusSeconds(60));
        assertThat(afterSecond.getNextRunAt()).isEqualTo(START.plusSeconds(120));
        assertThat(afterThird.getNextRunAt()).isEqualTo(START.plusSeconds(240));
        assertThat(afterThird.isAttentionRequired()).isFalse();
        assertThat(afterThird.getLastErrorKind()).isEqualTo("timeout");
    }

    @Test
    void recordOutcome_SuccessResetsBackoff() {
        // Arrange
        when(runService.execute(any(), any(), any()))
                .thenReturn(Mono.just(failed(ErrorKind.CONNECTION_REFUSED)))
                .thenReturn(Mono.just(succeeded()));

        // Act
        scheduler.triggerNow(Optional.empty());
        clock.advance(Duration.ofMinutes(5));
        scheduler.triggerNow(Optional.empty());

        // Assert
        SourceStatus status = scheduler.status();
        assertThat(status.getPhase()).isEqualTo(SchedulePhase.IDLE);
        assertThat(status.getConsecutiveFailures()).isZero();
        assertThat(status.getLastOutcome()).isEqualTo(RunOutcome.SUCCESS);
        assertThat(status.getNextRunAt()).isEqualTo(START.plus(Duration.ofMinutes(5)).plus(INTERVAL));
    }

    @Test
    void recordOutcome_RejectedCredentialNeedsOperator() {
        // Arrange
        when(runService.execute(any(), any(), any())).thenReturn(Mono.just(failed(ErrorKind.CREDENTIAL_REJECTED)));

        // Act
        scheduler.triggerNow(Optional.empty());

        // Assert
        SourceStatus status = scheduler.status();
        assertThat(status.isAttentionRequired()).isTrue();
        assertThat(status.getNextRunAt()).isEqualTo(START.plus(CAP));
    }

    @Test
    void recordOutcome_RejectedCredentialNeverRetriesBeforeRegularInterval() {
        // Arrange
        Duration daily = Duration.ofDays(1);
        scheduler.applySettings(scheduler.getSettings().toBuilder().interval(daily).build());
        when(runService.execute(any(), any(), any())).thenReturn(Mono.just(failed(ErrorKind.CREDENTIAL_REJECTED)));

        // Act
        scheduler.triggerNow(Optional.empty());

        // Assert
        SourceStatus status = scheduler.status();
        assertThat(status.isAttentionRequired()).isTrue();
        assertThat(status.getNextRunAt()).isEqualTo(START.plus(daily));
    }

    @Test
    void recordOutcome_BackoffGrowsFromSourceInterval() {
        // Arrange
        scheduler.applySettings(scheduler.getSettings().toBuilder()
                .interval(Duration.ofMinutes(10))
                .maxBackoff(Duration.ofHours(2))
                .build());
        when(runService.execute(any(), any(), any())).thenReturn(Mono.just(failed(ErrorKind.UNEXPECTED_STATUS)));

        // Act
        scheduler.triggerNow(Optional.empty());
        SourceStatus afterFirst = scheduler.status();
        scheduler.triggerNow(Optional.empty());
        SourceStatus afterSecond = scheduler.status();

        // Assert
        assertThat(afterFirst.getNextRunAt()).isEqualTo(START.plus(Duration.ofMinutes(10)));
        assertThat(afterSecond.getNextRunAt()).isEqualTo(START.plus(Duration.ofMinutes(20)));
    }

    @Test
    void recordOutcome_PartialRunCountsAsFailure() {
        // Arrange
        CollectionHistory partial = history();
        partial.partial(new UpsertResult(40, 0, 0, 0), 0, ErrorKind.SINK_ERROR, "connection lost",
                LocalDateTime.ofInstant(START, ZoneOffset.UTC));
        when(runService.execute(any(), any(), any())).thenReturn(Mono.just(partial));

        // Act
        scheduler.triggerNow(Optional.empty());

        // Assert
        SourceStatus status = scheduler.status();
        assertThat(status.getLastOutcome()).isEqualTo(RunOutcome.PARTIAL);
        assertThat(status.getConsecutiveFailures()).isEqualTo(1);
        assertThat(status.getPhase()).isEqualTo(SchedulePhase.BACKOFF);
    }

    @Test
    void tick_RunsOnlyWhenDue() {
        // Arrange
        doReturn(tickFuture).when(taskScheduler).scheduleWithFixedDelay(any(Runnable.class), eq(Duration.ofSeconds(30)));
        ArgumentCaptor<DateWindow> window = ArgumentCaptor.forClass(DateWindow.class);
        when(runService.execute(eq(collector), window.capture(), eq(TriggerType.SCHEDULED)))
                .thenReturn(Mono.just(succeeded()));
        scheduler.start(false);

        // Act
        scheduler.tick();
        clock.advance(INTERVAL);
        scheduler.tick();

        // Assert
        verify(runService, times(1)).execute(any(), any(), any());
        assertThat(window.getValue())
                .isEqualTo(new DateWindow(LocalDate.of(2025, 1, 31), LocalDate.of(2025, 2, 1)));
    }

    @Test
    void tick_DoesNothingWhenStoppedOrDisabled() {
        // Act
        scheduler.tick();
        scheduler.setEnabled(false);
        scheduler.tick();

        // Assert
        verifyNoInteractions(runService);
    }

    @Test
    void tick_RuntimeFailureDoesNotEscape() {
        // Arrange
        doReturn(tickFuture).when(taskScheduler).scheduleWithFixedDelay(any(Runnable.class), any(Duration.class));
        when(runService.execute(any(), any(), any())).thenThrow(new IllegalStateException("boom"));
        scheduler.start(true);

        // Act
        scheduler.tick();

        // Assert
        assertThat(scheduler.isRunning()).isFalse();
        assertThat(scheduler.status().getLastErrorKind()).isEqualTo("internal");
    }

    @Test
    void stop_ReportsRunStillInFlight() {
        // Arrange
        doReturn(tickFuture).when(taskScheduler).scheduleWithFixedDelay(any(Runnable.class), any(Duration.class));
        Sinks.One<CollectionHistory> pending = Sinks.one();
        when(runService.execute(any(), any(), any())).thenReturn(pending.asMono());
        scheduler.start(true);
        scheduler.triggerNow(Optional.empty());

        // Act
        boolean idle = scheduler.stop(Duration.ofMillis(50));

        // Assert
        assertThat(idle).isFalse();
        assertThat(scheduler.isStopped()).isTrue();
        verify(tickFuture).cancel(false);

        pending.tryEmitValue(succeeded());
        assertThat(scheduler.awaitIdle(Duration.ofSeconds(1))).isTrue();
    }

    @Test
    void setEnabled_ReEnablingClearsFailureState() {
        // Arrange
        when(runService.execute(any(), any(), any())).thenReturn(Mono.just(failed(ErrorKind.CREDENTIAL_DISABLED)));
        scheduler.triggerNow(Optional.empty());

        // Act
        scheduler.setEnabled(false);
        SourceStatus disabled = scheduler.status();
        clock.advance(Duration.ofMinutes(10));
        scheduler.setEnabled(true);

        // Assert
        assertThat(disabled.getPhase()).isEqualTo(SchedulePhase.DISABLED);
        assertThat(disabled.getNextRunAt()).isNull();
        SourceStatus enabled = scheduler.status();
        assertThat(enabled.isAttentionRequired()).isFalse();
        assertThat(enabled.getConsecutiveFailures()).isZero();
        assertThat(enabled.getNextRunAt()).isEqualTo(START.plus(Duration.ofMinutes(10)));
    }

    @Test
    void applySettings_NewIntervalMovesNextRun() {
        // Arrange
        doReturn(tickFuture).when(taskScheduler).scheduleWithFixedDelay(any(Runnable.class), any(Duration.class));
        scheduler.start(false);

        // Act
        scheduler.applySettings(scheduler.getSettings().toBuilder().interval(Duration.ofHours(2)).build());

        // Assert
        assertThat(scheduler.status().getNextRunAt()).isEqualTo(START.plus(Duration.ofHours(2)));
        assertThat(scheduler.status().getIntervalSeconds()).isEqualTo(7200);
    }

    @Test
    void applySettings_PendingRetryKeepsItsTime() {
        // Arrange
        when(runService.execute(any(), any(), any())).thenReturn(Mono.just(failed(ErrorKind.NETWORK_TIMEOUT)));
        scheduler.triggerNow(Optional.empty());

        // Act
        scheduler.applySettings(scheduler.getSettings().toBuilder().interval(Duration.ofHours(2)).build());

        // Assert
        assertThat(scheduler.status().getNextRunAt()).isEqualTo(START.plusSeconds(60));
    }

    private CollectionHistory history() {
        CollectionHistory history = new CollectionHistory("REGTECH", TriggerType.MANUAL,
                DateWindow.endingOn(LocalDate.of(2025, 2, 1), 1), "REGTECH:2025-01-31:2025-02-01");
        history.start(LocalDateTime.ofInstant(clock.instant(), ZoneOffset.UTC));
        return history;
    }

    private CollectionHistory succeeded() {
        CollectionHistory history = history();
        history.succeed(3, new UpsertResult(3, 0, 0, 0), 0, LocalDateTime.ofInstant(clock.instant(), ZoneOffset.UTC));
        return history;
    }

    private CollectionHistory failed(ErrorKind kind) {
        CollectionHistory history = history();
        history.fail(kind, kind.getCode(), LocalDateTime.ofInstant(clock.instant(), ZoneOffset.UTC));
        return history;
    }

    /**
     * Clock that only moves when told to.
     */
    static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
