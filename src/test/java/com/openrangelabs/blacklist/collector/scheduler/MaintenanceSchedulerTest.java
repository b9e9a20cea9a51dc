package com.openrangelabs.blacklist.collector.scheduler;

import com.openrangelabs.blacklist.collector.service.CollectionHistoryService;
import com.openrangelabs.blacklist.collector.service.CollectionOrchestrator;
import com.openrangelabs.blacklist.collector.service.RecordSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MaintenanceSchedulerTest {

    @Mock
    private CollectionOrchestrator orchestrator;

    @Mock
    private CollectionHistoryService historyService;

    @Mock
    private RecordSink recordSink;

    private MaintenanceScheduler maintenanceScheduler;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-02-01T03:00:00Z"), ZoneOffset.UTC);
        maintenanceScheduler = new MaintenanceScheduler(orchestrator, historyService, recordSink, clock);

        ReflectionTestUtils.setField(maintenanceScheduler, "schedulingEnabled", true);
        ReflectionTestUtils.setField(maintenanceScheduler, "cleanupEnabled", true);
        ReflectionTestUtils.setField(maintenanceScheduler, "retentionDays", 30);
        ReflectionTestUtils.setField(maintenanceScheduler, "expiryEnabled", true);
    }

    @Test
    void refreshSourceConfiguration_ShouldReloadSettings() {
        // Arrange
        when(orchestrator.refreshConfiguration()).thenReturn(Mono.empty());

        // Act
        maintenanceScheduler.refreshSourceConfiguration();

        // Assert
        verify(orchestrator).refreshConfiguration();
    }

    @Test
    void refreshSourceConfiguration_WhenSchedulingDisabled_ShouldSkip() {
        // Arrange
        ReflectionTestUtils.setField(maintenanceScheduler, "schedulingEnabled", false);

        // Act
        maintenanceScheduler.refreshSourceConfiguration();

        // Assert
        verifyNoInteractions(orchestrator);
    }

    @Test
    void refreshSourceConfiguration_ShouldSurviveErrors() {
        // Arrange
        when(orchestrator.refreshConfiguration()).thenReturn(Mono.error(new RuntimeException("database down")));

        // Act
        maintenanceScheduler.refreshSourceConfiguration();

        // Assert
        verify(orchestrator).refreshConfiguration();
    }

    @Test
    void cleanupHistory_ShouldUseRetentionPeriod() {
        // Arrange
        when(historyService.cleanup(30)).thenReturn(Mono.just(12));

        // Act
        maintenanceScheduler.cleanupHistory();

        // Assert
        verify(historyService).cleanup(30);
    }

    @Test
    void cleanupHistory_WhenDisabled_ShouldSkip() {
        // Arrange
        ReflectionTestUtils.setField(maintenanceScheduler, "cleanupEnabled", false);

        // Act
        maintenanceScheduler.cleanupHistory();

        // Assert
        verifyNoInteractions(historyService);
    }

    @Test
    void deactivateExpiredEntries_ShouldUseToday() {
        // Arrange
        when(recordSink.deactivateExpired(LocalDate.of(2025, 2, 1))).thenReturn(Mono.just(4));

        // Act
        maintenanceScheduler.deactivateExpiredEntries();

        // Assert
        verify(recordSink).deactivateExpired(LocalDate.of(2025, 2, 1));
    }

    @Test
    void deactivateExpiredEntries_WhenDisabled_ShouldSkip() {
        // Arrange
        ReflectionTestUtils.setField(maintenanceScheduler, "expiryEnabled", false);

        // Act
        maintenanceScheduler.deactivateExpiredEntries();

        // Assert
        verifyNoInteractions(recordSink);
    }
}
