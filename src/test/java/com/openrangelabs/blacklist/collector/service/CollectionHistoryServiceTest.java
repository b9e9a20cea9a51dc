package com.openrangelabs.blacklist.collector.service;

import com.openrangelabs.blacklist.collector.entity.CollectionHistory;
import com.openrangelabs.blacklist.collector.model.DateWindow;
import com.openrangelabs.blacklist.collector.model.TriggerType;
import com.openrangelabs.blacklist.collector.repository.CollectionHistoryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CollectionHistoryServiceTest {

    private static final DateWindow WINDOW = new DateWindow(LocalDate.of(2025, 1, 31), LocalDate.of(2025, 2, 1));

    @Mock
    private CollectionHistoryRepository repository;

    private CollectionHistoryService historyService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-02-01T09:00:00Z"), ZoneOffset.UTC);
        historyService = new CollectionHistoryService(repository, clock);
    }

    @Test
    void start_ShouldPersistOpenRecord() {
        // Arrange
        when(repository.save(any(CollectionHistory.class))).thenAnswer(invocation -> {
            CollectionHistory history = invocation.getArgument(0);
            history.setId(7L);
            return Mono.just(history);
        });

        // Act & Assert
        StepVerifier.create(historyService.start("REGTECH", TriggerType.SCHEDULED, WINDOW, "REGTECH:2025-01-31:2025-02-01"))
                .assertNext(history -> {
                    assertThat(history.getId()).isEqualTo(7L);
                    assertThat(history.getTriggerType()).isEqualTo("SCHEDULED");
                    assertThat(history.getStartedAt()).isEqualTo(LocalDateTime.of(2025, 2, 1, 9, 0));
                    assertThat(history.getWindowStart()).isEqualTo(WINDOW.start());
                    assertThat(history.isFinalized()).isFalse();
                })
                .verifyComplete();
    }

    @Test
    void recent_ShouldDelegateWithLimit() {
        // Arrange
        when(repository.findRecentByServiceName("REGTECH", 5)).thenReturn(Flux.empty());

        // Act & Assert
        StepVerifier.create(historyService.recent("REGTECH", 5)).verifyComplete();
        verify(repository).findRecentByServiceName("REGTECH", 5);
    }

    @Test
    void cleanup_ShouldDeleteOlderThanRetention() {
        // Arrange
        when(repository.deleteFinishedBefore(LocalDateTime.of(2024, 11, 3, 9, 0))).thenReturn(Mono.just(3));

        // Act & Assert
        StepVerifier.create(historyService.cleanup(90))
                .expectNext(3)
                .verifyComplete();
    }
}
