package com.example.osr.unit.infrastructure;

import com.example.osr.application.exception.StorageException;
import com.example.osr.application.port.in.PurgeHistoryUseCase;
import com.example.osr.infrastructure.config.OsrProperties;
import com.example.osr.infrastructure.scheduling.RetentionPurgeScheduler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("Retention Purge Scheduler Tests")
class RetentionPurgeSchedulerTest {

    @Mock
    private PurgeHistoryUseCase purgeHistoryUseCase;

    private static OsrProperties withRetention(Duration retention) {
        return new OsrProperties("OSR1", false,
                new OsrProperties.Gateway("http://localhost:8090", Duration.ofSeconds(2), Duration.ofSeconds(10)),
                new OsrProperties.Document("src", null),
                new OsrProperties.History(retention, 3_600_000L),
                new OsrProperties.Catalog(false));
    }

    @Test
    @DisplayName("should_refuse_negative_retention_at_startup")
    void should_refuse_negative_retention_at_startup() {
        // When & Then
        assertThatThrownBy(() -> new RetentionPurgeScheduler(purgeHistoryUseCase, withRetention(Duration.ofHours(-1))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("osr.history.retention");
        verifyNoInteractions(purgeHistoryUseCase);
    }

    @Test
    @DisplayName("should_purge_with_configured_retention")
    void should_purge_with_configured_retention() {
        // Given
        RetentionPurgeScheduler scheduler = new RetentionPurgeScheduler(purgeHistoryUseCase, withRetention(Duration.ofDays(7)));
        when(purgeHistoryUseCase.purge(Duration.ofDays(7))).thenReturn(2);

        // When
        scheduler.purgeExpired();

        // Then
        verify(purgeHistoryUseCase).purge(Duration.ofDays(7));
    }

    @Test
    @DisplayName("should_keep_running_when_purge_fails")
    void should_keep_running_when_purge_fails() {
        // Given
        RetentionPurgeScheduler scheduler = new RetentionPurgeScheduler(purgeHistoryUseCase, withRetention(Duration.ZERO));
        when(purgeHistoryUseCase.purge(Duration.ZERO))
                .thenThrow(new StorageException("History store failed to purge", new IllegalStateException("down")));

        // When & Then
        assertThatCode(scheduler::purgeExpired).doesNotThrowAnyException();
    }
}
