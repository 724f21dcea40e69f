package com.threadline.notificationservice.job;

import com.threadline.notificationservice.config.NotificationRetentionProperties;
import com.threadline.notificationservice.repository.NotificationRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RetentionSweeperTest {

    private static final Instant NOW = Instant.parse("2024-05-01T03:00:00Z");

    @Mock
    private NotificationRepository notificationRepository;

    private NotificationRetentionProperties properties;
    private RetentionSweeper sweeper;

    @BeforeEach
    void setUp() {
        properties = new NotificationRetentionProperties();
        sweeper = new RetentionSweeper(notificationRepository, properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void cleanupExpired_UsesThirtyDayCutoff() {
        // Arrange
        when(notificationRepository.deleteExpired(NOW, NOW.minus(Duration.ofDays(30)))).thenReturn(4);

        // Act
        int deleted = sweeper.cleanupExpired();

        // Assert
        assertThat(deleted).isEqualTo(4);
    }

    @Test
    void cleanupExpired_RunTwice_SecondRunDeletesNothing() {
        // Arrange
        when(notificationRepository.deleteExpired(any(), any())).thenReturn(3, 0);

        // Act
        int first = sweeper.cleanupExpired();
        int second = sweeper.cleanupExpired();

        // Assert
        assertThat(first).isEqualTo(3);
        assertThat(second).isZero();
    }

    @Test
    void cleanupExpired_CustomRetention_MovesCutoff() {
        // Arrange
        properties.setRetentionDays(7);
        when(notificationRepository.deleteExpired(NOW, NOW.minus(Duration.ofDays(7)))).thenReturn(0);

        // Act & Assert
        assertThat(sweeper.cleanupExpired()).isZero();
    }

    @Test
    void scheduledCleanup_Disabled_DoesNothing() {
        // Arrange
        properties.setEnabled(false);

        // Act
        sweeper.scheduledCleanup();

        // Assert
        verifyNoInteractions(notificationRepository);
    }

    @Test
    void scheduledCleanup_StoreFails_DoesNotPropagate() {
        // Arrange
        when(notificationRepository.deleteExpired(any(), any()))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        // Act & Assert
        assertThatCode(() -> sweeper.scheduledCleanup()).doesNotThrowAnyException();
    }
}
