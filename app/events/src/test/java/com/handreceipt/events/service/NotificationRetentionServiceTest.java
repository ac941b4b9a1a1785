/*
 * Where: Events retention tests
 * What: Verifies the sweep uses the configured thresholds
 * Why: Prevent accidental removal of unread notifications
 */
package com.handreceipt.events.service;

import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.handreceipt.events.config.NotificationRetentionProperties;
import com.handreceipt.events.repository.NotificationRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentMatchers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class NotificationRetentionServiceTest {

  private static final Instant FIXED_NOW = Instant.parse("2024-01-01T00:00:00Z");

  @Mock private NotificationRepository notificationRepository;

  @Test
  void cleanupDeletesExpiredAndOldReadRows() {
    final NotificationRetentionService service =
        new NotificationRetentionService(
            notificationRepository,
            new NotificationRetentionProperties(true, 30, Duration.ofHours(1)),
            Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
    final Instant threshold = FIXED_NOW.minus(Duration.ofDays(30));
    when(notificationRepository.countUnreadOlderThan(threshold)).thenReturn(2);
    when(notificationRepository.deleteExpired(FIXED_NOW)).thenReturn(3);
    when(notificationRepository.deleteReadOlderThan(threshold)).thenReturn(4);

    service.cleanup();

    verify(notificationRepository).deleteExpired(FIXED_NOW);
    verify(notificationRepository).deleteReadOlderThan(threshold);
    verify(notificationRepository, never())
        .deleteByUserIdCreatedBefore(ArgumentMatchers.anyLong(), ArgumentMatchers.any());
  }
}
