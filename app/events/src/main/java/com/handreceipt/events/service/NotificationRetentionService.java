/*
 * Where: Events service layer
 * What: Applies the global retention policy to notification rows
 * Why: Prevent unbounded growth of expired and long-read notifications
 */
package com.handreceipt.events.service;

import com.handreceipt.events.config.NotificationRetentionProperties;
import com.handreceipt.events.repository.NotificationRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationRetentionService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationRetentionService.class);

  private final NotificationRepository notificationRepository;
  private final NotificationRetentionProperties properties;
  private final Clock clock;

  public void cleanup() {
    final Instant now = Instant.now(clock);
    final Instant threshold = now.minus(Duration.ofDays(properties.retentionDays()));
    final int staleUnreadCount = notificationRepository.countUnreadOlderThan(threshold);
    if (staleUnreadCount > 0) {
      logger.info(
          "notification retention keeps unread records count={} threshold={}",
          staleUnreadCount,
          threshold);
    }
    final int deletedExpired = notificationRepository.deleteExpired(now);
    final int deletedRead = notificationRepository.deleteReadOlderThan(threshold);
    logger.info(
        "notification retention cleanup deleted expired={} read={} threshold={}",
        deletedExpired,
        deletedRead,
        threshold);
  }
}
