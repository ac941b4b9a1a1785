/*
 * どこで: Events Service 層
 * 何を: 業務イベントごとにライブ配信と受信者単位の永続通知を行う唯一の入口
 * なぜ: 接続中ユーザへの即時配信と、接続状態に依存しない通知履歴を同じ呼び出しで揃えるため
 */
package com.handreceipt.events.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.handreceipt.common.event.ConnectionRequestPayload;
import com.handreceipt.common.event.DocumentReceivedPayload;
import com.handreceipt.common.event.EventKind;
import com.handreceipt.common.event.GeneralNotificationPayload;
import com.handreceipt.common.event.PropertyUpdatePayload;
import com.handreceipt.common.event.TransferUpdatePayload;
import com.handreceipt.events.config.NotificationProperties;
import com.handreceipt.events.hub.ClientHub;
import com.handreceipt.events.hub.DeliveryReport;
import com.handreceipt.events.model.EventEnvelope;
import com.handreceipt.events.model.NotificationPriority;
import com.handreceipt.events.model.NotificationRecord;
import com.handreceipt.events.model.NotificationType;
import com.handreceipt.events.repository.NotificationRepository;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point used by the business layer whenever a domain action must reach users.
 *
 * <p>Each {@code notifyX} call builds one envelope, hands it to the hub for best-effort live
 * delivery, then writes one durable row per recipient. The two paths are independent: a live
 * delivery failure is logged and never propagated, and every row write is attempted even when an
 * earlier one fails. The first row failure is rethrown with the others attached as suppressed.
 */
@Service
@RequiredArgsConstructor
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "ClientHub と ObjectMapper は Spring 管理の共有コンポーネントのため")
public class NotificationService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationService.class);

  private final ClientHub clientHub;
  private final NotificationRepository notificationRepository;
  private final NotificationProperties properties;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public void notifyTransferCreated(TransferUpdatePayload transfer) {
    emit(
        EventKind.TRANSFER_CREATED,
        transfer,
        List.of(
            new Recipient(
                transfer.toUserId(),
                "New Transfer Request",
                String.format(
                    "You have a new transfer request for %s (%s)",
                    transfer.itemName(), transfer.serialNumber()),
                NotificationPriority.HIGH)));
  }

  public void notifyTransferUpdate(TransferUpdatePayload transfer) {
    final String title = "Transfer " + transfer.status();
    final List<Recipient> recipients = new ArrayList<>(2);
    recipients.add(
        new Recipient(
            transfer.fromUserId(),
            title,
            String.format(
                "Your transfer of %s (%s) has been %s",
                transfer.itemName(), transfer.serialNumber(), transfer.status()),
            NotificationPriority.NORMAL));
    if (transfer.toUserId() != transfer.fromUserId()) {
      recipients.add(
          new Recipient(
              transfer.toUserId(),
              title,
              String.format(
                  "Transfer of %s (%s) to you has been %s",
                  transfer.itemName(), transfer.serialNumber(), transfer.status()),
              NotificationPriority.NORMAL));
    }
    emit(EventKind.TRANSFER_UPDATE, transfer, recipients);
  }

  public void notifyPropertyUpdate(PropertyUpdatePayload property) {
    if (property.ownerId() == null) {
      logger.debug("property update without owner propertyId={}", property.propertyId());
      return;
    }
    final String action = property.action() == null ? "updated" : property.action();
    emit(
        EventKind.PROPERTY_UPDATE,
        property,
        List.of(
            new Recipient(
                property.ownerId(),
                "Property Updated",
                String.format("Property %s has been %s", property.serialNumber(), action),
                NotificationPriority.NORMAL)));
  }

  public void notifyConnectionRequest(ConnectionRequestPayload connection) {
    emit(
        EventKind.CONNECTION_REQUEST,
        connection,
        List.of(
            new Recipient(
                connection.targetUserId(),
                "New Connection Request",
                String.format("%s wants to connect with you", connection.fromUserName()),
                NotificationPriority.NORMAL)));
  }

  /** {@code fromUserId} is the accepting user; {@code targetUserId} is the original requester. */
  public void notifyConnectionAccepted(ConnectionRequestPayload connection) {
    emit(
        EventKind.CONNECTION_ACCEPTED,
        connection,
        List.of(
            new Recipient(
                connection.targetUserId(),
                "Connection Accepted",
                String.format("%s accepted your connection request", connection.fromUserName()),
                NotificationPriority.NORMAL)));
  }

  public void notifyDocumentReceived(DocumentReceivedPayload document) {
    emit(
        EventKind.DOCUMENT_RECEIVED,
        document,
        List.of(
            new Recipient(
                document.recipientId(),
                "New Document Received",
                String.format(
                    "You received a %s from user %d", document.title(), document.senderId()),
                NotificationPriority.NORMAL)));
  }

  public void sendGeneralNotification(
      long userId, GeneralNotificationPayload payload, NotificationPriority priority) {
    final NotificationPriority resolved = priority == null ? NotificationPriority.NORMAL : priority;
    final EventEnvelope envelope =
        EventEnvelope.direct(EventKind.GENERAL, payload, Instant.now(clock), userId);
    deliverLive(envelope, true, userId);
    persist(
        envelope,
        List.of(new Recipient(userId, payload.title(), payload.message(), resolved)));
  }

  public List<NotificationRecord> getUserNotifications(
      long userId, int limit, int offset, boolean unreadOnly) {
    return notificationRepository.findByUserId(
        userId, clampLimit(limit), Math.max(offset, 0), unreadOnly, Instant.now(clock));
  }

  public long getUnreadCount(long userId) {
    return notificationRepository.countUnread(userId, Instant.now(clock));
  }

  public void markAsRead(long userId, long notificationId) {
    if (notificationRepository.markRead(notificationId, userId, Instant.now(clock)) == 0) {
      throw new NotificationNotFoundException(notificationId, userId);
    }
  }

  public int markAllAsRead(long userId) {
    final int updated = notificationRepository.markAllRead(userId, Instant.now(clock));
    logger.info("notifications marked read userId={} count={}", userId, updated);
    return updated;
  }

  public void deleteNotification(long userId, long notificationId) {
    if (notificationRepository.delete(notificationId, userId) == 0) {
      throw new NotificationNotFoundException(notificationId, userId);
    }
  }

  public int clearOldNotifications(long userId, int days) {
    if (days < 0) {
      throw new IllegalArgumentException("days must not be negative: " + days);
    }
    final Instant threshold = Instant.now(clock).minus(Duration.ofDays(days));
    final int deleted = notificationRepository.deleteByUserIdCreatedBefore(userId, threshold);
    logger.info(
        "old notifications cleared userId={} count={} threshold={}", userId, deleted, threshold);
    return deleted;
  }

  public NotificationRecord createNotification(NotificationRecord record) {
    final Instant createdAt = record.createdAt() == null ? Instant.now(clock) : record.createdAt();
    final NotificationRecord stamped =
        new NotificationRecord(
            null,
            record.userId(),
            record.type(),
            record.title(),
            record.message(),
            record.payloadJson(),
            record.priority() == null ? NotificationPriority.NORMAL : record.priority(),
            record.read(),
            record.readAt(),
            createdAt,
            record.expiresAt() == null ? expiresAt(createdAt) : record.expiresAt());
    return stamped.withId(notificationRepository.insert(stamped));
  }

  public boolean isUserOnline(long userId) {
    return clientHub.isConnected(userId);
  }

  public List<Long> getOnlineUsers() {
    return clientHub.listConnected();
  }

  @VisibleForTesting
  int clampLimit(int limit) {
    return Math.min(Math.max(limit, 1), properties.maxPageSize());
  }

  private void emit(EventKind kind, Object payload, List<Recipient> recipients) {
    final EventEnvelope envelope = EventEnvelope.broadcast(kind, payload, Instant.now(clock));
    deliverLive(envelope, false, 0);
    persist(envelope, recipients);
  }

  private void deliverLive(EventEnvelope envelope, boolean direct, long userId) {
    try {
      final DeliveryReport report =
          direct ? clientHub.sendToUser(userId, envelope) : clientHub.broadcast(envelope);
      if (!report.evicted().isEmpty()) {
        logger.warn(
            "live delivery evicted slow consumers kind={} evicted={}",
            envelope.kind().wireName(),
            report.evicted());
      }
      logger.debug(
          "live delivery kind={} delivered={}", envelope.kind().wireName(), report.delivered());
    } catch (RuntimeException ex) {
      logger.error("live delivery failed kind={}", envelope.kind().wireName(), ex);
    }
  }

  private void persist(EventEnvelope envelope, List<Recipient> recipients) {
    final String payloadJson = toJson(envelope.payload());
    final String type = NotificationType.of(envelope.kind()).value();
    final Instant createdAt = envelope.occurredAt();
    RuntimeException failure = null;
    for (Recipient recipient : recipients) {
      final NotificationRecord record =
          new NotificationRecord(
              null,
              recipient.userId(),
              type,
              recipient.title(),
              recipient.message(),
              payloadJson,
              recipient.priority(),
              false,
              null,
              createdAt,
              expiresAt(createdAt));
      try {
        final long id = notificationRepository.insert(record);
        logger.debug("notification stored id={} userId={} type={}", id, recipient.userId(), type);
      } catch (RuntimeException ex) {
        logger.error(
            "notification store failed userId={} type={}", recipient.userId(), type, ex);
        if (failure == null) {
          failure = ex;
        } else {
          failure.addSuppressed(ex);
        }
      }
    }
    if (failure != null) {
      throw failure;
    }
  }

  private Instant expiresAt(Instant createdAt) {
    return properties.ttl().map(createdAt::plus).orElse(null);
  }

  private String toJson(Object payload) {
    if (payload == null) {
      return null;
    }
    try {
      return objectMapper.writeValueAsString(payload);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("notification payload is not serializable", ex);
    }
  }

  private record Recipient(
      long userId, String title, String message, NotificationPriority priority) {}
}
