/*
 * どこで: Events ドメインモデル
 * 何を: notifications テーブルのスナップショット (受信者ごとに 1 行)
 * なぜ: 既読状態を受信者単位で独立に持たせるため
 */
package com.handreceipt.events.model;

import java.time.Instant;

/** {@code id} is null until the row has been inserted. */
public record NotificationRecord(
    Long id,
    long userId,
    String type,
    String title,
    String message,
    String payloadJson,
    NotificationPriority priority,
    boolean read,
    Instant readAt,
    Instant createdAt,
    Instant expiresAt) {

  public NotificationRecord withId(long newId) {
    return new NotificationRecord(
        newId,
        userId,
        type,
        title,
        message,
        payloadJson,
        priority,
        read,
        readAt,
        createdAt,
        expiresAt);
  }

  public boolean isExpiredAt(Instant now) {
    return expiresAt != null && !expiresAt.isAfter(now);
  }
}
