/*
 * どこで: Events 監査モデル
 * 何を: 監査検索の条件。null の項目は絞り込みに使わない
 * なぜ: 最も具体的なキー接頭辞の選択と残りの述語判定を分けるため
 */
package com.handreceipt.events.model;

import java.time.Instant;

/**
 * Search criteria for {@code AuditLedger#search}. {@code startDate}/{@code endDate} are both
 * inclusive. {@code limit} bounds the scan, {@code offset} skips matched records.
 */
public record AuditSearchFilter(
    String entityType,
    String entityId,
    AuditAction action,
    Long actorUserId,
    Instant startDate,
    Instant endDate,
    int limit,
    int offset) {

  public static AuditSearchFilter forEntityType(String entityType, Instant start, Instant end) {
    return new AuditSearchFilter(entityType, null, null, null, start, end, 0, 0);
  }

  public boolean matches(AuditEvent event) {
    if (entityType != null && !entityType.equals(event.entityType())) {
      return false;
    }
    if (entityId != null && !entityId.equals(event.entityId())) {
      return false;
    }
    if (action != null && action != event.action()) {
      return false;
    }
    if (actorUserId != null && !actorUserId.equals(event.actorUserId())) {
      return false;
    }
    final Instant timestamp = event.timestamp();
    if (startDate != null && (timestamp == null || timestamp.isBefore(startDate))) {
      return false;
    }
    return endDate == null || (timestamp != null && !timestamp.isAfter(endDate));
  }
}
