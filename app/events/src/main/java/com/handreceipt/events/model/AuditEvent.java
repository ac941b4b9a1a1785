/*
 * どこで: Events 監査モデル
 * 何を: 監査台帳の 1 レコード (追記専用)
 * なぜ: エンティティのライフサイクルをコンプライアンス用途で改ざん検知可能に残すため
 */
package com.handreceipt.events.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One immutable ledger record. {@code id} and {@code timestamp} may be null on input; the ledger
 * assigns them on append. Corrections point at the corrected record through {@code
 * correctsEventId}.
 *
 * <p>{@code oldValues}, {@code newValues} and {@code metadata} are stored as JSON, so values come
 * back in their JSON form: integral numbers as {@code Integer} when they fit, otherwise {@code
 * Long}, and nested objects as maps.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditEvent(
    String id,
    String entityType,
    String entityId,
    AuditAction action,
    Long actorUserId,
    String actorName,
    Instant timestamp,
    Map<String, Object> oldValues,
    Map<String, Object> newValues,
    String ipAddress,
    String userAgent,
    String sessionId,
    Map<String, Object> metadata,
    String correctsEventId) {

  public AuditEvent {
    oldValues = copyOf(oldValues);
    newValues = copyOf(newValues);
    metadata = copyOf(metadata);
  }

  public AuditEvent withIdAndTimestamp(String newId, Instant newTimestamp) {
    return new AuditEvent(
        newId,
        entityType,
        entityId,
        action,
        actorUserId,
        actorName,
        newTimestamp,
        oldValues,
        newValues,
        ipAddress,
        userAgent,
        sessionId,
        metadata,
        correctsEventId);
  }

  private static Map<String, Object> copyOf(Map<String, Object> values) {
    if (values == null) {
      return null;
    }
    return Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }
}
