/*
 * どこで: Events 監査モデル
 * 何を: 期間内の監査イベント件数を操作種別/実行者ごとに集計した結果
 * なぜ: コンプライアンス報告画面へ一度の走査で返すため
 */
package com.handreceipt.events.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AuditStatistics(
    String entityType,
    Instant start,
    Instant end,
    long totalEvents,
    Map<String, Long> eventsByAction,
    Map<Long, Long> eventsByActor,
    boolean truncated) {

  public AuditStatistics {
    eventsByAction = Collections.unmodifiableMap(new LinkedHashMap<>(eventsByAction));
    eventsByActor = Collections.unmodifiableMap(new LinkedHashMap<>(eventsByActor));
  }

  public static AuditStatistics empty(String entityType, Instant start, Instant end) {
    return new AuditStatistics(entityType, start, end, 0, Map.of(), Map.of(), false);
  }
}
