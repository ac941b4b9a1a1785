/*
 * どこで: Events API レスポンス DTO
 * 何を: 監査イベント一覧の応答を定義する
 * なぜ: 履歴と検索結果を同じ形で返すため
 */
package com.handreceipt.events.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.handreceipt.events.model.AuditEvent;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AuditEventListResponse(int count, List<AuditEvent> events) {

  public AuditEventListResponse {
    events = List.copyOf(events);
  }

  public static AuditEventListResponse of(List<AuditEvent> events) {
    return new AuditEventListResponse(events.size(), events);
  }
}
