/*
 * どこで: Events API レスポンス DTO
 * 何を: 通知一覧の応答を定義する
 * なぜ: ページングの指定値を結果と一緒に返すため
 */
package com.handreceipt.events.api.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationListResponse(
    long userId, int limit, int offset, List<NotificationResponse> notifications) {

  public NotificationListResponse {
    notifications = List.copyOf(notifications);
  }
}
