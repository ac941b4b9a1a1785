/*
 * どこで: Events API レスポンス DTO
 * 何を: 通知 1 件の応答表現
 * なぜ: 保存形式 (data JSON 文字列) をクライアント向けの JSON ノードへ変換して返すため
 */
package com.handreceipt.events.api.response;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "API DTO record はレスポンス整形用途のため")
public record NotificationResponse(
    long id,
    long userId,
    String type,
    String title,
    String message,
    JsonNode data,
    String priority,
    boolean read,
    Instant readAt,
    Instant createdAt,
    Instant expiresAt) {}
