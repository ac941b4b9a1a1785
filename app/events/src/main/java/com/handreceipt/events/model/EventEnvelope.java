/*
 * どこで: Events ドメインモデル
 * 何を: ライブ配信 1 回分の不変な封筒 (種別/payload/時刻/明示宛先)
 * なぜ: ルーティングと JSON 化を同じ値から行うため
 */
package com.handreceipt.events.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.handreceipt.common.event.EventKind;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.Optional;

/**
 * Wire form: {@code {"type": "...", "data": {...}, "timestamp": "<RFC3339>", "userId": 7}}.
 * {@code userId} is present only for direct (unicast) envelopes.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"type", "data", "timestamp", "userId"})
public record EventEnvelope(
    @JsonProperty("type") EventKind kind,
    @JsonProperty("data") Object payload,
    @JsonIgnore Instant occurredAt,
    @JsonProperty("userId") Long targetUserId) {

  public EventEnvelope {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(occurredAt, "occurredAt");
  }

  public static EventEnvelope broadcast(EventKind kind, Object payload, Instant occurredAt) {
    return new EventEnvelope(kind, payload, occurredAt, null);
  }

  public static EventEnvelope direct(
      EventKind kind, Object payload, Instant occurredAt, long targetUserId) {
    return new EventEnvelope(kind, payload, occurredAt, targetUserId);
  }

  @JsonProperty("timestamp")
  public String timestamp() {
    return DateTimeFormatter.ISO_INSTANT.format(occurredAt);
  }

  public Optional<Long> target() {
    return Optional.ofNullable(targetUserId);
  }
}
