/*
 * どこで: common のイベント定義
 * 何を: ライブ配信イベントの種別と、クライアントへ送るワイヤ文字列を定義する
 * なぜ: Web/iOS/Android クライアントと同じ種別文字列を共有するため
 */
package com.handreceipt.common.event;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

public enum EventKind {
  TRANSFER_UPDATE("transfer:update"),
  TRANSFER_CREATED("transfer:created"),
  PROPERTY_UPDATE("property:update"),
  CONNECTION_REQUEST("connection:request"),
  CONNECTION_ACCEPTED("connection:accepted"),
  DOCUMENT_RECEIVED("document:received"),
  GENERAL("notification:general");

  private final String wireName;

  EventKind(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  public static EventKind fromWireName(String wireName) {
    return Arrays.stream(values())
        .filter(kind -> kind.wireName.equals(wireName))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("unknown event kind: " + wireName));
  }
}
