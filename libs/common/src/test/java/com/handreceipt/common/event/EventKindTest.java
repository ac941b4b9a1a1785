/*
 * どこで: common のイベント定義テスト
 * 何を: 種別のワイヤ文字列と JSON 表現を検証する
 * なぜ: クライアントが購読している種別文字列の変更を検知するため
 */
package com.handreceipt.common.event;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class EventKindTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Test
  void wireNamesMatchClientContract() {
    assertThat(EventKind.values())
        .extracting(EventKind::wireName)
        .containsExactly(
            "transfer:update",
            "transfer:created",
            "property:update",
            "connection:request",
            "connection:accepted",
            "document:received",
            "notification:general");
  }

  @Test
  void serializesAsWireName() throws Exception {
    assertThat(objectMapper.writeValueAsString(EventKind.CONNECTION_ACCEPTED))
        .isEqualTo("\"connection:accepted\"");
  }

  @Test
  void fromWireNameRejectsUnknownKind() {
    assertThat(EventKind.fromWireName("property:update")).isEqualTo(EventKind.PROPERTY_UPDATE);
    assertThatThrownBy(() -> EventKind.fromWireName("transfer:deleted"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void generalPayloadOmitsMissingData() throws Exception {
    final String json =
        objectMapper.writeValueAsString(new GeneralNotificationPayload("Hi", "hello", null));

    assertThat(json).isEqualTo("{\"title\":\"Hi\",\"message\":\"hello\"}");
  }
}
