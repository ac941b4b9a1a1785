/*
 * どこで: Events ドメインモデル
 * 何を: 永続通知の type カラム値
 * なぜ: ライブ配信の種別文字列とは別に、既存の通知一覧 UI が使う値を保つため
 */
package com.handreceipt.events.model;

import com.handreceipt.common.event.EventKind;

public enum NotificationType {
  TRANSFER_UPDATE("transfer_update"),
  TRANSFER_CREATED("transfer_created"),
  PROPERTY_UPDATE("property_update"),
  CONNECTION_REQUEST("connection_request"),
  CONNECTION_ACCEPTED("connection_accepted"),
  DOCUMENT_RECEIVED("document_received"),
  GENERAL("general");

  private final String value;

  NotificationType(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static NotificationType of(EventKind kind) {
    return switch (kind) {
      case TRANSFER_UPDATE -> TRANSFER_UPDATE;
      case TRANSFER_CREATED -> TRANSFER_CREATED;
      case PROPERTY_UPDATE -> PROPERTY_UPDATE;
      case CONNECTION_REQUEST -> CONNECTION_REQUEST;
      case CONNECTION_ACCEPTED -> CONNECTION_ACCEPTED;
      case DOCUMENT_RECEIVED -> DOCUMENT_RECEIVED;
      case GENERAL -> GENERAL;
    };
  }
}
