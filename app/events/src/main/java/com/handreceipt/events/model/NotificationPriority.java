/*
 * どこで: Events ドメインモデル
 * 何を: 永続通知の優先度
 * なぜ: DB の priority カラムとクライアント表示を一致させるため
 */
package com.handreceipt.events.model;

public enum NotificationPriority {
  LOW("low"),
  NORMAL("normal"),
  HIGH("high"),
  URGENT("urgent");

  private final String value;

  NotificationPriority(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static NotificationPriority fromValue(String value) {
    for (NotificationPriority priority : values()) {
      if (priority.value.equalsIgnoreCase(value)) {
        return priority;
      }
    }
    throw new IllegalArgumentException("unsupported priority: " + value);
  }
}
