/*
 * どこで: Events 監査モデル
 * 何を: 監査台帳に記録する操作種別
 * なぜ: 集計と検索のキーを閉じた集合に固定するため
 */
package com.handreceipt.events.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AuditAction {
  CREATE("create"),
  UPDATE("update"),
  DELETE("delete"),
  VIEW("view"),
  LOGIN("login"),
  LOGOUT("logout"),
  TRANSFER("transfer"),
  ASSIGN("assign"),
  RETURN("return"),
  CORRECTION("correction");

  private final String value;

  AuditAction(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static AuditAction fromValue(String value) {
    for (AuditAction action : values()) {
      if (action.value.equalsIgnoreCase(value)) {
        return action;
      }
    }
    throw new IllegalArgumentException("unsupported audit action: " + value);
  }
}
