/*
 * どこで: Events 監査モデル
 * 何を: エンティティ単位の改ざん検証結果
 * なぜ: 失敗時にどのキーで止まったかを運用者へ示すため
 */
package com.handreceipt.events.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record IntegrityReport(
    String entityType, String entityId, boolean verified, int checkedRecords, String failedKey,
    String reason) {

  public static IntegrityReport passed(String entityType, String entityId, int checkedRecords) {
    return new IntegrityReport(entityType, entityId, true, checkedRecords, null, null);
  }

  public static IntegrityReport failed(
      String entityType, String entityId, int checkedRecords, String failedKey, String reason) {
    return new IntegrityReport(entityType, entityId, false, checkedRecords, failedKey, reason);
  }
}
