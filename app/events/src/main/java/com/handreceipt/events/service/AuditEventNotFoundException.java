/*
 * どこで: Events Service 層
 * 何を: 監査イベント ID が台帳に見つからないことを表す例外
 * なぜ: 訂正対象の不在を I/O 失敗と区別するため
 */
package com.handreceipt.events.service;

public class AuditEventNotFoundException extends RuntimeException {

  public AuditEventNotFoundException(String eventId) {
    super("audit event not found id=" + eventId);
  }
}
