/*
 * どこで: Events Service 層
 * 何を: 追記専用の監査台帳の操作を抽象化する
 * なぜ: 台帳が無効な環境でも呼び出し側を変えずに済ませるため
 */
package com.handreceipt.events.service;

import com.handreceipt.events.model.AuditAction;
import com.handreceipt.events.model.AuditEvent;
import com.handreceipt.events.model.AuditSearchFilter;
import com.handreceipt.events.model.AuditStatistics;
import com.handreceipt.events.model.IntegrityReport;
import com.handreceipt.events.model.RequestMetadata;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Append-only ledger of entity lifecycle events. There is no update or delete operation; a
 * mistaken record is amended by appending a correction that references it.
 */
public interface AuditLedger {

  /**
   * 役割: 監査イベントを追記する。 動作: id/timestamp が未設定なら採番し、保存した JSON を読み戻した形のイベントを返す。 前提: entityType/entityId は空でなく ':'
   * を含まないこと。
   */
  AuditEvent logEvent(AuditEvent event);

  default AuditEvent logEvent(
      String entityType,
      String entityId,
      AuditAction action,
      Long actorUserId,
      String actorName,
      Map<String, Object> oldValues,
      Map<String, Object> newValues,
      RequestMetadata requestMetadata) {
    return logEvent(
        AuditEvents.event(
            entityType,
            entityId,
            action,
            actorUserId,
            actorName,
            oldValues,
            newValues,
            requestMetadata));
  }

  /** 役割: エンティティの監査履歴を新しい順に返す。 動作: trail-scan-limit を超える場合は新しい方から上限件数を返す。 */
  List<AuditEvent> getTrail(String entityType, String entityId);

  /** 役割: 条件に一致する監査イベントを新しい順に返す。 動作: 走査件数は limit で打ち切る。 */
  List<AuditEvent> search(AuditSearchFilter filter);

  /** 役割: エンティティの全レコードを再読込してダイジェストを検証する。 動作: 読込失敗も含め、1 件でも問題があれば失敗を返す。 */
  IntegrityReport verifyIntegrity(String entityType, String entityId);

  AuditStatistics getStatistics(String entityType, Instant start, Instant end);

  Optional<AuditEvent> findById(String eventId);

  /** 役割: 既存イベントへの訂正を新しいレコードとして追記する。 動作: 訂正対象が無ければ AuditEventNotFoundException。 */
  AuditEvent logCorrection(
      String originalEventId,
      String reason,
      Long actorUserId,
      String actorName,
      RequestMetadata requestMetadata);

  List<AuditEvent> findCorrections(String originalEventId);
}
