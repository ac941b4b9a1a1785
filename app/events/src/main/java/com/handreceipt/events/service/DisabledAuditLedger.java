/*
 * どこで: Events Service 層
 * 何を: 監査台帳が無効な構成で使う何もしない実装
 * なぜ: 台帳の停止中も業務処理を止めずに済ませるため
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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class DisabledAuditLedger implements AuditLedger {

  private static final Logger logger = LoggerFactory.getLogger(DisabledAuditLedger.class);

  public DisabledAuditLedger() {
    logger.warn("audit ledger is disabled; events will not be recorded");
  }

  @Override
  public AuditEvent logEvent(AuditEvent event) {
    logger.debug(
        "audit ledger disabled, dropping event entityType={} entityId={} action={}",
        event.entityType(),
        event.entityId(),
        event.action());
    return event;
  }

  @Override
  public List<AuditEvent> getTrail(String entityType, String entityId) {
    return List.of();
  }

  @Override
  public List<AuditEvent> search(AuditSearchFilter filter) {
    return List.of();
  }

  @Override
  public IntegrityReport verifyIntegrity(String entityType, String entityId) {
    return IntegrityReport.passed(entityType, entityId, 0);
  }

  @Override
  public AuditStatistics getStatistics(String entityType, Instant start, Instant end) {
    return AuditStatistics.empty(entityType, start, end);
  }

  @Override
  public Optional<AuditEvent> findById(String eventId) {
    return Optional.empty();
  }

  @Override
  public AuditEvent logCorrection(
      String originalEventId,
      String reason,
      Long actorUserId,
      String actorName,
      RequestMetadata requestMetadata) {
    final RequestMetadata meta = requestMetadata == null ? RequestMetadata.NONE : requestMetadata;
    return new AuditEvent(
        null,
        null,
        null,
        AuditAction.CORRECTION,
        actorUserId,
        actorName,
        null,
        null,
        null,
        meta.ipAddress(),
        meta.userAgent(),
        meta.sessionId(),
        Map.of(KeyValueAuditLedger.METADATA_REASON, reason == null ? "" : reason),
        originalEventId);
  }

  @Override
  public List<AuditEvent> findCorrections(String originalEventId) {
    return List.of();
  }
}
