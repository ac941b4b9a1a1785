/*
 * どこで: Events API
 * 何を: 監査履歴/改ざん検証/検索/集計/ID 参照エンドポイントを公開する
 * なぜ: 監査担当がエンティティの変更履歴と台帳の健全性を確認できるようにするため
 */
package com.handreceipt.events.api;

import com.handreceipt.events.api.response.AuditEventListResponse;
import com.handreceipt.events.model.AuditAction;
import com.handreceipt.events.model.AuditEvent;
import com.handreceipt.events.model.AuditSearchFilter;
import com.handreceipt.events.model.AuditStatistics;
import com.handreceipt.events.model.IntegrityReport;
import com.handreceipt.events.service.AuditEventNotFoundException;
import com.handreceipt.events.service.AuditLedger;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/audit")
@RequiredArgsConstructor
public class AuditController {

  private final AuditLedger auditLedger;

  @GetMapping("/search")
  public ResponseEntity<AuditEventListResponse> search(
      @RequestParam(name = "entity_type", required = false) String entityType,
      @RequestParam(name = "entity_id", required = false) String entityId,
      @RequestParam(name = "action", required = false) String action,
      @RequestParam(name = "actor_user_id", required = false) Long actorUserId,
      @RequestParam(name = "start", required = false)
          @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
          Instant start,
      @RequestParam(name = "end", required = false)
          @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
          Instant end,
      @RequestParam(name = "limit", defaultValue = "0") int limit,
      @RequestParam(name = "offset", defaultValue = "0") int offset) {
    final AuditSearchFilter filter =
        new AuditSearchFilter(
            entityType,
            entityId,
            action == null ? null : AuditAction.fromValue(action),
            actorUserId,
            start,
            end,
            limit,
            offset);
    return ResponseEntity.ok(AuditEventListResponse.of(auditLedger.search(filter)));
  }

  @GetMapping("/statistics")
  public ResponseEntity<AuditStatistics> statistics(
      @RequestParam(name = "entity_type", required = false) String entityType,
      @RequestParam(name = "start", required = false)
          @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
          Instant start,
      @RequestParam(name = "end", required = false)
          @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
          Instant end) {
    return ResponseEntity.ok(auditLedger.getStatistics(entityType, start, end));
  }

  @GetMapping("/events/{eventId}")
  public ResponseEntity<AuditEvent> findById(@PathVariable("eventId") String eventId) {
    return ResponseEntity.ok(
        auditLedger.findById(eventId).orElseThrow(() -> new AuditEventNotFoundException(eventId)));
  }

  @GetMapping("/{entityType}/{entityId}")
  public ResponseEntity<AuditEventListResponse> trail(
      @PathVariable("entityType") String entityType, @PathVariable("entityId") String entityId) {
    return ResponseEntity.ok(AuditEventListResponse.of(auditLedger.getTrail(entityType, entityId)));
  }

  @GetMapping("/{entityType}/{entityId}/verify")
  public ResponseEntity<IntegrityReport> verify(
      @PathVariable("entityType") String entityType, @PathVariable("entityId") String entityId) {
    return ResponseEntity.ok(auditLedger.verifyIntegrity(entityType, entityId));
  }
}
