/*
 * どこで: Events Service 層
 * 何を: エンティティ種別 (user/equipment/hand_receipt) ごとの監査イベント生成ヘルパ
 * なぜ: 業務側がキー用の種別文字列を個別に書かずに済むようにするため
 */
package com.handreceipt.events.service;

import com.handreceipt.events.model.AuditAction;
import com.handreceipt.events.model.AuditEvent;
import com.handreceipt.events.model.RequestMetadata;
import java.util.Map;

public final class AuditEvents {

  public static final String ENTITY_USER = "user";
  public static final String ENTITY_EQUIPMENT = "equipment";
  public static final String ENTITY_HAND_RECEIPT = "hand_receipt";

  private AuditEvents() {}

  public static AuditEvent userEvent(
      long userId,
      AuditAction action,
      Long actorUserId,
      String actorName,
      Map<String, Object> oldValues,
      Map<String, Object> newValues,
      RequestMetadata requestMetadata) {
    return event(
        ENTITY_USER,
        String.valueOf(userId),
        action,
        actorUserId,
        actorName,
        oldValues,
        newValues,
        requestMetadata);
  }

  public static AuditEvent equipmentEvent(
      long equipmentId,
      AuditAction action,
      Long actorUserId,
      String actorName,
      Map<String, Object> oldValues,
      Map<String, Object> newValues,
      RequestMetadata requestMetadata) {
    return event(
        ENTITY_EQUIPMENT,
        String.valueOf(equipmentId),
        action,
        actorUserId,
        actorName,
        oldValues,
        newValues,
        requestMetadata);
  }

  public static AuditEvent handReceiptEvent(
      long handReceiptId,
      AuditAction action,
      Long actorUserId,
      String actorName,
      Map<String, Object> oldValues,
      Map<String, Object> newValues,
      RequestMetadata requestMetadata) {
    return event(
        ENTITY_HAND_RECEIPT,
        String.valueOf(handReceiptId),
        action,
        actorUserId,
        actorName,
        oldValues,
        newValues,
        requestMetadata);
  }

  public static AuditEvent event(
      String entityType,
      String entityId,
      AuditAction action,
      Long actorUserId,
      String actorName,
      Map<String, Object> oldValues,
      Map<String, Object> newValues,
      RequestMetadata requestMetadata) {
    final RequestMetadata meta = requestMetadata == null ? RequestMetadata.NONE : requestMetadata;
    return new AuditEvent(
        null,
        entityType,
        entityId,
        action,
        actorUserId,
        actorName,
        null,
        oldValues,
        newValues,
        meta.ipAddress(),
        meta.userAgent(),
        meta.sessionId(),
        null,
        null);
  }
}
