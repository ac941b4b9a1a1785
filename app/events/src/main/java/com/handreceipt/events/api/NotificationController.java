/*
 * どこで: Events API
 * 何を: 呼び出しユーザ自身の通知一覧/未読数/既読化/削除エンドポイントを公開する
 * なぜ: クライアントが接続状態に関係なく通知履歴を扱えるようにするため
 */
package com.handreceipt.events.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.handreceipt.events.api.response.CountResponse;
import com.handreceipt.events.api.response.NotificationListResponse;
import com.handreceipt.events.api.response.NotificationResponse;
import com.handreceipt.events.model.NotificationRecord;
import com.handreceipt.events.service.NotificationService;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/notifications")
@RequiredArgsConstructor
public class NotificationController {

  private static final String HEADER_USER_ID = "X-User-Id";

  private final NotificationService notificationService;
  private final ObjectMapper objectMapper;

  @GetMapping
  public ResponseEntity<NotificationListResponse> list(
      @RequestHeader(HEADER_USER_ID) long userId,
      @RequestParam(name = "limit", defaultValue = "50") int limit,
      @RequestParam(name = "offset", defaultValue = "0") int offset,
      @RequestParam(name = "unread_only", defaultValue = "false") boolean unreadOnly) {
    final List<NotificationResponse> items =
        notificationService.getUserNotifications(userId, limit, offset, unreadOnly).stream()
            .map(this::toResponse)
            .toList();
    return ResponseEntity.ok(new NotificationListResponse(userId, limit, offset, items));
  }

  @GetMapping("/unread-count")
  public ResponseEntity<CountResponse> unreadCount(@RequestHeader(HEADER_USER_ID) long userId) {
    return ResponseEntity.ok(new CountResponse(notificationService.getUnreadCount(userId)));
  }

  @PostMapping("/{id}/read")
  public ResponseEntity<Void> markAsRead(
      @RequestHeader(HEADER_USER_ID) long userId, @PathVariable("id") long id) {
    notificationService.markAsRead(userId, id);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/read-all")
  public ResponseEntity<CountResponse> markAllAsRead(@RequestHeader(HEADER_USER_ID) long userId) {
    return ResponseEntity.ok(new CountResponse(notificationService.markAllAsRead(userId)));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> delete(
      @RequestHeader(HEADER_USER_ID) long userId, @PathVariable("id") long id) {
    notificationService.deleteNotification(userId, id);
    return ResponseEntity.noContent().build();
  }

  @DeleteMapping
  public ResponseEntity<CountResponse> clearOld(
      @RequestHeader(HEADER_USER_ID) long userId,
      @RequestParam(name = "older_than_days") int olderThanDays) {
    return ResponseEntity.ok(
        new CountResponse(notificationService.clearOldNotifications(userId, olderThanDays)));
  }

  private NotificationResponse toResponse(NotificationRecord record) {
    return new NotificationResponse(
        record.id(),
        record.userId(),
        record.type(),
        record.title(),
        record.message(),
        parse(record.payloadJson()),
        record.priority().value(),
        record.read(),
        record.readAt(),
        record.createdAt(),
        record.expiresAt());
  }

  private JsonNode parse(String payloadJson) {
    if (payloadJson == null) {
      return null;
    }
    try {
      return objectMapper.readTree(payloadJson);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("notification payload parse failure", ex);
    }
  }
}
