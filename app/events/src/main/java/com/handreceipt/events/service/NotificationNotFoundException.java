/*
 * どこで: Events Service 層
 * 何を: 通知が存在しない、または呼び出しユーザの所有でないことを表す例外
 * なぜ: 所有者不一致を存在しない扱いにし、他人の通知 ID を推測させないため
 */
package com.handreceipt.events.service;

public class NotificationNotFoundException extends RuntimeException {

  public NotificationNotFoundException(long notificationId, long userId) {
    super("notification not found id=" + notificationId + " userId=" + userId);
  }
}
