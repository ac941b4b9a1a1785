/*
 * どこで: Events 監査モデル
 * 何を: 監査イベントに添えるリクエスト由来の情報
 * なぜ: 誰がどこから操作したかを後から追跡するため
 */
package com.handreceipt.events.model;

public record RequestMetadata(String ipAddress, String userAgent, String sessionId) {

  public static final RequestMetadata NONE = new RequestMetadata(null, null, null);
}
