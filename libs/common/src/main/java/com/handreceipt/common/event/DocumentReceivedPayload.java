/*
 * どこで: common のイベント payload 定義
 * 何を: 書類受領イベントの payload
 * なぜ: 受領者のクライアントで書類一覧を即時更新させるため
 */
package com.handreceipt.common.event;

public record DocumentReceivedPayload(
    long documentId, long recipientId, long senderId, String documentType, String title) {}
