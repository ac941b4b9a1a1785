/*
 * どこで: common のイベント payload 定義
 * 何を: 接続申請/承認イベントの payload
 * なぜ: 申請者と相手の双方に同じ形状で通知するため
 */
package com.handreceipt.common.event;

public record ConnectionRequestPayload(
    long connectionId, long fromUserId, String fromUserName, long targetUserId, String status) {}
