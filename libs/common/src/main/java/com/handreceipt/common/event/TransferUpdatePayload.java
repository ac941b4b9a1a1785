/*
 * どこで: common のイベント payload 定義
 * 何を: 移管 (transfer) の作成/更新イベントの payload
 * なぜ: 送り手と受け手の双方へ同じ形状で届けるため
 */
package com.handreceipt.common.event;

public record TransferUpdatePayload(
    long transferId,
    long fromUserId,
    long toUserId,
    String status,
    String serialNumber,
    String itemName) {}
