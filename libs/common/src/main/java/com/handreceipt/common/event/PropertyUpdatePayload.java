/*
 * どこで: common のイベント payload 定義
 * 何を: 物品 (property) の更新イベントの payload
 * なぜ: 現在の保有者へ状態変化を伝えるため
 */
package com.handreceipt.common.event;

/** {@code ownerId} is null while the property is unassigned. */
public record PropertyUpdatePayload(
    long propertyId, Long ownerId, String serialNumber, String status, String action) {}
