/*
 * どこで: Events API レスポンス DTO
 * 何を: 件数だけを返す応答 (未読数/既読化件数/削除件数)
 * なぜ: 一括操作の結果をクライアントが表示できるようにするため
 */
package com.handreceipt.events.api.response;

public record CountResponse(long count) {}
