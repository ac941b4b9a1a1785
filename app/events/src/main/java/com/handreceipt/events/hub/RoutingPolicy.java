/*
 * どこで: ライブ配信ハブ
 * 何を: 封筒から配信先ユーザ集合を求める純粋関数
 * なぜ: 種別ごとの宛先規則を一箇所に閉じ込めるため
 */
package com.handreceipt.events.hub;

import com.handreceipt.common.event.ConnectionRequestPayload;
import com.handreceipt.common.event.DocumentReceivedPayload;
import com.handreceipt.common.event.PropertyUpdatePayload;
import com.handreceipt.common.event.TransferUpdatePayload;
import com.handreceipt.events.model.EventEnvelope;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Maps an envelope to the users that should receive it live. An explicit target always wins.
 * Payloads that do not have the shape expected for their kind route to nobody; this never
 * throws.
 */
@Component
public class RoutingPolicy {

  public Set<Long> recipients(EventEnvelope envelope) {
    if (envelope.targetUserId() != null) {
      return users(envelope.targetUserId());
    }
    final Object payload = envelope.payload();
    return switch (envelope.kind()) {
      case TRANSFER_CREATED, TRANSFER_UPDATE ->
          payload instanceof TransferUpdatePayload transfer
              ? users(transfer.fromUserId(), transfer.toUserId())
              : Set.of();
      case PROPERTY_UPDATE ->
          payload instanceof PropertyUpdatePayload property && property.ownerId() != null
              ? users(property.ownerId())
              : Set.of();
      case CONNECTION_REQUEST, CONNECTION_ACCEPTED ->
          payload instanceof ConnectionRequestPayload connection
              ? users(connection.fromUserId(), connection.targetUserId())
              : Set.of();
      case DOCUMENT_RECEIVED ->
          payload instanceof DocumentReceivedPayload document
              ? users(document.recipientId())
              : Set.of();
      case GENERAL -> Set.of();
    };
  }

  private static Set<Long> users(long... userIds) {
    final Set<Long> users = new LinkedHashSet<>();
    for (long userId : userIds) {
      // 未採番 (0 以下) の ID は宛先として扱わない
      if (userId > 0) {
        users.add(userId);
      }
    }
    return Collections.unmodifiableSet(users);
  }
}
