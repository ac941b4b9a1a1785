/*
 * どこで: ライブ配信ハブ
 * 何を: 1 回のファンアウト結果 (配信できたユーザ/切り離したユーザ)
 * なぜ: 呼び出し側がログとテストで配信結果を確認できるようにするため
 */
package com.handreceipt.events.hub;

import com.handreceipt.common.event.EventKind;
import java.util.List;

public record DeliveryReport(EventKind kind, List<Long> delivered, List<Long> evicted) {

  public DeliveryReport {
    delivered = List.copyOf(delivered);
    evicted = List.copyOf(evicted);
  }

  public static DeliveryReport empty(EventKind kind) {
    return new DeliveryReport(kind, List.of(), List.of());
  }
}
