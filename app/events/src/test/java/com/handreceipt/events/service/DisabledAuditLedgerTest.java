/*
 * どこで: 監査台帳 (無効構成) のテスト
 * 何を: 全操作が何も保存せず空/成功の結果を返すことを検証する
 * なぜ: 台帳停止中に業務処理が例外で止まる回帰を防ぐため
 */
package com.handreceipt.events.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.handreceipt.events.model.AuditAction;
import com.handreceipt.events.model.AuditEvent;
import com.handreceipt.events.model.AuditSearchFilter;
import com.handreceipt.events.model.RequestMetadata;
import org.junit.jupiter.api.Test;

class DisabledAuditLedgerTest {

  private final DisabledAuditLedger ledger = new DisabledAuditLedger();

  @Test
  void everyOperationIsANoOp() {
    final AuditEvent event =
        AuditEvents.userEvent(1L, AuditAction.LOGIN, 1L, "a", null, null, RequestMetadata.NONE);

    assertThat(ledger.logEvent(event)).isSameAs(event);
    assertThat(ledger.getTrail("user", "1")).isEmpty();
    assertThat(ledger.search(new AuditSearchFilter("user", null, null, null, null, null, 10, 0)))
        .isEmpty();
    assertThat(ledger.verifyIntegrity("user", "1").verified()).isTrue();
    assertThat(ledger.getStatistics("user", null, null).totalEvents()).isZero();
    assertThat(ledger.findById("any")).isEmpty();
    assertThat(ledger.findCorrections("any")).isEmpty();
    assertThat(ledger.logCorrection("any", "reason", 1L, "a", null).correctsEventId())
        .isEqualTo("any");
  }
}
