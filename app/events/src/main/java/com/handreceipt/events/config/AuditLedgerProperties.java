/*
 * どこで: Events アプリの設定バインド
 * 何を: 監査台帳のバックエンド選択と走査上限を保持する
 * なぜ: 台帳の保存先を構成で切り替え、走査コストを固定上限で抑えるため
 */
package com.handreceipt.events.config;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "audit.ledger")
@Validated
public record AuditLedgerProperties(
    boolean enabled,
    @NotNull Backend backend,
    @Positive int trailScanLimit,
    @Positive int searchScanLimit,
    @Positive int statisticsScanLimit,
    @Positive int appendRetries) {

  public enum Backend {
    JDBC,
    REDIS,
    DISABLED
  }

  public boolean active() {
    return enabled && backend != Backend.DISABLED;
  }
}
