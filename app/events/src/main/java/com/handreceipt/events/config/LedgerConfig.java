/*
 * どこで: Events 監査台帳の設定
 * 何を: audit.ledger.* に従って AuditLedger 実装を選ぶ
 * なぜ: 台帳バックエンドの切り替えと無効化を構成だけで行うため
 */
package com.handreceipt.events.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.handreceipt.events.ledger.LedgerStore;
import com.handreceipt.events.service.AuditLedger;
import com.handreceipt.events.service.DisabledAuditLedger;
import com.handreceipt.events.service.KeyValueAuditLedger;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LedgerConfig {

  private static final Logger logger = LoggerFactory.getLogger(LedgerConfig.class);

  @Bean
  AuditLedger auditLedger(
      AuditLedgerProperties properties,
      ObjectProvider<LedgerStore> ledgerStore,
      ObjectMapper objectMapper,
      Clock clock) {
    if (!properties.active()) {
      return new DisabledAuditLedger();
    }
    final LedgerStore store = ledgerStore.getIfAvailable();
    if (store == null) {
      throw new IllegalStateException(
          "no ledger store for audit.ledger.backend=" + properties.backend());
    }
    logger.info(
        "audit ledger enabled backend={} store={}",
        properties.backend(),
        store.getClass().getSimpleName());
    return new KeyValueAuditLedger(store, objectMapper, properties, clock);
  }
}
