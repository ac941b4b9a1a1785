package com.handreceipt.events.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.handreceipt.events.ledger.InMemoryLedgerStore;
import com.handreceipt.events.service.AuditLedger;
import com.handreceipt.events.service.DisabledAuditLedger;
import com.handreceipt.events.service.KeyValueAuditLedger;
import java.time.Clock;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

class LedgerConfigTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withUserConfiguration(BaseConfiguration.class, LedgerConfig.class)
          .withPropertyValues(
              "audit.ledger.enabled=true",
              "audit.ledger.backend=jdbc",
              "audit.ledger.trail-scan-limit=10",
              "audit.ledger.search-scan-limit=10",
              "audit.ledger.statistics-scan-limit=10",
              "audit.ledger.append-retries=2");

  @Test
  void activeLedgerUsesAvailableStore() {
    contextRunner
        .withBean(InMemoryLedgerStore.class)
        .run(
            context ->
                assertThat(context.getBean(AuditLedger.class))
                    .isInstanceOf(KeyValueAuditLedger.class));
  }

  @Test
  void disabledLedgerNeedsNoStore() {
    contextRunner
        .withPropertyValues("audit.ledger.enabled=false")
        .run(
            context ->
                assertThat(context.getBean(AuditLedger.class))
                    .isInstanceOf(DisabledAuditLedger.class));
  }

  @Test
  void activeLedgerWithoutStoreFailsStartup() {
    contextRunner.run(
        context ->
            assertThat(context)
                .getFailure()
                .hasRootCauseInstanceOf(IllegalStateException.class)
                .rootCause()
                .hasMessageContaining("audit.ledger.backend=JDBC"));
  }

  @Configuration
  @EnableConfigurationProperties(AuditLedgerProperties.class)
  static class BaseConfiguration {

    @Bean
    ObjectMapper objectMapper() {
      return new ObjectMapper();
    }

    @Bean
    Clock clock() {
      return Clock.systemUTC();
    }
  }
}
