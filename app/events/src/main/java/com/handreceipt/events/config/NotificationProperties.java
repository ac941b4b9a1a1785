/*
 * どこで: Events アプリの設定バインド
 * 何を: 通知一覧のページ上限と既定の有効期限を保持する
 * なぜ: 一覧 API の負荷と通知の寿命を環境ごとに調整するため
 */
package com.handreceipt.events.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.Optional;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** {@code defaultTtl} is optional; when absent new rows never expire. */
@ConfigurationProperties(prefix = "notification")
@Validated
public record NotificationProperties(@Positive int maxPageSize, Duration defaultTtl) {

  @AssertTrue(message = "notification.default-ttl must be positive when set")
  public boolean isDefaultTtlPositive() {
    return defaultTtl == null || (!defaultTtl.isZero() && !defaultTtl.isNegative());
  }

  public Optional<Duration> ttl() {
    return Optional.ofNullable(defaultTtl);
  }
}
