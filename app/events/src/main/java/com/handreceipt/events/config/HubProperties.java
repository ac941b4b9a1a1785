/*
 * どこで: Events アプリの設定バインド
 * 何を: ライブ配信ハブの送信キュー容量/制御キュー容量/停止待ち時間を保持する
 * なぜ: 遅い購読者を切り離す閾値を環境ごとに調整するため
 */
package com.handreceipt.events.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "hub")
@Validated
public record HubProperties(
    @Positive int queueCapacity, @Positive int intakeCapacity, @NotNull Duration shutdownTimeout) {

  @AssertTrue(message = "hub.shutdown-timeout must be positive")
  public boolean isShutdownTimeoutPositive() {
    return shutdownTimeout != null && !shutdownTimeout.isZero() && !shutdownTimeout.isNegative();
  }
}
