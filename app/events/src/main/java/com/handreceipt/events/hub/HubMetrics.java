/*
 * どこで: ライブ配信ハブ
 * 何を: 接続数/配信結果/制御キュー溢れのメトリクスを記録する
 * なぜ: 遅い購読者の切り離し頻度を Prometheus から観測するため
 */
package com.handreceipt.events.hub;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class HubMetrics {

  private static final String METRIC_CONNECTIONS_CURRENT = "hub.connections.current";
  private static final String METRIC_DELIVERY_TOTAL = "hub.delivery.total";
  private static final String METRIC_INTAKE_REJECTED_TOTAL = "hub.intake.rejected.total";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger connectionsCurrent = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> deliveryCounters = new ConcurrentHashMap<>();
  private final Counter intakeRejectedCounter;

  public HubMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_CONNECTIONS_CURRENT, connectionsCurrent, AtomicInteger::get)
        .description("Current number of live client connections")
        .register(meterRegistry);
    this.intakeRejectedCounter =
        Counter.builder(METRIC_INTAKE_REJECTED_TOTAL)
            .description("Hub control commands rejected because the intake queue was full")
            .register(meterRegistry);
  }

  public void recordDelivery(String result, int count) {
    if (count <= 0) {
      return;
    }
    deliveryCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_DELIVERY_TOTAL)
                    .description("Live delivery outcomes per recipient")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment(count);
  }

  public void recordIntakeRejected() {
    intakeRejectedCounter.increment();
  }

  public void updateConnectionsCurrent(int connections) {
    connectionsCurrent.set(Math.max(connections, 0));
  }
}
