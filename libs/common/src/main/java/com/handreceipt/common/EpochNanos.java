/*
 * どこで: 共通ユーティリティ
 * 何を: Instant とエポックナノ秒の相互変換、および固定桁の文字列化を行う
 * なぜ: 監査キーの辞書順と時系列順を一致させるため
 */
package com.handreceipt.common;

import java.time.Instant;

public final class EpochNanos {

  private static final long NANOS_PER_SECOND = 1_000_000_000L;
  // Long.MAX_VALUE の桁数。ゼロ埋めすれば辞書順 = 数値順になる
  private static final int FIXED_WIDTH = 19;

  private EpochNanos() {}

  public static long of(Instant instant) {
    return Math.addExact(
        Math.multiplyExact(instant.getEpochSecond(), NANOS_PER_SECOND), instant.getNano());
  }

  public static Instant toInstant(long epochNanos) {
    return Instant.ofEpochSecond(
        Math.floorDiv(epochNanos, NANOS_PER_SECOND), Math.floorMod(epochNanos, NANOS_PER_SECOND));
  }

  public static String format(long epochNanos) {
    if (epochNanos < 0) {
      throw new IllegalArgumentException("epoch nanos must not be negative: " + epochNanos);
    }
    final String digits = Long.toString(epochNanos);
    return "0".repeat(FIXED_WIDTH - digits.length()) + digits;
  }
}
