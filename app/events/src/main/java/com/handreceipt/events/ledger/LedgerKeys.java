/*
 * どこで: 監査台帳ストア
 * 何を: audit:{type}:{id}:{nanos} 形式のキーと走査用接頭辞を組み立てる
 * なぜ: キーの辞書順をエンティティ内の時系列順と一致させるため
 */
package com.handreceipt.events.ledger;

import com.handreceipt.common.EpochNanos;

public final class LedgerKeys {

  public static final String ROOT_PREFIX = "audit:";

  private static final char SEPARATOR = ':';

  private LedgerKeys() {}

  public static String key(String entityType, String entityId, long timestampNanos) {
    return entityPrefix(entityType, entityId) + EpochNanos.format(timestampNanos);
  }

  public static String typePrefix(String entityType) {
    return ROOT_PREFIX + segment("entityType", entityType) + SEPARATOR;
  }

  public static String entityPrefix(String entityType, String entityId) {
    return typePrefix(entityType) + segment("entityId", entityId) + SEPARATOR;
  }

  /** Exclusive upper bound for a range scan over {@code prefix}. */
  public static String upperBound(String prefix) {
    if (prefix.isEmpty()) {
      throw new IllegalArgumentException("prefix must not be empty");
    }
    final int last = prefix.length() - 1;
    return prefix.substring(0, last) + (char) (prefix.charAt(last) + 1);
  }

  private static String segment(String name, String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " is required");
    }
    if (value.indexOf(SEPARATOR) >= 0) {
      throw new IllegalArgumentException(name + " must not contain ':' value=" + value);
    }
    return value;
  }
}
