/*
 * どこで: 監査台帳ストア
 * 何を: 台帳キー/JSON 本文/SHA-256 ダイジェストの組
 * なぜ: バックエンドに依存せず改ざん検知できる単位で保存するため
 */
package com.handreceipt.events.ledger;

import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

public record LedgerEntry(String key, String payloadJson, String digest) {

  public LedgerEntry {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(payloadJson, "payloadJson");
    Objects.requireNonNull(digest, "digest");
  }

  public static LedgerEntry seal(String key, String payloadJson) {
    return new LedgerEntry(key, payloadJson, digestOf(payloadJson));
  }

  public static String digestOf(String payloadJson) {
    return Hashing.sha256().hashString(payloadJson, StandardCharsets.UTF_8).toString();
  }

  public boolean digestMatches() {
    return digest.equals(digestOf(payloadJson));
  }
}
