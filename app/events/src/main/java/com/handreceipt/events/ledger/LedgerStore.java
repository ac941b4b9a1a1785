/*
 * どこで: 監査台帳ストア
 * 何を: 追記専用のキー順走査ストアを抽象化する
 * なぜ: キー設計と検索ロジックを JDBC/Redis の実装詳細から切り離すため
 */
package com.handreceipt.events.ledger;

import java.util.List;
import java.util.Optional;

/** Backend failures surface as {@link LedgerUnavailableException}. */
public interface LedgerStore {

  /**
   * 役割: エントリを追記する。 動作: キーが未登録なら保存して true、既に存在すれば何も変えず false を返す。 前提: 上書き API は存在しない。
   */
  boolean append(LedgerEntry entry);

  /** 役割: キーでエントリを 1 件取得する。 動作: 存在しなければ empty を返す。 */
  Optional<LedgerEntry> get(String key);

  /**
   * 役割: 接頭辞に一致するキーを昇順に列挙する。 動作: startAfter が非 null ならそのキーより後ろから始め、最大 limit 件で打ち切る。
   * 前提: prefix は空でなく、limit は正であること。
   */
  List<String> keys(String prefix, String startAfter, int limit);

  default List<String> keys(String prefix, int limit) {
    return keys(prefix, null, limit);
  }

  /** 役割: 接頭辞に一致するエントリをキー昇順に返す。 動作: 最大 limit 件で打ち切る。 */
  List<LedgerEntry> scan(String prefix, int limit);

  /** 役割: 接頭辞に一致するエントリをキー降順 (新しい順) に返す。 動作: 最大 limit 件で打ち切る。 */
  List<LedgerEntry> scanLatest(String prefix, int limit);
}
