/*
 * どこで: 監査台帳ストア
 * 何を: バックエンド (DB/Redis) 到達不能を表す例外
 * なぜ: 一時的な I/O 失敗を NotFound と区別して 503 に写像するため
 */
package com.handreceipt.events.ledger;

public class LedgerUnavailableException extends RuntimeException {

  public LedgerUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
