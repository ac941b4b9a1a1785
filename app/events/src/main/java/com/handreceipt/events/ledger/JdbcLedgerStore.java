/*
 * どこで: 監査台帳ストア (PostgreSQL)
 * 何を: audit_ledger テーブルへの追記とキー範囲走査を行う
 * なぜ: 更新/削除をトリガで拒否する追記専用テーブルに台帳を置くため
 */
package com.handreceipt.events.ledger;

import static com.handreceipt.common.JdbcTimestampUtils.toTimestamp;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(name = "audit.ledger.backend", havingValue = "jdbc", matchIfMissing = true)
public class JdbcLedgerStore implements LedgerStore {

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final Clock clock;

  @Override
  public boolean append(LedgerEntry entry) {
    final String sql =
        """
        INSERT INTO audit_ledger (ledger_key, payload_json, digest, created_at)
        VALUES (:key, :payloadJson, :digest, :createdAt)
        ON CONFLICT (ledger_key) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("key", entry.key())
            .addValue("payloadJson", entry.payloadJson())
            .addValue("digest", entry.digest())
            .addValue("createdAt", toTimestamp(Instant.now(clock)));
    try {
      return jdbcTemplate.update(sql, params) == 1;
    } catch (DataAccessException ex) {
      throw new LedgerUnavailableException("ledger append failed key=" + entry.key(), ex);
    }
  }

  @Override
  public Optional<LedgerEntry> get(String key) {
    final String sql =
        """
        SELECT ledger_key, payload_json, digest
        FROM audit_ledger
        WHERE ledger_key = :key
        """;
    try {
      final List<LedgerEntry> rows =
          jdbcTemplate.query(sql, new MapSqlParameterSource("key", key), this::mapRow);
      return rows.stream().findFirst();
    } catch (DataAccessException ex) {
      throw new LedgerUnavailableException("ledger read failed key=" + key, ex);
    }
  }

  @Override
  public List<String> keys(String prefix, String startAfter, int limit) {
    // 続きのページは直前の最終キーより後ろから読む
    final String lowerBound =
        startAfter == null ? "ledger_key >= :prefix" : "ledger_key > :startAfter";
    final String sql =
        "SELECT ledger_key FROM audit_ledger WHERE "
            + lowerBound
            + """
             AND ledger_key < :upperBound
            ORDER BY ledger_key
            LIMIT :limit
            """;
    final MapSqlParameterSource params =
        rangeParams(prefix, limit).addValue("startAfter", startAfter);
    try {
      return jdbcTemplate.query(sql, params, (rs, rowNum) -> rs.getString("ledger_key"));
    } catch (DataAccessException ex) {
      throw new LedgerUnavailableException("ledger scan failed prefix=" + prefix, ex);
    }
  }

  @Override
  public List<LedgerEntry> scan(String prefix, int limit) {
    final String sql =
        """
        SELECT ledger_key, payload_json, digest
        FROM audit_ledger
        WHERE ledger_key >= :prefix AND ledger_key < :upperBound
        ORDER BY ledger_key
        LIMIT :limit
        """;
    try {
      return jdbcTemplate.query(sql, rangeParams(prefix, limit), this::mapRow);
    } catch (DataAccessException ex) {
      throw new LedgerUnavailableException("ledger scan failed prefix=" + prefix, ex);
    }
  }

  @Override
  public List<LedgerEntry> scanLatest(String prefix, int limit) {
    final String sql =
        """
        SELECT ledger_key, payload_json, digest
        FROM audit_ledger
        WHERE ledger_key >= :prefix AND ledger_key < :upperBound
        ORDER BY ledger_key DESC
        LIMIT :limit
        """;
    try {
      return jdbcTemplate.query(sql, rangeParams(prefix, limit), this::mapRow);
    } catch (DataAccessException ex) {
      throw new LedgerUnavailableException("ledger scan failed prefix=" + prefix, ex);
    }
  }

  private MapSqlParameterSource rangeParams(String prefix, int limit) {
    // ledger_key は COLLATE "C" なので範囲比較がバイト順の接頭辞一致になる
    return new MapSqlParameterSource()
        .addValue("prefix", prefix)
        .addValue("upperBound", LedgerKeys.upperBound(prefix))
        .addValue("limit", limit);
  }

  private LedgerEntry mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new LedgerEntry(
        rs.getString("ledger_key"), rs.getString("payload_json"), rs.getString("digest"));
  }
}
