/*
 * どこで: Events データアクセス
 * 何を: notifications テーブルの登録/一覧/既読化/削除/保持期間掃除を担う
 * なぜ: 受信者ごとの通知行を接続状態と無関係に永続化するため
 */
package com.handreceipt.events.repository;

import static com.handreceipt.common.JdbcTimestampUtils.toInstant;
import static com.handreceipt.common.JdbcTimestampUtils.toTimestamp;

import com.handreceipt.events.model.NotificationPriority;
import com.handreceipt.events.model.NotificationRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationRepository {

  private static final String COLUMNS =
      """
      id, user_id, type, title, message, data::text AS data_text, priority,
      read, read_at, created_at, expires_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public long insert(NotificationRecord record) {
    final String sql =
        """
        INSERT INTO notifications (
          user_id,
          type,
          title,
          message,
          data,
          priority,
          read,
          read_at,
          created_at,
          expires_at
        ) VALUES (
          :userId,
          :type,
          :title,
          :message,
          CAST(:data AS jsonb),
          :priority,
          :read,
          :readAt,
          :createdAt,
          :expiresAt
        )
        RETURNING id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", record.userId())
            .addValue("type", record.type())
            .addValue("title", record.title())
            .addValue("message", record.message())
            .addValue("data", record.payloadJson())
            .addValue("priority", record.priority().value())
            .addValue("read", record.read())
            .addValue("readAt", toTimestamp(record.readAt()))
            .addValue("createdAt", toTimestamp(record.createdAt()))
            .addValue("expiresAt", toTimestamp(record.expiresAt()));
    final Long id = jdbcTemplate.queryForObject(sql, params, Long.class);
    if (id == null) {
      throw new IllegalStateException("notification insert returned no id");
    }
    return id;
  }

  public List<NotificationRecord> findByUserId(
      long userId, int limit, int offset, boolean unreadOnly, Instant now) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM notifications
            WHERE user_id = :userId
              AND (expires_at IS NULL OR expires_at > :now)
              AND (:unreadOnly = FALSE OR read = FALSE)
            ORDER BY created_at DESC, id DESC
            LIMIT :limit OFFSET :offset
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("now", toTimestamp(now))
            .addValue("unreadOnly", unreadOnly)
            .addValue("limit", limit)
            .addValue("offset", offset);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public long countUnread(long userId, Instant now) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM notifications
        WHERE user_id = :userId
          AND read = FALSE
          AND (expires_at IS NULL OR expires_at > :now)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("userId", userId).addValue("now", toTimestamp(now));
    final Long count = jdbcTemplate.queryForObject(sql, params, Long.class);
    return count == null ? 0 : count;
  }

  /** Returns 0 when no row with this id belongs to the user. Already-read rows keep read_at. */
  public int markRead(long id, long userId, Instant now) {
    final String sql =
        """
        UPDATE notifications
        SET read = TRUE,
            read_at = COALESCE(read_at, :now)
        WHERE id = :id
          AND user_id = :userId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("userId", userId)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int markAllRead(long userId, Instant now) {
    final String sql =
        """
        UPDATE notifications
        SET read = TRUE,
            read_at = :now
        WHERE user_id = :userId
          AND read = FALSE
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("userId", userId).addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int delete(long id, long userId) {
    final String sql =
        """
        DELETE FROM notifications
        WHERE id = :id
          AND user_id = :userId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("id", id).addValue("userId", userId);
    return jdbcTemplate.update(sql, params);
  }

  public int deleteByUserIdCreatedBefore(long userId, Instant threshold) {
    final String sql =
        """
        DELETE FROM notifications
        WHERE user_id = :userId
          AND created_at < :threshold
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.update(sql, params);
  }

  public int deleteExpired(Instant now) {
    final String sql =
        """
        DELETE FROM notifications
        WHERE expires_at IS NOT NULL
          AND expires_at <= :now
        """;
    return jdbcTemplate.update(sql, new MapSqlParameterSource("now", toTimestamp(now)));
  }

  public int deleteReadOlderThan(Instant threshold) {
    final String sql =
        """
        DELETE FROM notifications
        WHERE read = TRUE
          AND created_at < :threshold
        """;
    return jdbcTemplate.update(
        sql, new MapSqlParameterSource("threshold", toTimestamp(threshold)));
  }

  public int countUnreadOlderThan(Instant threshold) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM notifications
        WHERE read = FALSE
          AND created_at < :threshold
        """;
    final Integer count =
        jdbcTemplate.queryForObject(
            sql, new MapSqlParameterSource("threshold", toTimestamp(threshold)), Integer.class);
    return count == null ? 0 : count;
  }

  private NotificationRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new NotificationRecord(
        rs.getLong("id"),
        rs.getLong("user_id"),
        rs.getString("type"),
        rs.getString("title"),
        rs.getString("message"),
        rs.getString("data_text"),
        NotificationPriority.fromValue(rs.getString("priority")),
        rs.getBoolean("read"),
        toInstant(rs.getTimestamp("read_at")),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("expires_at")));
  }
}
