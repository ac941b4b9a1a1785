/*
 * どこで: Events データアクセスのテスト
 * 何を: 通知行の登録/一覧/既読化/削除/保持期間掃除を実 DB で検証する
 * なぜ: 所有者チェックと期限切れ除外が SQL で正しく効いていることを保証するため
 */
package com.handreceipt.events.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.handreceipt.events.AbstractPostgresContainerTest;
import com.handreceipt.events.model.NotificationPriority;
import com.handreceipt.events.model.NotificationRecord;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class NotificationRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant NOW = Instant.parse("2026-03-01T00:00:00Z");

  @Autowired private NotificationRepository notificationRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM notifications", new MapSqlParameterSource());
  }

  @Test
  void insertAndListNewestFirstExcludingExpired() {
    final long older = notificationRepository.insert(row(1L, NOW.minusSeconds(60), null));
    final long newer = notificationRepository.insert(row(1L, NOW, null));
    notificationRepository.insert(row(1L, NOW.minusSeconds(30), NOW.minusSeconds(1)));
    notificationRepository.insert(row(2L, NOW, null));

    final List<NotificationRecord> rows = notificationRepository.findByUserId(1L, 10, 0, false, NOW);

    assertThat(rows).extracting(NotificationRecord::id).containsExactly(newer, older);
    assertThat(rows.get(0).payloadJson()).contains("\"transferId\"");
    assertThat(rows.get(0).priority()).isEqualTo(NotificationPriority.HIGH);
    assertThat(notificationRepository.countUnread(1L, NOW)).isEqualTo(2);
  }

  @Test
  void markReadChecksOwnershipAndKeepsFirstReadAt() {
    final long id = notificationRepository.insert(row(1L, NOW, null));

    assertThat(notificationRepository.markRead(id, 2L, NOW)).isZero();
    assertThat(notificationRepository.markRead(id, 1L, NOW)).isEqualTo(1);
    assertThat(notificationRepository.markRead(id, 1L, NOW.plusSeconds(60))).isEqualTo(1);

    final Map<String, Object> row =
        jdbcTemplate.queryForMap(
            "SELECT read, read_at FROM notifications WHERE id = :id",
            new MapSqlParameterSource("id", id));
    assertThat(row.get("read")).isEqualTo(Boolean.TRUE);
    assertThat(((Timestamp) row.get("read_at")).toInstant()).isEqualTo(NOW);
    assertThat(notificationRepository.findByUserId(1L, 10, 0, true, NOW)).isEmpty();
  }

  @Test
  void markAllReadReturnsChangedCount() {
    notificationRepository.insert(row(1L, NOW, null));
    notificationRepository.insert(row(1L, NOW, null));
    notificationRepository.insert(row(2L, NOW, null));

    assertThat(notificationRepository.markAllRead(1L, NOW)).isEqualTo(2);
    assertThat(notificationRepository.markAllRead(1L, NOW)).isZero();
  }

  @Test
  void deleteChecksOwnership() {
    final long id = notificationRepository.insert(row(1L, NOW, null));

    assertThat(notificationRepository.delete(id, 2L)).isZero();
    assertThat(notificationRepository.delete(id, 1L)).isEqualTo(1);
    assertThat(notificationRepository.delete(id, 1L)).isZero();
  }

  @Test
  void retentionSweepsKeepUnreadRows() {
    final Instant old = NOW.minus(Duration.ofDays(40));
    final long oldRead = notificationRepository.insert(row(1L, old, null));
    notificationRepository.markRead(oldRead, 1L, old);
    notificationRepository.insert(row(1L, old, null));
    notificationRepository.insert(row(1L, NOW.minus(Duration.ofDays(1)), NOW.minusSeconds(1)));
    final Instant threshold = NOW.minus(Duration.ofDays(30));

    assertThat(notificationRepository.deleteExpired(NOW)).isEqualTo(1);
    assertThat(notificationRepository.deleteReadOlderThan(threshold)).isEqualTo(1);
    assertThat(notificationRepository.countUnreadOlderThan(threshold)).isEqualTo(1);
  }

  @Test
  void deleteByUserIdCreatedBefore() {
    notificationRepository.insert(row(1L, NOW.minus(8, ChronoUnit.DAYS), null));
    notificationRepository.insert(row(1L, NOW, null));
    notificationRepository.insert(row(2L, NOW.minus(8, ChronoUnit.DAYS), null));

    assertThat(notificationRepository.deleteByUserIdCreatedBefore(1L, NOW.minus(7, ChronoUnit.DAYS)))
        .isEqualTo(1);
  }

  private static NotificationRecord row(long userId, Instant createdAt, Instant expiresAt) {
    return new NotificationRecord(
        null,
        userId,
        "transfer_created",
        "New Transfer Request",
        "You have a new transfer request for Radio (SN-7)",
        "{\"transferId\":7}",
        NotificationPriority.HIGH,
        false,
        null,
        createdAt,
        expiresAt);
  }
}
