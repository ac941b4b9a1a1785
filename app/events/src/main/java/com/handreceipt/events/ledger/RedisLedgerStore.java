/*
 * どこで: 監査台帳ストア (Redis)
 * 何を: SET NX による追記と、辞書順 Sorted Set 索引による接頭辞走査を行う
 * なぜ: キーバリュー型バックエンドでも同じキー設計で台帳を運用するため
 */
package com.handreceipt.events.ledger;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.connection.Limit;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Repository;

/**
 * Values are stored as {@code <sha256 hex>:<json>} under the ledger key. Every appended key is
 * also added with score 0 to {@link #INDEX_KEY} so prefix scans can use {@code ZRANGEBYLEX}. The
 * value write and the index write run in one Lua script, so a stored value is always indexed.
 * The ledger keys and the index must live on the same Redis node.
 */
@Repository
@ConditionalOnProperty(name = "audit.ledger.backend", havingValue = "redis")
public class RedisLedgerStore implements LedgerStore {

  static final String INDEX_KEY = "audit-index";

  private static final int DIGEST_LENGTH = 64;

  // KEYS[1]=台帳キー, KEYS[2]=索引, ARGV[1]=値。SET NX が成功した時だけ索引へ載せる
  private static final RedisScript<Long> APPEND_SCRIPT =
      new DefaultRedisScript<>(
          """
          if redis.call('SET', KEYS[1], ARGV[1], 'NX') then
            redis.call('ZADD', KEYS[2], 0, KEYS[1])
            return 1
          end
          return 0
          """,
          Long.class);

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StringRedisTemplate は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final StringRedisTemplate redisTemplate;

  public RedisLedgerStore(StringRedisTemplate redisTemplate) {
    this.redisTemplate = redisTemplate;
  }

  @Override
  public boolean append(LedgerEntry entry) {
    try {
      final Long stored =
          redisTemplate.execute(APPEND_SCRIPT, List.of(entry.key(), INDEX_KEY), encode(entry));
      return stored != null && stored == 1L;
    } catch (DataAccessException ex) {
      throw new LedgerUnavailableException("ledger append failed key=" + entry.key(), ex);
    }
  }

  @Override
  public Optional<LedgerEntry> get(String key) {
    try {
      return Optional.ofNullable(redisTemplate.opsForValue().get(key))
          .map(value -> decode(key, value));
    } catch (DataAccessException ex) {
      throw new LedgerUnavailableException("ledger read failed key=" + key, ex);
    }
  }

  @Override
  public List<String> keys(String prefix, String startAfter, int limit) {
    final Range<String> range =
        startAfter == null
            ? Range.rightOpen(prefix, LedgerKeys.upperBound(prefix))
            : Range.of(
                Range.Bound.exclusive(startAfter),
                Range.Bound.exclusive(LedgerKeys.upperBound(prefix)));
    try {
      final Set<String> keys =
          redisTemplate.opsForZSet().rangeByLex(INDEX_KEY, range, Limit.limit().count(limit));
      return keys == null ? List.of() : new ArrayList<>(keys);
    } catch (DataAccessException ex) {
      throw new LedgerUnavailableException("ledger scan failed prefix=" + prefix, ex);
    }
  }

  @Override
  public List<LedgerEntry> scan(String prefix, int limit) {
    return fetch(prefix, keys(prefix, limit));
  }

  @Override
  public List<LedgerEntry> scanLatest(String prefix, int limit) {
    final List<String> keys;
    try {
      final Set<String> found =
          redisTemplate
              .opsForZSet()
              .reverseRangeByLex(
                  INDEX_KEY,
                  Range.rightOpen(prefix, LedgerKeys.upperBound(prefix)),
                  Limit.limit().count(limit));
      keys = found == null ? List.of() : new ArrayList<>(found);
    } catch (DataAccessException ex) {
      throw new LedgerUnavailableException("ledger scan failed prefix=" + prefix, ex);
    }
    return fetch(prefix, keys);
  }

  private List<LedgerEntry> fetch(String prefix, List<String> keys) {
    if (keys.isEmpty()) {
      return List.of();
    }
    final List<String> values;
    try {
      values = redisTemplate.opsForValue().multiGet(keys);
    } catch (DataAccessException ex) {
      throw new LedgerUnavailableException("ledger scan failed prefix=" + prefix, ex);
    }
    return decodeAll(keys, values);
  }

  private List<LedgerEntry> decodeAll(List<String> keys, Collection<String> values) {
    final List<LedgerEntry> entries = new ArrayList<>(keys.size());
    if (values == null) {
      return entries;
    }
    int index = 0;
    for (String value : values) {
      final String key = keys.get(index++);
      // 索引だけ残った (値の無い) キーは走査結果から除く
      if (value != null) {
        entries.add(decode(key, value));
      }
    }
    return entries;
  }

  private static String encode(LedgerEntry entry) {
    return entry.digest() + ":" + entry.payloadJson();
  }

  private static LedgerEntry decode(String key, String value) {
    if (value.length() <= DIGEST_LENGTH || value.charAt(DIGEST_LENGTH) != ':') {
      // 形式不正は改ざんとして検証で落ちるよう、空ダイジェストで返す
      return new LedgerEntry(key, value, "");
    }
    return new LedgerEntry(
        key, value.substring(DIGEST_LENGTH + 1), value.substring(0, DIGEST_LENGTH));
  }
}
