/*
 * どこで: 監査台帳ストア (Redis) のテスト
 * 何を: 追記スクリプト (SET NX + ZADD) と辞書順索引の使い方、値の符号化、障害時の例外変換を検証する
 * なぜ: Redis 実装の追記専用/接頭辞走査の前提が崩れる回帰を防ぐため
 */
package com.handreceipt.events.ledger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.data.domain.Range;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.connection.Limit;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.ZSetOperations;
import org.springframework.data.redis.core.script.RedisScript;

class RedisLedgerStoreTest {

  private static final String KEY = "audit:equipment:1:0000000000000000001";

  private StringRedisTemplate redisTemplate;
  private ValueOperations<String, String> valueOps;
  private ZSetOperations<String, String> zSetOps;
  private RedisLedgerStore store;

  @SuppressWarnings("unchecked")
  @BeforeEach
  void setUp() {
    redisTemplate = Mockito.mock(StringRedisTemplate.class);
    valueOps = Mockito.mock(ValueOperations.class);
    zSetOps = Mockito.mock(ZSetOperations.class);
    when(redisTemplate.opsForValue()).thenReturn(valueOps);
    when(redisTemplate.opsForZSet()).thenReturn(zSetOps);
    store = new RedisLedgerStore(redisTemplate);
  }

  @SuppressWarnings("unchecked")
  @Test
  void appendWritesValueAndIndexInOneScript() {
    final LedgerEntry entry = LedgerEntry.seal(KEY, "{\"id\":\"e-1\"}");
    Mockito.doReturn(1L)
        .when(redisTemplate)
        .execute(Mockito.<RedisScript<Long>>any(), eq(List.of(KEY, RedisLedgerStore.INDEX_KEY)), any());

    assertThat(store.append(entry)).isTrue();

    final ArgumentCaptor<RedisScript<Long>> script = ArgumentCaptor.forClass(RedisScript.class);
    final ArgumentCaptor<Object> value = ArgumentCaptor.forClass(Object.class);
    verify(redisTemplate)
        .execute(script.capture(), eq(List.of(KEY, RedisLedgerStore.INDEX_KEY)), value.capture());
    assertThat(value.getValue()).isEqualTo(entry.digest() + ":{\"id\":\"e-1\"}");
    assertThat(script.getValue().getScriptAsString()).contains("'NX'").contains("ZADD");
    verify(valueOps, never()).setIfAbsent(anyString(), anyString());
    verify(zSetOps, never()).add(anyString(), anyString(), Mockito.anyDouble());
  }

  @SuppressWarnings("unchecked")
  @Test
  void appendReturnsFalseWhenKeyExists() {
    Mockito.doReturn(0L)
        .when(redisTemplate)
        .execute(Mockito.<RedisScript<Long>>any(), eq(List.of(KEY, RedisLedgerStore.INDEX_KEY)), any());

    assertThat(store.append(LedgerEntry.seal(KEY, "{}"))).isFalse();
  }

  @SuppressWarnings("unchecked")
  @Test
  void appendConnectionFailureIsWrapped() {
    Mockito.doThrow(new RedisConnectionFailureException("down"))
        .when(redisTemplate)
        .execute(Mockito.<RedisScript<Long>>any(), eq(List.of(KEY, RedisLedgerStore.INDEX_KEY)), any());

    assertThatThrownBy(() -> store.append(LedgerEntry.seal(KEY, "{}")))
        .isInstanceOf(LedgerUnavailableException.class);
    verify(valueOps, never()).setIfAbsent(anyString(), anyString());
  }

  @SuppressWarnings("unchecked")
  @Test
  void keysAfterCursorUseExclusiveLowerBound() {
    when(zSetOps.rangeByLex(eq(RedisLedgerStore.INDEX_KEY), any(Range.class), any(Limit.class)))
        .thenReturn(new LinkedHashSet<>(List.of("audit:equipment:1:0000000000000000002")));

    final List<String> keys = store.keys("audit:equipment:1:", KEY, 10);

    assertThat(keys).containsExactly("audit:equipment:1:0000000000000000002");
    final ArgumentCaptor<Range<String>> range = ArgumentCaptor.forClass(Range.class);
    verify(zSetOps).rangeByLex(eq(RedisLedgerStore.INDEX_KEY), range.capture(), any(Limit.class));
    assertThat(range.getValue().getLowerBound().getValue()).contains(KEY);
    assertThat(range.getValue().getLowerBound().isInclusive()).isFalse();
  }

  @SuppressWarnings("unchecked")
  @Test
  void scanLatestReadsIndexInReverse() {
    final String newer = "audit:equipment:1:0000000000000000002";
    final LedgerEntry newest = LedgerEntry.seal(newer, "{\"n\":2}");
    when(zSetOps.reverseRangeByLex(
            eq(RedisLedgerStore.INDEX_KEY), any(Range.class), any(Limit.class)))
        .thenReturn(new LinkedHashSet<>(List.of(newer)));
    when(valueOps.multiGet(List.of(newer))).thenReturn(List.of(newest.digest() + ":{\"n\":2}"));

    assertThat(store.scanLatest("audit:equipment:1:", 1)).containsExactly(newest);
  }

  @SuppressWarnings("unchecked")
  @Test
  void scanUsesLexRangeAndDecodesValues() {
    final LedgerEntry first = LedgerEntry.seal(KEY, "{\"n\":1}");
    final String secondKey = "audit:equipment:1:0000000000000000002";
    when(zSetOps.rangeByLex(eq(RedisLedgerStore.INDEX_KEY), any(Range.class), any(Limit.class)))
        .thenReturn(new LinkedHashSet<>(List.of(KEY, secondKey)));
    when(valueOps.multiGet(List.of(KEY, secondKey)))
        .thenReturn(Arrays.asList(first.digest() + ":{\"n\":1}", null));

    final List<LedgerEntry> entries = store.scan("audit:equipment:1:", 10);

    assertThat(entries).containsExactly(first);
    final ArgumentCaptor<Range<String>> range = ArgumentCaptor.forClass(Range.class);
    verify(zSetOps).rangeByLex(eq(RedisLedgerStore.INDEX_KEY), range.capture(), any(Limit.class));
    assertThat(range.getValue().getLowerBound().getValue()).contains("audit:equipment:1:");
    assertThat(range.getValue().getUpperBound().getValue()).contains("audit:equipment:1;");
    assertThat(range.getValue().getUpperBound().isInclusive()).isFalse();
  }

  @Test
  void malformedValueFailsDigestCheck() {
    when(valueOps.get(KEY)).thenReturn("not-a-ledger-value");

    final Optional<LedgerEntry> entry = store.get(KEY);

    assertThat(entry).isPresent();
    assertThat(entry.get().digestMatches()).isFalse();
  }

  @Test
  void connectionFailureIsWrapped() {
    when(valueOps.get(KEY)).thenThrow(new RedisConnectionFailureException("down"));

    assertThatThrownBy(() -> store.get(KEY)).isInstanceOf(LedgerUnavailableException.class);
  }
}
