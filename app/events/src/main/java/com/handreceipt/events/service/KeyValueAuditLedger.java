/*
 * どこで: Events Service 層
 * 何を: キー順走査ストア上に監査台帳 (追記/履歴/検索/検証/集計/訂正) を実装する
 * なぜ: キー設計と検索ロジックを 1 箇所に置き、JDBC/Redis のどちらでも同じ振る舞いにするため
 */
package com.handreceipt.events.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.handreceipt.common.EpochNanos;
import com.handreceipt.events.config.AuditLedgerProperties;
import com.handreceipt.events.ledger.LedgerEntry;
import com.handreceipt.events.ledger.LedgerKeys;
import com.handreceipt.events.ledger.LedgerStore;
import com.handreceipt.events.model.AuditAction;
import com.handreceipt.events.model.AuditEvent;
import com.handreceipt.events.model.AuditSearchFilter;
import com.handreceipt.events.model.AuditStatistics;
import com.handreceipt.events.model.IntegrityReport;
import com.handreceipt.events.model.RequestMetadata;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ledger over a {@link LedgerStore}. Records are keyed {@code audit:{type}:{id}:{nanos}} with the
 * nanosecond timestamp zero-padded, so a prefix scan of one entity returns its trail in time
 * order. Every scan is bounded by a fixed cap from {@link AuditLedgerProperties}.
 */
public class KeyValueAuditLedger implements AuditLedger {

  static final String METADATA_REASON = "reason";

  private static final Logger logger = LoggerFactory.getLogger(KeyValueAuditLedger.class);

  private static final Comparator<AuditEvent> NEWEST_FIRST =
      Comparator.comparing(
              AuditEvent::timestamp, Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))
          .reversed();

  private final LedgerStore store;
  private final ObjectMapper objectMapper;
  private final AuditLedgerProperties properties;
  private final Clock clock;

  public KeyValueAuditLedger(
      LedgerStore store, ObjectMapper objectMapper, AuditLedgerProperties properties, Clock clock) {
    this.store = store;
    // 台帳の JSON は全体設定に依存させず ISO-8601 の日時で固定する
    this.objectMapper =
        objectMapper
            .copy()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    this.properties = properties;
    this.clock = clock;
  }

  @Override
  public AuditEvent logEvent(AuditEvent event) {
    Objects.requireNonNull(event.action(), "action");
    final String id = event.id() == null ? UUID.randomUUID().toString() : event.id();
    final Instant requested = event.timestamp() == null ? Instant.now(clock) : event.timestamp();
    final long baseNanos = EpochNanos.of(requested);
    // キー構築で entityType/entityId を検証する
    LedgerKeys.entityPrefix(event.entityType(), event.entityId());

    for (int attempt = 0; attempt <= properties.appendRetries(); attempt++) {
      final long nanos = baseNanos + attempt;
      final AuditEvent stamped = event.withIdAndTimestamp(id, EpochNanos.toInstant(nanos));
      final String key = LedgerKeys.key(event.entityType(), event.entityId(), nanos);
      final LedgerEntry entry = LedgerEntry.seal(key, encode(stamped));
      if (store.append(entry)) {
        logger.debug(
            "audit event appended key={} id={} action={}", key, id, event.action().value());
        // 履歴から読み戻したものと equals になるよう、保存した JSON の形で返す
        return decode(entry);
      }
      logger.debug("audit key collision, advancing timestamp key={}", key);
    }
    throw new IllegalStateException(
        "audit key collisions exhausted entityType="
            + event.entityType()
            + " entityId="
            + event.entityId());
  }

  @Override
  public List<AuditEvent> getTrail(String entityType, String entityId) {
    final String prefix = LedgerKeys.entityPrefix(entityType, entityId);
    final int cap = properties.trailScanLimit();
    final List<LedgerEntry> entries = store.scanLatest(prefix, cap);
    if (entries.size() >= cap) {
      logger.info("audit trail capped to newest records prefix={} cap={}", prefix, cap);
    }
    final List<AuditEvent> trail = decodeAll(entries);
    trail.sort(NEWEST_FIRST);
    return trail;
  }

  @Override
  public List<AuditEvent> search(AuditSearchFilter filter) {
    final int limit = searchLimit(filter.limit());
    final String prefix = searchPrefix(filter);
    final List<AuditEvent> matched = new ArrayList<>();
    for (AuditEvent event : decodeAll(store.scan(prefix, limit))) {
      if (filter.matches(event)) {
        matched.add(event);
      }
    }
    matched.sort(NEWEST_FIRST);
    final int offset = Math.max(filter.offset(), 0);
    if (offset >= matched.size()) {
      return List.of();
    }
    return List.copyOf(matched.subList(offset, matched.size()));
  }

  @Override
  public IntegrityReport verifyIntegrity(String entityType, String entityId) {
    final String prefix = LedgerKeys.entityPrefix(entityType, entityId);
    final int pageSize = properties.trailScanLimit();
    int checked = 0;
    String cursor = null;
    // 全キーを確認し終えるまでページ単位で読み進める。途中で読めなければ失敗とする
    while (true) {
      final List<String> page;
      try {
        page = store.keys(prefix, cursor, pageSize);
      } catch (RuntimeException ex) {
        logger.error("audit integrity scan failed prefix={} after={}", prefix, cursor, ex);
        return IntegrityReport.failed(entityType, entityId, checked, null, "scan failed");
      }
      for (String key : page) {
        final String problem = checkRecord(key, entityType, entityId);
        if (problem != null) {
          logger.error("audit integrity check failed key={} reason={}", key, problem);
          return IntegrityReport.failed(entityType, entityId, checked, key, problem);
        }
        checked++;
      }
      if (page.size() < pageSize) {
        return IntegrityReport.passed(entityType, entityId, checked);
      }
      cursor = page.get(page.size() - 1);
    }
  }

  @Override
  public AuditStatistics getStatistics(String entityType, Instant start, Instant end) {
    final String prefix =
        entityType == null ? LedgerKeys.ROOT_PREFIX : LedgerKeys.typePrefix(entityType);
    final int cap = properties.statisticsScanLimit();
    final List<LedgerEntry> entries = store.scan(prefix, cap);
    final AuditSearchFilter range = AuditSearchFilter.forEntityType(entityType, start, end);

    long total = 0;
    final Map<String, Long> byAction = new TreeMap<>();
    final Map<Long, Long> byActor = new TreeMap<>();
    for (AuditEvent event : decodeAll(entries)) {
      if (!range.matches(event)) {
        continue;
      }
      total++;
      byAction.merge(event.action().value(), 1L, Long::sum);
      if (event.actorUserId() != null) {
        byActor.merge(event.actorUserId(), 1L, Long::sum);
      }
    }
    final boolean truncated = entries.size() >= cap;
    if (truncated) {
      logger.warn("audit statistics scan hit cap prefix={} cap={}", prefix, cap);
    }
    return new AuditStatistics(entityType, start, end, total, byAction, byActor, truncated);
  }

  @Override
  public Optional<AuditEvent> findById(String eventId) {
    if (eventId == null || eventId.isBlank()) {
      return Optional.empty();
    }
    return decodeAll(store.scan(LedgerKeys.ROOT_PREFIX, properties.statisticsScanLimit()))
        .stream()
        .filter(event -> eventId.equals(event.id()))
        .findFirst();
  }

  @Override
  public AuditEvent logCorrection(
      String originalEventId,
      String reason,
      Long actorUserId,
      String actorName,
      RequestMetadata requestMetadata) {
    final AuditEvent original =
        findById(originalEventId).orElseThrow(() -> new AuditEventNotFoundException(originalEventId));
    final RequestMetadata meta = requestMetadata == null ? RequestMetadata.NONE : requestMetadata;
    final Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put(METADATA_REASON, reason == null ? "" : reason);
    final AuditEvent correction =
        new AuditEvent(
            null,
            original.entityType(),
            original.entityId(),
            AuditAction.CORRECTION,
            actorUserId,
            actorName,
            null,
            null,
            null,
            meta.ipAddress(),
            meta.userAgent(),
            meta.sessionId(),
            metadata,
            original.id());
    final AuditEvent stored = logEvent(correction);
    logger.info(
        "audit correction appended id={} correctsEventId={} entityType={} entityId={}",
        stored.id(),
        original.id(),
        original.entityType(),
        original.entityId());
    return stored;
  }

  @Override
  public List<AuditEvent> findCorrections(String originalEventId) {
    final AuditEvent original =
        findById(originalEventId).orElseThrow(() -> new AuditEventNotFoundException(originalEventId));
    final List<AuditEvent> corrections = new ArrayList<>();
    for (AuditEvent event : getTrail(original.entityType(), original.entityId())) {
      if (event.action() == AuditAction.CORRECTION
          && originalEventId.equals(event.correctsEventId())) {
        corrections.add(event);
      }
    }
    return corrections;
  }

  private int searchLimit(int requested) {
    if (requested <= 0) {
      return properties.searchScanLimit();
    }
    return Math.min(requested, properties.searchScanLimit());
  }

  private static String searchPrefix(AuditSearchFilter filter) {
    if (filter.entityType() != null && filter.entityId() != null) {
      return LedgerKeys.entityPrefix(filter.entityType(), filter.entityId());
    }
    if (filter.entityType() != null) {
      return LedgerKeys.typePrefix(filter.entityType());
    }
    return LedgerKeys.ROOT_PREFIX;
  }

  private String checkRecord(String key, String entityType, String entityId) {
    final Optional<LedgerEntry> entry;
    try {
      entry = store.get(key);
    } catch (RuntimeException ex) {
      logger.error("audit integrity read failed key={}", key, ex);
      return "read failed";
    }
    if (entry.isEmpty()) {
      return "missing record";
    }
    if (!entry.get().digestMatches()) {
      return "digest mismatch";
    }
    final AuditEvent event;
    try {
      event = decode(entry.get());
    } catch (IllegalStateException ex) {
      return "unreadable record";
    }
    if (event.timestamp() == null
        || !key.equals(LedgerKeys.key(entityType, entityId, EpochNanos.of(event.timestamp())))) {
      return "key mismatch";
    }
    return null;
  }

  private List<AuditEvent> decodeAll(List<LedgerEntry> entries) {
    final List<AuditEvent> events = new ArrayList<>(entries.size());
    for (LedgerEntry entry : entries) {
      try {
        events.add(decode(entry));
      } catch (IllegalStateException ex) {
        // 読めないレコードは結果から除き、verifyIntegrity で検出させる
        logger.warn("skip unreadable audit record key={}", entry.key(), ex);
      }
    }
    return events;
  }

  private String encode(AuditEvent event) {
    try {
      return objectMapper.writeValueAsString(event);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("audit event is not serializable", ex);
    }
  }

  private AuditEvent decode(LedgerEntry entry) {
    try {
      return objectMapper.readValue(entry.payloadJson(), AuditEvent.class);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("unreadable audit record key=" + entry.key(), ex);
    }
  }
}
