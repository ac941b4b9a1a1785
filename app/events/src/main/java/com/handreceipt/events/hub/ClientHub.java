/*
 * どこで: ライブ配信ハブ
 * 何を: ユーザごとに 1 本の接続を管理し、封筒を接続中の宛先へファンアウトする
 * なぜ: 配信側を遅い購読者でブロックさせず、接続表の変更を 1 スレッドに直列化するため
 */
package com.handreceipt.events.hub;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.handreceipt.common.event.EventKind;
import com.handreceipt.events.config.HubProperties;
import com.handreceipt.events.model.EventEnvelope;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Registry of live client connections, at most one per user.
 *
 * <p>Structural changes (register, unregister, eviction) are queued to a single control-loop
 * thread, which is the only writer of the connection map. Fan-out and membership queries run on
 * the caller's thread under the read lock and never block on a slow client: a full outbound queue
 * closes that connection on the spot and asks the loop to remove it.
 */
@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "ObjectMapper と MeterRegistry 系は Spring 管理の共有コンポーネントのため")
public class ClientHub {

  private static final Logger logger = LoggerFactory.getLogger(ClientHub.class);

  private static final String RESULT_DELIVERED = "delivered";
  private static final String RESULT_EVICTED = "evicted";

  private final RoutingPolicy routingPolicy;
  private final ObjectMapper objectMapper;
  private final HubProperties properties;
  private final HubMetrics metrics;
  private final Clock clock;

  private final BlockingQueue<HubCommand> intake;
  // 書き込みは制御ループのみ。読み取りは任意スレッドから read lock 下で行う
  private final Map<Long, ClientConnection> connections = new HashMap<>();
  private final ReentrantReadWriteLock membershipLock = new ReentrantReadWriteLock();
  private final AtomicBoolean running = new AtomicBoolean(false);
  private ExecutorService controlLoop;

  public ClientHub(
      RoutingPolicy routingPolicy,
      ObjectMapper objectMapper,
      HubProperties properties,
      HubMetrics metrics,
      Clock clock) {
    this.routingPolicy = routingPolicy;
    this.objectMapper = objectMapper;
    this.properties = properties;
    this.metrics = metrics;
    this.clock = clock;
    this.intake = new ArrayBlockingQueue<>(properties.intakeCapacity());
  }

  @PostConstruct
  public void start() {
    if (!running.compareAndSet(false, true)) {
      return;
    }
    controlLoop =
        Executors.newSingleThreadExecutor(
            new ThreadFactoryBuilder().setNameFormat("client-hub-%d").setDaemon(true).build());
    controlLoop.execute(this::runLoop);
    logger.info(
        "client hub started queueCapacity={} intakeCapacity={}",
        properties.queueCapacity(),
        properties.intakeCapacity());
  }

  @PreDestroy
  public void stop() {
    if (!running.compareAndSet(true, false)) {
      return;
    }
    if (!intake.offer(new Shutdown())) {
      controlLoop.shutdownNow();
    } else {
      controlLoop.shutdown();
    }
    try {
      if (!controlLoop.awaitTermination(
          properties.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
        logger.warn("client hub control loop did not stop in time");
        controlLoop.shutdownNow();
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      controlLoop.shutdownNow();
    }
    logger.info("client hub stopped");
  }

  /** Creates a connection with the configured queue capacity and registers it. */
  public CompletableFuture<ClientConnection> connect(long userId, Runnable onClose) {
    final ClientConnection connection =
        new ClientConnection(userId, properties.queueCapacity(), Instant.now(clock), onClose);
    return register(connection).thenApply(ignored -> connection);
  }

  /**
   * Registers the connection as the user's only live channel. An existing connection for the same
   * user is closed and replaced. Completes once the control loop has applied the change.
   */
  public CompletableFuture<Void> register(ClientConnection connection) {
    final CompletableFuture<Void> applied = new CompletableFuture<>();
    if (!submit(new Register(connection, applied))) {
      connection.close();
      applied.completeExceptionally(
          new IllegalStateException("client hub is not accepting registrations"));
    }
    return applied;
  }

  /** No-op when the connection is absent or already superseded. */
  public CompletableFuture<Void> unregister(ClientConnection connection) {
    final CompletableFuture<Void> applied = new CompletableFuture<>();
    if (!submit(new Unregister(connection, applied))) {
      connection.close();
      applied.completeExceptionally(
          new IllegalStateException("client hub is not accepting unregistrations"));
    }
    return applied;
  }

  public DeliveryReport broadcast(EventEnvelope envelope) {
    final Set<Long> recipients = routingPolicy.recipients(envelope);
    if (recipients.isEmpty()) {
      logger.debug("no live recipients kind={}", envelope.kind().wireName());
      return DeliveryReport.empty(envelope.kind());
    }
    return deliver(envelope, recipients);
  }

  public DeliveryReport sendToUser(long userId, EventEnvelope envelope) {
    return deliver(envelope, Set.of(userId));
  }

  public boolean isConnected(long userId) {
    membershipLock.readLock().lock();
    try {
      final ClientConnection connection = connections.get(userId);
      return connection != null && connection.isOpen();
    } finally {
      membershipLock.readLock().unlock();
    }
  }

  public List<Long> listConnected() {
    final List<Long> userIds = new ArrayList<>();
    membershipLock.readLock().lock();
    try {
      for (ClientConnection connection : connections.values()) {
        if (connection.isOpen()) {
          userIds.add(connection.userId());
        }
      }
    } finally {
      membershipLock.readLock().unlock();
    }
    userIds.sort(null);
    return userIds;
  }

  @VisibleForTesting
  int pendingCommands() {
    return intake.size();
  }

  private DeliveryReport deliver(EventEnvelope envelope, Set<Long> recipients) {
    final String message = encode(envelope);
    if (message == null) {
      return DeliveryReport.empty(envelope.kind());
    }
    final List<ClientConnection> targets = new ArrayList<>(recipients.size());
    membershipLock.readLock().lock();
    try {
      for (Long userId : recipients) {
        final ClientConnection connection = connections.get(userId);
        if (connection != null && connection.isOpen()) {
          targets.add(connection);
        }
      }
    } finally {
      membershipLock.readLock().unlock();
    }

    final List<Long> delivered = new ArrayList<>(targets.size());
    final List<Long> evicted = new ArrayList<>();
    for (ClientConnection connection : targets) {
      if (connection.offer(message)) {
        delivered.add(connection.userId());
      } else if (evict(connection, envelope.kind())) {
        evicted.add(connection.userId());
      }
    }
    metrics.recordDelivery(RESULT_DELIVERED, delivered.size());
    metrics.recordDelivery(RESULT_EVICTED, evicted.size());
    return new DeliveryReport(envelope.kind(), delivered, evicted);
  }

  private String encode(EventEnvelope envelope) {
    try {
      return objectMapper.writeValueAsString(envelope);
    } catch (JsonProcessingException ex) {
      logger.error("failed to encode envelope kind={}", envelope.kind().wireName(), ex);
      return null;
    }
  }

  private boolean evict(ClientConnection connection, EventKind kind) {
    // close した呼び出しだけが退去を記録する
    if (!connection.close()) {
      return false;
    }
    logger.warn(
        "slow consumer evicted userId={} connectionId={} capacity={} kind={}",
        connection.userId(),
        connection.connectionId(),
        connection.capacity(),
        kind.wireName());
    if (!submit(new Evict(connection))) {
      // 接続は閉じ済みなので isConnected は false のまま。エントリは次の register で置き換わる
      logger.warn("evict command dropped userId={}", connection.userId());
    }
    return true;
  }

  private boolean submit(HubCommand command) {
    if (!running.get()) {
      return false;
    }
    if (!intake.offer(command)) {
      metrics.recordIntakeRejected();
      logger.error(
          "client hub intake full capacity={} command={}",
          properties.intakeCapacity(),
          command.getClass().getSimpleName());
      return false;
    }
    return true;
  }

  private void runLoop() {
    while (true) {
      final HubCommand command;
      try {
        command = intake.take();
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        break;
      }
      if (command instanceof Shutdown) {
        break;
      }
      apply(command);
    }
    closeAll();
  }

  private void apply(HubCommand command) {
    try {
      if (command instanceof Register register) {
        applyRegister(register.connection());
        register.applied().complete(null);
      } else if (command instanceof Unregister unregister) {
        remove(unregister.connection());
        unregister.connection().close();
        unregister.applied().complete(null);
      } else if (command instanceof Evict evict) {
        remove(evict.connection());
      }
    } catch (RuntimeException ex) {
      logger.error("client hub command failed command={}", command.getClass().getSimpleName(), ex);
      if (command instanceof Register register) {
        register.applied().completeExceptionally(ex);
      } else if (command instanceof Unregister unregister) {
        unregister.applied().completeExceptionally(ex);
      }
    }
  }

  private void applyRegister(ClientConnection connection) {
    if (!connection.isOpen()) {
      logger.debug("skip registering closed connection userId={}", connection.userId());
      return;
    }
    final ClientConnection previous;
    final int size;
    membershipLock.writeLock().lock();
    try {
      previous = connections.put(connection.userId(), connection);
      size = connections.size();
    } finally {
      membershipLock.writeLock().unlock();
    }
    if (previous != null && previous != connection) {
      previous.close();
      logger.info(
          "client superseded userId={} previousConnectionId={} connectionId={}",
          connection.userId(),
          previous.connectionId(),
          connection.connectionId());
    } else {
      logger.info(
          "client registered userId={} connectionId={}",
          connection.userId(),
          connection.connectionId());
    }
    metrics.updateConnectionsCurrent(size);
  }

  private void remove(ClientConnection connection) {
    final boolean removed;
    final int size;
    membershipLock.writeLock().lock();
    try {
      // 置き換え済みの古い接続では新しい接続を消さない
      removed = connections.remove(connection.userId(), connection);
      size = connections.size();
    } finally {
      membershipLock.writeLock().unlock();
    }
    if (removed) {
      logger.info(
          "client unregistered userId={} connectionId={}",
          connection.userId(),
          connection.connectionId());
      metrics.updateConnectionsCurrent(size);
    }
  }

  private void closeAll() {
    final List<ClientConnection> open;
    membershipLock.writeLock().lock();
    try {
      open = new ArrayList<>(connections.values());
      connections.clear();
    } finally {
      membershipLock.writeLock().unlock();
    }
    open.forEach(ClientConnection::close);
    metrics.updateConnectionsCurrent(0);

    final List<HubCommand> abandoned = new ArrayList<>();
    intake.drainTo(abandoned);
    for (HubCommand command : abandoned) {
      if (command instanceof Register register) {
        register.connection().close();
        register.applied().completeExceptionally(new IllegalStateException("client hub stopped"));
      } else if (command instanceof Unregister unregister) {
        unregister.connection().close();
        unregister.applied().complete(null);
      }
    }
    logger.info("client hub closed connections count={}", open.size());
  }

  private interface HubCommand {}

  private record Register(ClientConnection connection, CompletableFuture<Void> applied)
      implements HubCommand {}

  private record Unregister(ClientConnection connection, CompletableFuture<Void> applied)
      implements HubCommand {}

  private record Evict(ClientConnection connection) implements HubCommand {}

  private record Shutdown() implements HubCommand {}
}
