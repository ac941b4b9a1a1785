/*
 * どこで: ライブ配信ハブ
 * 何を: 接続中ユーザ 1 人分の有界送信キューと生存フラグ
 * なぜ: 配信側をブロックさせず、溢れた購読者だけを切り離せるようにするため
 */
package com.handreceipt.events.hub;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Outbound side of one client connection. The hub only ever calls {@link #offer(String)}, which
 * never blocks; the transport writer drains the queue through {@link #poll(Duration)} or {@link
 * #drain()} and pushes the JSON text to the socket. {@code onClose} is invoked exactly once, when
 * the connection is closed by the hub (supersede, unregister, eviction, shutdown) or by the
 * transport itself.
 */
public final class ClientConnection {

  private final String connectionId;
  private final long userId;
  private final Instant connectedAt;
  private final int capacity;
  private final BlockingQueue<String> outbound;
  private final AtomicBoolean open = new AtomicBoolean(true);
  private final Runnable onClose;

  public ClientConnection(long userId, int capacity, Instant connectedAt, Runnable onClose) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive: " + capacity);
    }
    this.connectionId = UUID.randomUUID().toString();
    this.userId = userId;
    this.connectedAt = connectedAt;
    this.capacity = capacity;
    this.outbound = new ArrayBlockingQueue<>(capacity);
    this.onClose = onClose == null ? () -> {} : onClose;
  }

  public String connectionId() {
    return connectionId;
  }

  public long userId() {
    return userId;
  }

  public Instant connectedAt() {
    return connectedAt;
  }

  public int capacity() {
    return capacity;
  }

  public boolean isOpen() {
    return open.get();
  }

  public int pendingCount() {
    return outbound.size();
  }

  /** Returns false when the queue is full or the connection is already closed. */
  boolean offer(String message) {
    return open.get() && outbound.offer(message);
  }

  /** Waits up to {@code timeout}; returns null on timeout or once closed and empty. */
  public String poll(Duration timeout) throws InterruptedException {
    final String message = outbound.poll();
    if (message != null || !open.get()) {
      return message;
    }
    return outbound.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
  }

  public List<String> drain() {
    final List<String> messages = new ArrayList<>(outbound.size());
    outbound.drainTo(messages);
    return messages;
  }

  /** Returns true only for the call that actually closed the connection. */
  public boolean close() {
    if (!open.compareAndSet(true, false)) {
      return false;
    }
    onClose.run();
    return true;
  }

  @Override
  public String toString() {
    return "ClientConnection[userId=" + userId + ", connectionId=" + connectionId + "]";
  }
}
