package com.pileupbuster.backend.events;

import java.time.Duration;
import java.util.Iterator;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One subscriber's bounded mailbox on the {@link EventBus}.
 *
 * <p>The bus is the only producer; the owning stream connection is the only consumer.
 */
public final class Subscription {

  /** Result of handing one event to this subscription. */
  enum Delivery {
    QUEUED,
    QUEUED_AFTER_DROP,
    DROPPED,
    OVERFLOW,
    CLOSED
  }

  private final long id;
  private final LinkedBlockingDeque<StreamEvent> pending;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  Subscription(long id, int capacity) {
    this.id = id;
    this.pending = new LinkedBlockingDeque<>(Math.max(1, capacity));
  }

  public long id() {
    return id;
  }

  /**
   * Waits up to {@code timeout} for the next event.
   *
   * @return next event, or null when none arrived in time
   * @throws InterruptedException if the consumer thread is interrupted
   */
  public StreamEvent poll(Duration timeout) throws InterruptedException {
    return pending.pollFirst(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  public boolean isClosed() {
    return closed.get();
  }

  public int pendingCount() {
    return pending.size();
  }

  Delivery offer(StreamEvent event) {
    if (closed.get()) {
      return Delivery.CLOSED;
    }
    if (pending.offerLast(event)) {
      return Delivery.QUEUED;
    }
    if (!event.type().isCritical()) {
      return Delivery.DROPPED;
    }
    if (dropOldestNonCritical() && pending.offerLast(event)) {
      return Delivery.QUEUED_AFTER_DROP;
    }
    return Delivery.OVERFLOW;
  }

  boolean close() {
    if (!closed.compareAndSet(false, true)) {
      return false;
    }
    pending.clear();
    return true;
  }

  private boolean dropOldestNonCritical() {
    Iterator<StreamEvent> iterator = pending.iterator();
    while (iterator.hasNext()) {
      StreamEvent candidate = iterator.next();
      if (!candidate.type().isCritical()) {
        return pending.removeFirstOccurrence(candidate);
      }
    }
    return false;
  }

  @Override
  public String toString() {
    return "Subscription{id=" + id + ", pending=" + pending.size() + ", closed=" + closed.get() + "}";
  }
}
