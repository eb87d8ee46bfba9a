package com.pileupbuster.backend.events;

import com.pileupbuster.backend.config.PileupProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.time.Clock;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * In-process typed publish/subscribe fabric between the coordinator and stream connections.
 *
 * <p>Publishing never blocks on a subscriber: each subscription has a bounded mailbox. When a
 * mailbox is full the oldest pending keepalive is dropped first; if that is not enough the
 * subscriber is closed and removed. Publishes are serialized, so every subscriber sees events in
 * global publish order.
 */
@Component
public class EventBus {
  private static final Logger log = LoggerFactory.getLogger(EventBus.class);

  private final Set<Subscription> subscriptions = ConcurrentHashMap.newKeySet();
  private final Object publishLock = new Object();
  private final AtomicLong nextId = new AtomicLong(1);
  private final int bufferSize;
  private final Clock clock;
  private final Counter publishedCounter;
  private final Counter droppedCounter;
  private final Counter overflowCounter;

  public EventBus(PileupProperties properties, MeterRegistry meterRegistry, Clock clock) {
    this.bufferSize = Math.max(1, properties.getStream().getSubscriberBufferSize());
    this.clock = clock;
    this.publishedCounter = meterRegistry.counter("pileup.events.published.total");
    this.droppedCounter = meterRegistry.counter("pileup.events.dropped.total");
    this.overflowCounter = meterRegistry.counter("pileup.events.overflow_disconnects.total");
    meterRegistry.gaugeCollectionSize("pileup.events.subscribers", Tags.empty(), subscriptions);
  }

  /**
   * Registers a new subscriber.
   *
   * @return subscription that receives every event published from now on
   */
  public Subscription subscribe() {
    Subscription subscription = new Subscription(nextId.getAndIncrement(), bufferSize);
    subscriptions.add(subscription);
    log.info("Subscriber {} added. Total subscribers: {}", subscription.id(), subscriptions.size());
    return subscription;
  }

  /**
   * Removes and closes a subscriber. Safe to call more than once.
   *
   * @param subscription subscription to release
   */
  public void unsubscribe(Subscription subscription) {
    if (subscription == null) {
      return;
    }
    boolean removed = subscriptions.remove(subscription);
    subscription.close();
    if (removed) {
      log.info("Subscriber {} removed. Total subscribers: {}", subscription.id(), subscriptions.size());
    }
  }

  /**
   * Fans an event out to every current subscriber.
   *
   * @param type event type
   * @param payload event data, may be null
   * @return the published envelope
   */
  public StreamEvent publish(EventType type, Object payload) {
    synchronized (publishLock) {
      StreamEvent event = new StreamEvent(type, payload, clock.instant());
      for (Subscription subscription : subscriptions) {
        switch (subscription.offer(event)) {
          case QUEUED -> {
          }
          case QUEUED_AFTER_DROP, DROPPED -> droppedCounter.increment();
          case OVERFLOW -> disconnectLagging(subscription, type);
          case CLOSED -> subscriptions.remove(subscription);
        }
      }
      publishedCounter.increment();
      if (type.isCritical()) {
        log.debug("Published {} to {} subscribers", type.wireName(), subscriptions.size());
      }
      return event;
    }
  }

  public int subscriberCount() {
    return subscriptions.size();
  }

  private void disconnectLagging(Subscription subscription, EventType type) {
    overflowCounter.increment();
    subscriptions.remove(subscription);
    subscription.close();
    log.warn(
        "Subscriber {} disconnected: mailbox full while delivering {}",
        subscription.id(),
        type.wireName());
  }
}
