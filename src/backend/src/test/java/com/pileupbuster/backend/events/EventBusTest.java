package com.pileupbuster.backend.events;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.pileupbuster.backend.config.PileupProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EventBusTest {
  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  private SimpleMeterRegistry registry;
  private EventBus bus;

  @BeforeEach
  void setUp() {
    PileupProperties properties = new PileupProperties();
    properties.getStream().setSubscriberBufferSize(3);
    registry = new SimpleMeterRegistry();
    bus = new EventBus(properties, registry, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void publish_deliversToEverySubscriberInPublishOrder() throws Exception {
    Subscription first = bus.subscribe();
    Subscription second = bus.subscribe();

    bus.publish(EventType.QUEUE_UPDATE, "a");
    bus.publish(EventType.CURRENT_QSO, "b");

    assertEquals(List.of(EventType.QUEUE_UPDATE, EventType.CURRENT_QSO), drainTypes(first));
    assertEquals(List.of(EventType.QUEUE_UPDATE, EventType.CURRENT_QSO), drainTypes(second));
  }

  @Test
  void publish_stampsEnvelopeWithClockTime() throws Exception {
    Subscription subscription = bus.subscribe();

    StreamEvent published = bus.publish(EventType.SPLIT_UPDATE, "up 5");

    assertEquals(NOW, published.timestamp());
    assertEquals(NOW, subscription.poll(Duration.ZERO).timestamp());
  }

  @Test
  void subscriberOnlySeesEventsAfterSubscribing() throws Exception {
    bus.publish(EventType.QUEUE_UPDATE, "before");
    Subscription late = bus.subscribe();
    bus.publish(EventType.SYSTEM_STATUS, "after");

    assertEquals(List.of(EventType.SYSTEM_STATUS), drainTypes(late));
  }

  @Test
  void overflow_dropsOldestKeepaliveBeforeDisconnecting() throws Exception {
    Subscription slow = bus.subscribe();
    bus.publish(EventType.KEEPALIVE, "k1");
    bus.publish(EventType.QUEUE_UPDATE, "q1");
    bus.publish(EventType.KEEPALIVE, "k2");

    bus.publish(EventType.CURRENT_QSO, "c1");

    assertFalse(slow.isClosed());
    assertEquals(List.of(EventType.QUEUE_UPDATE, EventType.KEEPALIVE, EventType.CURRENT_QSO), drainTypes(slow));
    assertEquals(1.0, registry.counter("pileup.events.dropped.total").count());
  }

  @Test
  void overflow_withOnlyCriticalEventsClosesSubscriber() throws Exception {
    Subscription slow = bus.subscribe();
    Subscription healthy = bus.subscribe();
    bus.publish(EventType.QUEUE_UPDATE, "q1");
    bus.publish(EventType.QUEUE_UPDATE, "q2");
    bus.publish(EventType.QUEUE_UPDATE, "q3");
    drainTypes(healthy);

    bus.publish(EventType.CURRENT_QSO, "c1");

    assertTrue(slow.isClosed());
    assertEquals(1, bus.subscriberCount());
    assertEquals(List.of(EventType.CURRENT_QSO), drainTypes(healthy));
    assertEquals(1.0, registry.counter("pileup.events.overflow_disconnects.total").count());
  }

  @Test
  void fullMailboxDropsIncomingKeepaliveInsteadOfDisconnecting() throws Exception {
    Subscription slow = bus.subscribe();
    bus.publish(EventType.QUEUE_UPDATE, "q1");
    bus.publish(EventType.QUEUE_UPDATE, "q2");
    bus.publish(EventType.QUEUE_UPDATE, "q3");

    bus.publish(EventType.KEEPALIVE, "k");

    assertFalse(slow.isClosed());
    assertEquals(3, slow.pendingCount());
  }

  @Test
  void unsubscribe_stopsDeliveryAndIsIdempotent() throws Exception {
    Subscription subscription = bus.subscribe();

    bus.unsubscribe(subscription);
    bus.unsubscribe(subscription);
    bus.publish(EventType.QUEUE_UPDATE, "q");

    assertTrue(subscription.isClosed());
    assertEquals(0, bus.subscriberCount());
    assertNull(subscription.poll(Duration.ZERO));
  }

  @Test
  void publish_prunesClosedSubscriptionWithoutCountingOverflow() {
    Subscription closed = bus.subscribe();
    Subscription open = bus.subscribe();
    closed.close();

    bus.publish(EventType.QUEUE_UPDATE, "q");

    assertEquals(1, bus.subscriberCount());
    assertEquals(1, open.pendingCount());
    assertEquals(0.0, registry.counter("pileup.events.overflow_disconnects.total").count());
  }

  private static List<EventType> drainTypes(Subscription subscription) throws InterruptedException {
    List<EventType> types = new ArrayList<>();
    StreamEvent event;
    while ((event = subscription.poll(Duration.ZERO)) != null) {
      types.add(event.type());
    }
    return types;
  }
}
