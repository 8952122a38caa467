package com.consullo.roimonitor.events;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for synchronous event delivery.
 *
 * @since 1.0
 */
public class MonitorEventBusTest {

  private final MonitorEventBus bus = new MonitorEventBus();

  @Test
  @DisplayName("Should deliver events only to listeners of the matching type")
  void publish_TypedListener_ReceivesMatchingEventsOnly() {
    final List<MonitoringStopped> stopped = new ArrayList<>();
    final List<MonitorEvent> all = new ArrayList<>();
    bus.subscribe(MonitoringStopped.class, stopped::add);
    bus.subscribeAll(all::add);

    bus.publish(new RegionUpdated(Instant.now(), "s1", null, null));
    bus.publish(new MonitoringStopped(Instant.now(), "s1", "user", false));

    assertThat(stopped).hasSize(1);
    assertThat(stopped.get(0).reason()).isEqualTo("user");
    assertThat(all).hasSize(2);
  }

  @Test
  @DisplayName("A failing listener should not prevent delivery to the others")
  void publish_ListenerThrows_OthersStillCalled() {
    final List<MonitorEvent> received = new ArrayList<>();
    bus.subscribeAll(e -> {
      throw new IllegalStateException("listener failure");
    });
    bus.subscribeAll(received::add);

    bus.publish(new MonitoringStopped(Instant.now(), "s1", "user", false));

    assertThat(received).hasSize(1);
  }

  @Test
  @DisplayName("Closing a subscription removes the listener")
  void subscription_Close_Unsubscribes() {
    final List<MonitorEvent> received = new ArrayList<>();
    final Subscription subscription = bus.subscribeAll(received::add);
    assertThat(bus.listenerCount()).isEqualTo(1);

    subscription.close();
    bus.publish(new MonitoringStopped(Instant.now(), "s1", "user", false));

    assertThat(received).isEmpty();
    assertThat(bus.listenerCount()).isZero();
  }

  @Test
  @DisplayName("Listeners run on the publishing thread in publish order")
  void publish_IsSynchronousAndOrdered() {
    final List<String> order = new ArrayList<>();
    final Thread caller = Thread.currentThread();
    bus.subscribeAll(e -> {
      assertThat(Thread.currentThread()).isSameAs(caller);
      order.add(e.sessionId());
    });

    bus.publish(new MonitoringStopped(Instant.now(), "a", "r", false));
    bus.publish(new MonitoringStopped(Instant.now(), "b", "r", false));

    assertThat(order).containsExactly("a", "b");
  }
}
