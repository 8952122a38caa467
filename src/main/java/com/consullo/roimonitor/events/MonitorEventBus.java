package com.consullo.roimonitor.events;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Synchronous publish/subscribe hub between the monitor and its collaborators.
 *
 * <p>
 * Listeners subscribe to an event class; subscribing to {@link MonitorEvent}
 * itself receives everything. Publication calls each matching listener on the
 * publishing thread in subscription order. A listener that throws is logged
 * and skipped; the remaining listeners still receive the event.
 * </p>
 */
public final class MonitorEventBus {

  private static final Logger LOGGER = LoggerFactory.getLogger(MonitorEventBus.class);

  private final List<Registration<?>> registrations = new CopyOnWriteArrayList<>();

  private static final class Registration<E extends MonitorEvent> {
    final Class<E> eventType;
    final MonitorEventListener<? super E> listener;

    Registration(Class<E> eventType, MonitorEventListener<? super E> listener) {
      this.eventType = eventType;
      this.listener = listener;
    }

    void deliver(MonitorEvent event) {
      if (eventType.isInstance(event)) {
        listener.onEvent(eventType.cast(event));
      }
    }
  }

  /**
   * Registers a listener for an event type and its subtypes.
   *
   * @param eventType event class, e.g. {@code ChangeDetected.class}
   * @param listener listener
   * @param <E> event type
   * @return subscription that removes the listener when closed
   */
  public <E extends MonitorEvent> Subscription subscribe(Class<E> eventType, MonitorEventListener<? super E> listener) {
    Validate.notNull(eventType, "eventType must not be null");
    Validate.notNull(listener, "listener must not be null");
    Registration<E> registration = new Registration<>(eventType, listener);
    registrations.add(registration);
    return () -> registrations.remove(registration);
  }

  /**
   * Registers a listener for every event.
   *
   * @param listener listener
   * @return subscription
   */
  public Subscription subscribeAll(MonitorEventListener<MonitorEvent> listener) {
    return subscribe(MonitorEvent.class, listener);
  }

  /**
   * Delivers an event to every matching listener.
   *
   * @param event event
   */
  public void publish(MonitorEvent event) {
    Validate.notNull(event, "event must not be null");
    LOGGER.debug("publish: {}", event.getClass().getSimpleName());
    for (Registration<?> registration : registrations) {
      try {
        registration.deliver(event);
      } catch (RuntimeException e) {
        LOGGER.warn("Listener for {} failed on {}: {}",
            registration.eventType.getSimpleName(), event.getClass().getSimpleName(), e.getMessage(), e);
      }
    }
  }

  public int listenerCount() {
    return registrations.size();
  }
}
