package com.consullo.roimonitor.events;

/**
 * Listener for monitor events.
 *
 * <p>Handlers run synchronously on the publishing thread, often the monitor loop. Slow work such as
 * persisting frames belongs on the subscriber's own executor.
 *
 * @param <E> event type
 * @since 1.0
 */
@FunctionalInterface
public interface MonitorEventListener<E extends MonitorEvent> {

  /**
   * Called for each published event of the subscribed type.
   *
   * @param event event
   */
  void onEvent(E event);
}
