package com.consullo.roimonitor.events;

import java.time.Instant;

/**
 * Lifecycle or change notification published by the monitor.
 *
 * <p>Events are ephemeral: the monitor publishes and forgets them. Implementations are immutable records.
 *
 * @since 1.0
 */
public interface MonitorEvent {

  /**
   * Returns the time the event was raised.
   *
   * @return timestamp
   */
  Instant timestamp();

  /**
   * Returns the id of the session that raised the event.
   *
   * @return session id
   */
  String sessionId();
}
