package com.consullo.roimonitor.events;

/**
 * Handle returned by {@link MonitorEventBus#subscribe}. Closing it removes the listener.
 *
 * @since 1.0
 */
public interface Subscription extends AutoCloseable {

  @Override
  void close();
}
