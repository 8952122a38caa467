package com.consullo.roimonitor.monitor;

/**
 * Lifecycle state of the monitoring session.
 *
 * @since 1.0
 */
public enum MonitorState {
  /** No session has been started. */
  IDLE,
  /** The loop is ticking. */
  RUNNING,
  /** The loop is suspended; the baseline is retained. */
  PAUSED,
  /** Stopped by a caller. */
  STOPPED,
  /** Stopped because capture kept failing. */
  FAILED;

  /**
   * Returns true while a session is attached and accepts control calls.
   *
   * @return true for RUNNING and PAUSED
   */
  public boolean isActive() {
    return this == RUNNING || this == PAUSED;
  }

  public boolean isTerminal() {
    return this == STOPPED || this == FAILED;
  }
}
